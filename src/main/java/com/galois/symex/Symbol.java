package com.galois.symex;

import java.math.BigInteger;
import java.util.Map;

import com.galois.symex.proto.Protos;

/**
 * A named atomic value.
 *
 * <p>
 * Symbols are obtained from a {@link SymbolTable}, which returns the same
 * object for the same name.  Equality is by name, so two symbols with the
 * same name are equal even if they were interned by different tables.
 */
public class Symbol extends Expression {
    private final String name;

    /** Package level method for creating a symbol; see {@link SymbolTable#symbol}. */
    Symbol(String name) {
        if (name == null) throw new NullPointerException("name");
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public Kind kind() {
        return Kind.SYMBOL;
    }

    public Protos.Expr getExprRep() {
        return
            Protos.Expr.newBuilder()
            .setCode(Protos.ExprCode.SymbolExpr)
            .setName(name)
            .build();
    }

    public BigInteger evaluate(Map<? extends Expression, BigInteger> env) {
        BigInteger v = env.get(this);
        if (v == null) {
            throw new IllegalArgumentException("No value given for symbol " + name);
        }
        return v;
    }

    public boolean equals(Object o) {
        if (!(o instanceof Symbol)) return false;
        Symbol r = (Symbol) o;
        return kind() == r.kind() && name.equals(r.name);
    }

    public int hashCode() {
        return name.hashCode();
    }

    public String toString() {
        return name;
    }
}
