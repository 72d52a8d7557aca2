package com.galois.symex;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.galois.symex.proto.Protos;

/**
 * Registry that interns symbols and wilds by name.
 *
 * <p>
 * Create one table per execution context and pass it to everything that
 * needs to make symbols.  Interning is synchronized on the table, so a
 * table may be shared between threads.  Tests should create a fresh table
 * or call {@link #reset}.
 */
public class SymbolTable extends ExpressionCreator {
    private final Map<String, Symbol> symbols = new HashMap<String, Symbol>();
    private final Map<String, Wild> wilds = new HashMap<String, Wild>();

    /** Radix given to literals created by <code>number</code>. */
    private int defaultRadix = 10;

    private static void checkName(String name) {
        if (name == null) throw new NullPointerException("name");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Symbol name must not be empty.");
        }
    }

    private static String[] splitNames(String names) {
        if (names == null) throw new NullPointerException("names");
        String trimmed = names.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("No names given.");
        }
        return trimmed.split("\\s+");
    }

    /**
     * Return the symbol with the given name, creating it on first use.
     *
     * @param name The name of the symbol.
     * @return the interned symbol
     */
    public Symbol symbol(String name) {
        checkName(name);
        synchronized (this) {
            Symbol r = symbols.get(name);
            if (r == null) {
                r = new Symbol(name);
                symbols.put(name, r);
            }
            return r;
        }
    }

    /**
     * Return symbols for each whitespace separated name in <code>names</code>.
     */
    public Symbol[] symbols(String names) {
        String[] split = splitNames(names);
        Symbol[] r = new Symbol[split.length];
        for (int i = 0; i != split.length; ++i) {
            r[i] = symbol(split[i]);
        }
        return r;
    }

    /**
     * Return the wild with the given name, creating it on first use.
     */
    public Wild wild(String name) {
        checkName(name);
        synchronized (this) {
            Wild r = wilds.get(name);
            if (r == null) {
                r = new Wild(name);
                wilds.put(name, r);
            }
            return r;
        }
    }

    /**
     * Return a new anonymous wild.  It matches anything and captures nothing.
     */
    public Wild wild() {
        return new Wild();
    }

    /**
     * Return wilds for each whitespace separated name in <code>names</code>.
     */
    public Wild[] wilds(String names) {
        String[] split = splitNames(names);
        Wild[] r = new Wild[split.length];
        for (int i = 0; i != split.length; ++i) {
            r[i] = wild(split[i]);
        }
        return r;
    }

    /**
     * Returns true if a symbol with this name has been interned.
     */
    public synchronized boolean isInterned(String name) {
        return symbols.containsKey(name);
    }

    /** Number of interned symbols. */
    public synchronized int size() {
        return symbols.size();
    }

    /**
     * Forget every interned symbol and wild.  Symbols handed out earlier
     * remain valid and still compare equal by name to new ones.
     */
    public synchronized void reset() {
        symbols.clear();
        wilds.clear();
    }

    public int getDefaultRadix() {
        return defaultRadix;
    }

    /**
     * Set the radix used to display literals created by this table.
     */
    public void setDefaultRadix(int radix) {
        if (radix < Character.MIN_RADIX || radix > Character.MAX_RADIX) {
            throw new IllegalArgumentException("Unsupported radix " + radix);
        }
        this.defaultRadix = radix;
    }

    public IntegerValue number(BigInteger val) {
        if (val == null) throw new NullPointerException("val");
        return new IntegerValue(val, defaultRadix);
    }

    public Expression applyOperator(Operator op, Expression... args) {
        if (op == null) throw new NullPointerException("op");
        return new Operation(op.head(), args);
    }

    /**
     * Build <code>head(operands...)</code>.
     */
    public Operation operation(Expression head, List<Expression> operands) {
        return new Operation(head, operands);
    }

    /**
     * Create an expression from its Protocol Buffer representation,
     * interning its symbols in this table.
     */
    public Expression fromExprRep(Protos.Expr rep) {
        switch (rep.getCode()) {
        case SymbolExpr:
            return symbol(rep.getName());
        case WildExpr:
            if (rep.getName().isEmpty()) {
                return wild();
            }
            return wild(rep.getName());
        case NumberExpr: {
            BigInteger v = new BigInteger(rep.getData().toByteArray());
            int radix = rep.hasRadix() ? rep.getRadix() : 10;
            return new IntegerValue(v, radix);
        }
        case OperationExpr: {
            if (!rep.hasHead()) {
                throw new IllegalArgumentException("Operation has no head.");
            }
            Expression head = fromExprRep(rep.getHead());
            Expression[] args = new Expression[rep.getOperandCount()];
            for (int i = 0; i != args.length; ++i) {
                args[i] = fromExprRep(rep.getOperand(i));
            }
            return new Operation(head, args);
        }
        default:
            throw new IllegalArgumentException("Unknown expression code: " + rep.getCode());
        }
    }
}
