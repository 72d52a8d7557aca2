package com.galois.symex;

import java.math.BigInteger;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import com.galois.symex.proto.Protos;

/**
 * A pattern variable that matches any single subexpression.
 *
 * <p>
 * A named wild captures what it matches, and every occurrence of it in one
 * pattern must match equal subexpressions.  An anonymous wild matches
 * anything and captures nothing.
 */
public final class Wild extends Symbol {
    /** Source of serial numbers for anonymous wilds. */
    private static final AtomicLong nextSerial = new AtomicLong(1);

    private final boolean anonymous;
    private final long serial;

    Wild(String name) {
        super(name);
        this.anonymous = false;
        this.serial = 0;
    }

    /** Create an anonymous wild. */
    Wild() {
        super("");
        this.anonymous = true;
        this.serial = nextSerial.getAndIncrement();
    }

    public boolean isAnonymous() {
        return anonymous;
    }

    /**
     * Creation order of an anonymous wild; distinct anonymous wilds have
     * distinct serials.  Named wilds return 0.
     */
    long getSerial() {
        return serial;
    }

    public Kind kind() {
        return Kind.WILD;
    }

    public Protos.Expr getExprRep() {
        return
            Protos.Expr.newBuilder()
            .setCode(Protos.ExprCode.WildExpr)
            .setName(getName())
            .build();
    }

    public BigInteger evaluate(Map<? extends Expression, BigInteger> env) {
        throw new IllegalArgumentException("Cannot evaluate pattern variable " + this);
    }

    public boolean equals(Object o) {
        if (anonymous) return this == o;
        if (!(o instanceof Wild)) return false;
        Wild r = (Wild) o;
        return !r.anonymous && getName().equals(r.getName());
    }

    public int hashCode() {
        return anonymous ? Long.hashCode(serial) : 31 * getName().hashCode() + 7;
    }

    public String toString() {
        return anonymous ? "_" : "?" + getName();
    }
}
