package com.galois.symex;

import java.math.BigInteger;
import java.util.Map;

import com.google.protobuf.ByteString;

import com.galois.symex.proto.Protos;

/**
 * An arbitrary-precision integer literal.
 *
 * <p>
 * The radix only controls how the value is printed; it is ignored by
 * {@link #equals} and {@link #hashCode}.
 */
public final class IntegerValue extends Expression {
    public static final IntegerValue ZERO = new IntegerValue(BigInteger.ZERO);
    public static final IntegerValue ONE = new IntegerValue(BigInteger.ONE);
    /** The value with every bit set. */
    public static final IntegerValue MINUS_ONE = new IntegerValue(BigInteger.ONE.negate());

    private final BigInteger v;
    private final int radix;

    public IntegerValue(long i) {
        this(BigInteger.valueOf(i));
    }

    public IntegerValue(BigInteger i) {
        this(i, 10);
    }

    public IntegerValue(BigInteger i, int radix) {
        if (i == null) throw new NullPointerException("i");
        if (radix < Character.MIN_RADIX || radix > Character.MAX_RADIX) {
            throw new IllegalArgumentException("Unsupported radix " + radix);
        }
        this.v = i;
        this.radix = radix;
    }

    public static IntegerValue of(long i) {
        return of(BigInteger.valueOf(i));
    }

    public static IntegerValue of(BigInteger i) {
        if (i.signum() == 0) return ZERO;
        if (i.equals(BigInteger.ONE)) return ONE;
        return new IntegerValue(i);
    }

    public BigInteger getValue() {
        return v;
    }

    public int getRadix() {
        return radix;
    }

    /**
     * Return the same value printed in another radix.
     */
    public IntegerValue withRadix(int r) {
        if (r == radix) return this;
        return new IntegerValue(v, r);
    }

    public Kind kind() {
        return Kind.NUMBER;
    }

    public Protos.Expr getExprRep() {
        return
            Protos.Expr.newBuilder()
            .setCode(Protos.ExprCode.NumberExpr)
            .setData(ByteString.copyFrom(v.toByteArray()))
            .setRadix(radix)
            .build();
    }

    public BigInteger evaluate(Map<? extends Expression, BigInteger> env) {
        return v;
    }

    public boolean equals(Object o) {
        if (!(o instanceof IntegerValue)) return false;
        return v.equals(((IntegerValue) o).v);
    }

    /**
     * Returns hash code of integer.
     */
    public int hashCode() {
        return v.hashCode();
    }

    public String toString() {
        switch (radix) {
        case 10:
            return v.toString();
        case 16:
            return (v.signum() < 0 ? "-0x" : "0x") + v.abs().toString(16);
        case 8:
            if (v.signum() == 0) return "0";
            return (v.signum() < 0 ? "-0" : "0") + v.abs().toString(8);
        case 2:
            return (v.signum() < 0 ? "-0b" : "0b") + v.abs().toString(2);
        default:
            return v.toString(radix) + "_" + radix;
        }
    }
}
