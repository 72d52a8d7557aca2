package com.galois.symex;

import java.math.BigInteger;

/**
 * Provides the arithmetic and bitwise operator constructors.
 *
 * It requires subclasses to implement <code>applyOperator</code> and
 * <code>number</code>, and then they inherit the operator constructors.
 * When every operand is an {@link IntegerValue} the result is computed;
 * otherwise an operation node is built and nothing is simplified.
 */
public abstract class ExpressionCreator {
    /**
     * Build the operation <code>op(args...)</code> without computing it.
     */
    public abstract Expression applyOperator(Operator op, Expression... args);

    /** Create a literal for <code>val</code>. */
    public abstract IntegerValue number(BigInteger val);

    public IntegerValue number(long val) {
        return number(BigInteger.valueOf(val));
    }

    private Expression binary(Operator op, Expression x, Expression y) {
        if (x == null) throw new NullPointerException("x");
        if (y == null) throw new NullPointerException("y");
        if (x.kind() == Expression.Kind.NUMBER && y.kind() == Expression.Kind.NUMBER) {
            BigInteger yv = ((IntegerValue) y).getValue();
            // Division by zero stays symbolic.
            if (!(op == Operator.DIV && yv.signum() == 0)) {
                return number(op.fold(((IntegerValue) x).getValue(), yv));
            }
        }
        return applyOperator(op, x, y);
    }

    /** Add two values. */
    public Expression add(Expression x, Expression y) {
        return binary(Operator.ADD, x, y);
    }

    public Expression add(Expression x, long y) {
        return add(x, number(y));
    }

    /** Subtract one value from another. */
    public Expression sub(Expression x, Expression y) {
        return binary(Operator.SUB, x, y);
    }

    public Expression sub(Expression x, long y) {
        return sub(x, number(y));
    }

    /** Multiply two values. */
    public Expression mul(Expression x, Expression y) {
        return binary(Operator.MUL, x, y);
    }

    public Expression mul(Expression x, long y) {
        return mul(x, number(y));
    }

    /** Divide <code>x</code> by <code>y</code>, rounding toward zero. */
    public Expression div(Expression x, Expression y) {
        return binary(Operator.DIV, x, y);
    }

    public Expression div(Expression x, long y) {
        return div(x, number(y));
    }

    /** Bitwise and. */
    public Expression and(Expression x, Expression y) {
        return binary(Operator.AND, x, y);
    }

    public Expression and(Expression x, long y) {
        return and(x, number(y));
    }

    /** Bitwise inclusive-or. */
    public Expression or(Expression x, Expression y) {
        return binary(Operator.OR, x, y);
    }

    public Expression or(Expression x, long y) {
        return or(x, number(y));
    }

    /** Bitwise exclusive-or. */
    public Expression xor(Expression x, Expression y) {
        return binary(Operator.XOR, x, y);
    }

    public Expression xor(Expression x, long y) {
        return xor(x, number(y));
    }
}
