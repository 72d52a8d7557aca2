package com.galois.symex;

import java.math.BigInteger;
import java.util.Map;

import com.galois.symex.proto.Protos;

/**
 * Base class that all symbolic expressions extend.
 *
 * <p>
 * The set of expressions is closed: an expression is a {@link Symbol}
 * (including {@link Wild}), an {@link IntegerValue} or an {@link Operation}.
 * Use {@link #kind()} to dispatch over them.  Expressions compare
 * structurally and are never modified after construction.
 */
public abstract class Expression {
    /** The kinds of expression. */
    public enum Kind { NUMBER, SYMBOL, WILD, OPERATION }

    Expression() {}

    /**
     * Return which kind of expression this is.
     * @return the kind
     */
    public abstract Kind kind();

    /**
     * Return the Protocol Buffer representation of an expression.
     * @return the representation
     */
    public abstract Protos.Expr getExprRep();

    /**
     * Evaluate this expression to an integer.
     *
     * @param env values for the symbols (or other subexpressions) that
     *   occur in the expression.
     * @return the value
     * @throws IllegalArgumentException if a symbol has no value or an
     *   operation head is not an operator.
     * @throws ArithmeticException on division by zero.
     */
    public abstract BigInteger evaluate(Map<? extends Expression, BigInteger> env);

    /**
     * Use this expression as the head of an operation.
     *
     * @param operands The operands.
     * @return the operation <code>this(operands...)</code>
     */
    public Operation apply(Expression... operands) {
        return new Operation(this, operands);
    }

    /**
     * Return the canonical simplified form of this expression.
     */
    public Expression simplify() {
        return Simplifier.simplify(this);
    }

    /**
     * Replace every subexpression that is a key in <code>mapping</code> by
     * its value.  Replacements are not searched again, and nothing is
     * simplified.
     *
     * @param mapping The replacements.
     * @return the new expression, or <code>this</code> if nothing changed.
     */
    public Expression substitute(Map<? extends Expression, ? extends Expression> mapping) {
        Expression r = mapping.get(this);
        if (r != null) {
            return r;
        }
        return substituteOperands(mapping);
    }

    /** Substitute below this node. */
    Expression substituteOperands(Map<? extends Expression, ? extends Expression> mapping) {
        return this;
    }

    /**
     * Returns true if this expression matches <code>pattern</code>.
     */
    public boolean match(Expression pattern) {
        return PatternMatcher.match(this, pattern, new Bindings());
    }

    /**
     * Match this expression against <code>pattern</code>, storing captured
     * wilds in <code>bindings</code>.
     */
    public boolean match(Expression pattern, Bindings bindings) {
        return PatternMatcher.match(this, pattern, bindings);
    }
}
