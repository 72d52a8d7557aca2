package com.galois.symex;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

/**
 * The arithmetic and bitwise operators understood by the simplifier.
 *
 * <p>
 * An operator appears in an expression as an {@link Operation} whose head
 * is the operator's symbol, e.g. <code>+(a, b)</code>.  Applied to more than
 * two operands, an operator folds left to right.
 */
public enum Operator {
    ADD("+", true),
    SUB("-", false),
    MUL("*", true),
    /**
     * Integer division rounding toward zero, as x86 <code>IDIV</code> does.
     * For operands of opposite sign this differs from floor division:
     * <code>-7 / 2</code> is <code>-3</code>, not <code>-4</code>.
     */
    DIV("/", false),
    AND("&", true),
    OR("|", true),
    XOR("^", true);

    private static final Map<String, Operator> byName = new HashMap<String, Operator>();

    static {
        for (Operator op : values()) {
            byName.put(op.head.getName(), op);
        }
    }

    private final Symbol head;
    private final boolean commutative;

    private Operator(String name, boolean commutative) {
        this.head = new Symbol(name);
        this.commutative = commutative;
    }

    /**
     * Return the symbol used as the head of operations with this operator.
     */
    public Symbol head() {
        return head;
    }

    /**
     * Returns true if the operator is commutative and associative, so its
     * operands may be flattened and reordered.
     */
    public boolean isCommutative() {
        return commutative;
    }

    /**
     * Return the operator named by <code>head</code>, or <code>null</code>
     * if the head is not an operator symbol.
     */
    public static Operator forHead(Expression head) {
        if (head.kind() != Expression.Kind.SYMBOL) return null;
        return byName.get(((Symbol) head).getName());
    }

    /**
     * Apply the operator to two integers.
     *
     * @throws ArithmeticException if dividing by zero.
     */
    public BigInteger fold(BigInteger x, BigInteger y) {
        switch (this) {
        case ADD: return x.add(y);
        case SUB: return x.subtract(y);
        case MUL: return x.multiply(y);
        case DIV: return x.divide(y);
        case AND: return x.and(y);
        case OR:  return x.or(y);
        case XOR: return x.xor(y);
        default:
            throw new AssertionError("Unknown operator " + this);
        }
    }

    public String toString() {
        return head.getName();
    }
}
