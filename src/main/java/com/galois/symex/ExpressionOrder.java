package com.galois.symex;

import java.util.Comparator;

/**
 * Total order over expressions used to sort the operands of commutative
 * operators.
 *
 * Numbers come first (by value), then symbols and wilds (by name), then
 * operations (by head, arity and operands).  The order is consistent with
 * <code>equals</code>.
 */
public final class ExpressionOrder implements Comparator<Expression> {
    public static final ExpressionOrder INSTANCE = new ExpressionOrder();

    private ExpressionOrder() {}

    private static int rank(Expression e) {
        switch (e.kind()) {
        case NUMBER:    return 0;
        case SYMBOL:    return 1;
        case WILD:      return 2;
        case OPERATION: return 3;
        default:
            throw new AssertionError("Unknown kind " + e.kind());
        }
    }

    public int compare(Expression x, Expression y) {
        if (x == y) return 0;
        int c = Integer.compare(rank(x), rank(y));
        if (c != 0) return c;

        switch (x.kind()) {
        case NUMBER:
            return ((IntegerValue) x).getValue().compareTo(((IntegerValue) y).getValue());
        case SYMBOL:
            return ((Symbol) x).getName().compareTo(((Symbol) y).getName());
        case WILD: {
            Wild wx = (Wild) x;
            Wild wy = (Wild) y;
            c = Boolean.compare(wx.isAnonymous(), wy.isAnonymous());
            if (c != 0) return c;
            if (wx.isAnonymous()) {
                return Long.compare(wx.getSerial(), wy.getSerial());
            }
            return wx.getName().compareTo(wy.getName());
        }
        case OPERATION: {
            Operation ox = (Operation) x;
            Operation oy = (Operation) y;
            c = compare(ox.getHead(), oy.getHead());
            if (c != 0) return c;
            c = Integer.compare(ox.getArity(), oy.getArity());
            if (c != 0) return c;
            for (int i = 0; i != ox.getArity(); ++i) {
                c = compare(ox.getOperand(i), oy.getOperand(i));
                if (c != 0) return c;
            }
            return 0;
        }
        default:
            throw new AssertionError("Unknown kind " + x.kind());
        }
    }
}
