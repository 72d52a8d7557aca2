package com.galois.symex;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rewrites expressions into a canonical simplified form.
 *
 * <p>
 * Operands are simplified first.  Operations on {@link Operator}s are then
 * rewritten as follows:
 * <ul>
 * <li>nested uses of a commutative operator are flattened, and the operands
 *     are sorted by {@link ExpressionOrder};</li>
 * <li>literal operands are folded into one literal;</li>
 * <li>identities and annihilators are applied (<code>x+0</code>,
 *     <code>x*1</code>, <code>x*0</code>, <code>x&amp;0</code>,
 *     <code>x&amp;-1</code>, <code>x|0</code>, <code>x|-1</code>,
 *     <code>x^0</code>);</li>
 * <li><code>&amp;</code> and <code>|</code> drop duplicate operands, and
 *     <code>^</code> cancels them in pairs;</li>
 * <li><code>a - b</code> becomes <code>a + -1*b</code>, and <code>+</code>
 *     collects like terms, so <code>x - x</code> is <code>0</code>.</li>
 * </ul>
 * Literals are arbitrary precision; no word width is assumed.  Division by
 * a literal zero is left alone.  The result has the same value as the input
 * and simplifying it again returns an equal expression.
 */
public final class Simplifier {
    private Simplifier() {}

    public static Expression simplify(Expression e) {
        if (e == null) throw new NullPointerException("e");
        if (e.kind() != Expression.Kind.OPERATION) {
            return e;
        }

        Operation op = (Operation) e;
        Expression head = simplify(op.getHead());
        boolean changed = head != op.getHead();
        List<Expression> args = new ArrayList<Expression>(op.getArity());
        for (Expression a : op.getOperands()) {
            Expression s = simplify(a);
            changed |= s != a;
            args.add(s);
        }

        Operator oper = Operator.forHead(head);
        if (oper == null || args.isEmpty()) {
            return changed ? new Operation(head, args) : op;
        }
        if (args.size() == 1) {
            return args.get(0);
        }

        switch (oper) {
        case ADD: return simplifyAdd(args);
        case SUB: return simplifySub(args);
        case MUL: return simplifyMul(args);
        case DIV: return simplifyDiv(args);
        case AND: return simplifyAnd(args);
        case OR:  return simplifyOr(args);
        case XOR: return simplifyXor(args);
        default:
            throw new AssertionError("Unknown operator " + oper);
        }
    }

    private static boolean isOperation(Expression e, Operator op) {
        return e.kind() == Expression.Kind.OPERATION
            && ((Operation) e).getOperator() == op;
    }

    private static boolean isNumber(Expression e) {
        return e.kind() == Expression.Kind.NUMBER;
    }

    private static BigInteger valueOf(Expression e) {
        return ((IntegerValue) e).getValue();
    }

    /** Splice operands of nested <code>op</code> operations into one list. */
    private static List<Expression> flatten(Operator op, List<Expression> args) {
        List<Expression> r = new ArrayList<Expression>(args.size());
        for (Expression a : args) {
            if (isOperation(a, op)) {
                r.addAll(((Operation) a).getOperands());
            } else {
                r.add(a);
            }
        }
        return r;
    }

    /** Sort operands and build <code>op(operands)</code>. */
    private static Expression build(Operator op, List<Expression> operands) {
        if (operands.size() == 1) {
            return operands.get(0);
        }
        Collections.sort(operands, ExpressionOrder.INSTANCE);
        return new Operation(op.head(), operands);
    }

    /** Keep the radix of the literal an operand was written with. */
    private static IntegerValue literal(BigInteger v, int radix) {
        return radix == 10 ? IntegerValue.of(v) : new IntegerValue(v, radix);
    }

    private static int radixOf(List<Expression> args) {
        for (Expression a : args) {
            if (isNumber(a)) return ((IntegerValue) a).getRadix();
        }
        return 10;
    }

    private static List<Expression> sortedDistinct(List<Expression> l) {
        Collections.sort(l, ExpressionOrder.INSTANCE);
        List<Expression> r = new ArrayList<Expression>(l.size());
        for (Expression e : l) {
            if (r.isEmpty() || !r.get(r.size() - 1).equals(e)) {
                r.add(e);
            }
        }
        return r;
    }

    // Addition {{{1

    private static Expression simplifyAdd(List<Expression> args) {
        List<Expression> terms = flatten(Operator.ADD, args);
        int radix = radixOf(terms);

        BigInteger constant = BigInteger.ZERO;
        Map<Expression, BigInteger> coefficients = new LinkedHashMap<Expression, BigInteger>();
        for (Expression t : terms) {
            if (isNumber(t)) {
                constant = constant.add(valueOf(t));
                continue;
            }
            BigInteger c = BigInteger.ONE;
            Expression base = t;
            if (isOperation(t, Operator.MUL) && isNumber(((Operation) t).getOperand(0))) {
                Operation m = (Operation) t;
                c = valueOf(m.getOperand(0));
                List<Expression> rest = m.getOperands().subList(1, m.getArity());
                base = rest.size() == 1 ? rest.get(0) : new Operation(Operator.MUL.head(), rest);
            }
            BigInteger prev = coefficients.get(base);
            coefficients.put(base, prev == null ? c : prev.add(c));
        }

        List<Expression> out = new ArrayList<Expression>();
        boolean nested = false;
        for (Map.Entry<Expression, BigInteger> entry : coefficients.entrySet()) {
            BigInteger c = entry.getValue();
            if (c.signum() == 0) continue;
            Expression t = scale(c, entry.getKey());
            nested |= isOperation(t, Operator.ADD);
            out.add(t);
        }

        if (out.isEmpty()) {
            return literal(constant, radix);
        }
        if (constant.signum() != 0) {
            out.add(literal(constant, radix));
        }
        // A coefficient of one can expose a sum that was under a product.
        if (nested) {
            return simplifyAdd(out);
        }
        return build(Operator.ADD, out);
    }

    /** Build the canonical product <code>c * base</code>. */
    private static Expression scale(BigInteger c, Expression base) {
        if (c.equals(BigInteger.ONE)) {
            return base;
        }
        List<Expression> factors = new ArrayList<Expression>();
        factors.add(IntegerValue.of(c));
        if (isOperation(base, Operator.MUL)) {
            factors.addAll(((Operation) base).getOperands());
        } else {
            factors.add(base);
        }
        return new Operation(Operator.MUL.head(), factors);
    }

    private static void addNegated(List<Expression> terms, Expression e) {
        if (isOperation(e, Operator.ADD)) {
            for (Expression t : ((Operation) e).getOperands()) {
                addNegated(terms, t);
            }
        } else {
            List<Expression> factors = new ArrayList<Expression>(2);
            factors.add(IntegerValue.MINUS_ONE);
            factors.add(e);
            terms.add(simplifyMul(factors));
        }
    }

    private static Expression simplifySub(List<Expression> args) {
        List<Expression> terms = new ArrayList<Expression>();
        terms.add(args.get(0));
        for (Expression a : args.subList(1, args.size())) {
            addNegated(terms, a);
        }
        Expression r = simplifyAdd(terms);
        if (isNumber(r) && isNumber(args.get(0))) {
            return literal(valueOf(r), ((IntegerValue) args.get(0)).getRadix());
        }
        return r;
    }

    // Multiplication and division {{{1

    private static Expression simplifyMul(List<Expression> args) {
        List<Expression> factors = new ArrayList<Expression>();
        int radix = radixOf(args);
        BigInteger product = BigInteger.ONE;
        for (Expression f : flatten(Operator.MUL, args)) {
            if (isNumber(f)) {
                product = product.multiply(valueOf(f));
            } else {
                factors.add(f);
            }
        }

        if (product.signum() == 0 || factors.isEmpty()) {
            return literal(product, radix);
        }
        if (!product.equals(BigInteger.ONE)) {
            factors.add(literal(product, radix));
        }
        return build(Operator.MUL, factors);
    }

    private static Expression simplifyDiv(List<Expression> args) {
        Expression dividend = args.get(0);
        List<Expression> divisors = new ArrayList<Expression>();
        for (Expression d : args.subList(1, args.size())) {
            if (d.equals(IntegerValue.ONE)) {
                continue;
            }
            if (divisors.isEmpty() && isNumber(dividend) && isNumber(d) && valueOf(d).signum() != 0) {
                dividend = literal(Operator.DIV.fold(valueOf(dividend), valueOf(d)),
                                   ((IntegerValue) dividend).getRadix());
                continue;
            }
            divisors.add(d);
        }

        if (divisors.isEmpty()) {
            return dividend;
        }
        List<Expression> operands = new ArrayList<Expression>(divisors.size() + 1);
        operands.add(dividend);
        operands.addAll(divisors);
        return new Operation(Operator.DIV.head(), operands);
    }

    // Bitwise operators {{{1

    private static Expression simplifyAnd(List<Expression> args) {
        List<Expression> factors = new ArrayList<Expression>();
        int radix = radixOf(args);
        BigInteger mask = BigInteger.ONE.negate();
        for (Expression f : flatten(Operator.AND, args)) {
            if (isNumber(f)) {
                mask = mask.and(valueOf(f));
            } else {
                factors.add(f);
            }
        }

        if (mask.signum() == 0 || factors.isEmpty()) {
            return literal(mask, radix);
        }
        factors = sortedDistinct(factors);
        if (!mask.equals(BigInteger.ONE.negate())) {
            factors.add(literal(mask, radix));
        }
        return build(Operator.AND, factors);
    }

    private static Expression simplifyOr(List<Expression> args) {
        List<Expression> factors = new ArrayList<Expression>();
        int radix = radixOf(args);
        BigInteger bits = BigInteger.ZERO;
        for (Expression f : flatten(Operator.OR, args)) {
            if (isNumber(f)) {
                bits = bits.or(valueOf(f));
            } else {
                factors.add(f);
            }
        }

        if (bits.equals(BigInteger.ONE.negate()) || factors.isEmpty()) {
            return literal(bits, radix);
        }
        factors = sortedDistinct(factors);
        if (bits.signum() != 0) {
            factors.add(literal(bits, radix));
        }
        return build(Operator.OR, factors);
    }

    private static Expression simplifyXor(List<Expression> args) {
        List<Expression> factors = new ArrayList<Expression>();
        int radix = radixOf(args);
        BigInteger bits = BigInteger.ZERO;
        for (Expression f : flatten(Operator.XOR, args)) {
            if (isNumber(f)) {
                bits = bits.xor(valueOf(f));
            } else {
                factors.add(f);
            }
        }

        // Equal operands cancel in pairs.
        Collections.sort(factors, ExpressionOrder.INSTANCE);
        List<Expression> odd = new ArrayList<Expression>();
        int i = 0;
        while (i < factors.size()) {
            int j = i;
            while (j < factors.size() && factors.get(j).equals(factors.get(i))) {
                ++j;
            }
            if ((j - i) % 2 == 1) {
                odd.add(factors.get(i));
            }
            i = j;
        }

        if (odd.isEmpty()) {
            return literal(bits, radix);
        }
        if (bits.signum() != 0) {
            odd.add(literal(bits, radix));
        }
        return build(Operator.XOR, odd);
    }
}
