package com.galois.symex;

/**
 * Structural matching of expressions against patterns containing wilds.
 */
public final class PatternMatcher {
    private PatternMatcher() {}

    /**
     * Match <code>expr</code> against <code>pattern</code>.
     *
     * <p>
     * The bindings are cleared first.  One set of bindings is used for the
     * whole pattern, so a wild that occurs several times, at any depth, must
     * match equal subexpressions each time.  On failure the bindings are
     * left empty.
     *
     * @return true if the expression matches.
     */
    public static boolean match(Expression expr, Expression pattern, Bindings bindings) {
        if (expr == null) throw new NullPointerException("expr");
        if (pattern == null) throw new NullPointerException("pattern");
        if (bindings == null) throw new NullPointerException("bindings");

        bindings.clear();
        if (matchInto(expr, pattern, bindings)) {
            return true;
        }
        bindings.clear();
        return false;
    }

    private static boolean matchInto(Expression expr, Expression pattern, Bindings bindings) {
        switch (pattern.kind()) {
        case WILD: {
            Wild w = (Wild) pattern;
            if (w.isAnonymous()) {
                return true;
            }
            Expression bound = bindings.lookup(w.getName());
            if (bound == null) {
                bindings.put(w.getName(), expr);
                return true;
            }
            return bound.equals(expr);
        }
        case NUMBER:
        case SYMBOL:
            return pattern.equals(expr);
        case OPERATION: {
            if (expr.kind() != Expression.Kind.OPERATION) {
                return false;
            }
            Operation p = (Operation) pattern;
            Operation e = (Operation) expr;
            if (p.getArity() != e.getArity()) {
                return false;
            }
            if (!matchInto(e.getHead(), p.getHead(), bindings)) {
                return false;
            }
            for (int i = 0; i != p.getArity(); ++i) {
                if (!matchInto(e.getOperand(i), p.getOperand(i), bindings)) {
                    return false;
                }
            }
            return true;
        }
        default:
            throw new AssertionError("Unknown kind " + pattern.kind());
        }
    }
}
