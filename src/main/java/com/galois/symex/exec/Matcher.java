package com.galois.symex.exec;

import com.galois.symex.Bindings;
import com.galois.symex.Expression;
import com.galois.symex.PatternMatcher;

/**
 * Decides whether a handler applies to an instruction.
 *
 * <p>
 * A matcher is either a pattern, matched structurally, or a predicate that
 * may run arbitrary code.  Both fill in the bindings passed to the handler.
 */
public final class Matcher {
    public enum Kind { PATTERN, PREDICATE }

    /**
     * Custom matching logic.
     */
    public interface Predicate {
        /**
         * @param instruction the instruction being dispatched.
         * @param bindings empty bindings to fill in for the handler.
         * @return true if the handler applies.
         */
        boolean test(Expression instruction, Bindings bindings);
    }

    private final Kind kind;
    private final Expression pattern;
    private final Predicate predicate;

    private Matcher(Kind kind, Expression pattern, Predicate predicate) {
        this.kind = kind;
        this.pattern = pattern;
        this.predicate = predicate;
    }

    public static Matcher pattern(Expression pattern) {
        if (pattern == null) throw new NullPointerException("pattern");
        return new Matcher(Kind.PATTERN, pattern, null);
    }

    public static Matcher predicate(Predicate predicate) {
        if (predicate == null) throw new NullPointerException("predicate");
        return new Matcher(Kind.PREDICATE, null, predicate);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Return the pattern of a pattern matcher.
     */
    public Expression getPattern() {
        if (kind != Kind.PATTERN) {
            throw new IllegalStateException("Predicate matchers have no pattern.");
        }
        return pattern;
    }

    /**
     * Test the instruction, clearing and then filling <code>bindings</code>.
     */
    public boolean matches(Expression instruction, Bindings bindings) {
        switch (kind) {
        case PATTERN:
            return PatternMatcher.match(instruction, pattern, bindings);
        case PREDICATE:
            bindings.clear();
            return predicate.test(instruction, bindings);
        default:
            throw new AssertionError("Unknown matcher kind " + kind);
        }
    }

    public String toString() {
        return kind == Kind.PATTERN ? pattern.toString() : "<predicate>";
    }
}
