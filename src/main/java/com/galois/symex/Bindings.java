package com.galois.symex;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The subexpressions captured by wilds during a successful match, keyed by
 * wild name.
 */
public final class Bindings {
    private final Map<String, Expression> values = new LinkedHashMap<String, Expression>();

    /**
     * Return the expression captured by the named wild.
     *
     * @throws UnboundWildException if the wild was not captured.
     */
    public Expression get(String name) {
        Expression r = values.get(name);
        if (r == null) {
            throw new UnboundWildException(name);
        }
        return r;
    }

    public Expression get(Wild w) {
        return get(w.getName());
    }

    /** Return the captured expression or <code>null</code>. */
    Expression lookup(String name) {
        return values.get(name);
    }

    public boolean isBound(String name) {
        return values.containsKey(name);
    }

    /**
     * Bind or rebind a name.  Handlers use this to replace an operand by
     * a resolved form before passing the bindings on.
     */
    public void put(String name, Expression value) {
        if (name == null) throw new NullPointerException("name");
        if (value == null) throw new NullPointerException("value");
        values.put(name, value);
    }

    public void clear() {
        values.clear();
    }

    public int size() {
        return values.size();
    }

    public Map<String, Expression> asMap() {
        return Collections.unmodifiableMap(values);
    }

    public String toString() {
        return values.toString();
    }
}
