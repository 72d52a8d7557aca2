package com.galois.symex.graph;

import java.util.Arrays;

import com.galois.symex.Expression;
import com.galois.symex.Symbol;

/**
 * A directed edge with an optional label.
 */
public final class Edge {
    private final Symbol source;
    private final Symbol target;
    private final Expression label;

    Edge(Symbol source, Symbol target, Expression label) {
        this.source = source;
        this.target = target;
        this.label = label;
    }

    public Symbol getSource() {
        return source;
    }

    public Symbol getTarget() {
        return target;
    }

    /**
     * Return the label, or <code>null</code> for an unlabelled edge.
     */
    public Expression getLabel() {
        return label;
    }

    public boolean equals(Object o) {
        if (!(o instanceof Edge)) return false;
        Edge r = (Edge) o;
        return source.equals(r.source)
            && target.equals(r.target)
            && (label == null ? r.label == null : label.equals(r.label));
    }

    public int hashCode() {
        return Arrays.hashCode(new Object[] { source, target, label });
    }

    public String toString() {
        if (label == null) {
            return source + " -> " + target;
        }
        return source + " -[" + label + "]-> " + target;
    }
}
