package com.galois.symex.graph;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Set;

import com.galois.symex.Symbol;

/**
 * Reachability queries over directed graphs.
 */
public final class GraphAlgorithms {
    private GraphAlgorithms() {}

    /**
     * Returns true if there is a directed path from <code>a</code> to
     * <code>b</code>.  Every node reaches itself.
     */
    public static boolean pathQ(DirectedGraph g, Symbol a, Symbol b) {
        if (a.equals(b)) {
            return true;
        }
        if (!g.containsNode(a) || !g.containsNode(b)) {
            return false;
        }
        return reachableFrom(g, a).contains(b);
    }

    /**
     * Return every node reachable from <code>start</code>, including
     * <code>start</code>, in breadth-first order.
     */
    public static Set<Symbol> reachableFrom(DirectedGraph g, Symbol start) {
        Set<Symbol> visited = new LinkedHashSet<Symbol>();
        if (!g.containsNode(start)) {
            return visited;
        }
        Deque<Symbol> queue = new ArrayDeque<Symbol>();
        visited.add(start);
        queue.add(start);
        while (!queue.isEmpty()) {
            Symbol n = queue.removeFirst();
            for (Edge e : g.outgoing(n)) {
                if (visited.add(e.getTarget())) {
                    queue.addLast(e.getTarget());
                }
            }
        }
        return visited;
    }
}
