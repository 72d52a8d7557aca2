package com.galois.symex.graph;

import java.util.Random;

import com.galois.symex.Symbol;
import com.galois.symex.SymbolTable;

/**
 * Generators for test graphs.
 */
public final class GraphGeneration {
    private GraphGeneration() {}

    /**
     * Build a random graph over the nodes <code>node_0 ... node_(n-1)</code>
     * in which each edge between distinct nodes is present with probability
     * <code>p</code>.
     */
    public static DirectedGraph randomGraph(SymbolTable t, int n, double p, Random random) {
        if (n < 0) {
            throw new IllegalArgumentException("Negative node count.");
        }
        if (!(0.0 <= p && p <= 1.0)) {
            throw new IllegalArgumentException("Edge probability must be between 0 and 1.");
        }

        Symbol[] nodes = new Symbol[n];
        DirectedGraph g = new DirectedGraph();
        for (int i = 0; i != n; ++i) {
            nodes[i] = t.symbol("node_" + i);
            g.addNode(nodes[i]);
        }
        for (int i = 0; i != n; ++i) {
            for (int j = 0; j != n; ++j) {
                if (i != j && random.nextDouble() < p) {
                    g.connect(nodes[i], nodes[j]);
                }
            }
        }
        return g;
    }
}
