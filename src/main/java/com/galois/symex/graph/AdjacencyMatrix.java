package com.galois.symex.graph;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.galois.symex.Symbol;

/**
 * A 0/1 matrix whose cell <code>[i][j]</code> is 1 iff there is at least
 * one edge from node <code>i</code> to node <code>j</code>.
 */
public final class AdjacencyMatrix {
    private final Map<Symbol, Integer> index;
    private final List<Symbol> nodes;
    private final int[][] cells;

    AdjacencyMatrix(Map<Symbol, Integer> index, List<Symbol> nodes, int[][] cells) {
        this.index = Collections.unmodifiableMap(index);
        this.nodes = Collections.unmodifiableList(nodes);
        this.cells = cells;
    }

    /** Number of rows (and columns). */
    public int size() {
        return cells.length;
    }

    /**
     * Return the map from node to row/column index.
     */
    public Map<Symbol, Integer> getIndexMap() {
        return index;
    }

    public int indexOf(Symbol node) {
        Integer i = index.get(node);
        if (i == null) {
            throw new IllegalArgumentException("Not a node of the graph: " + node);
        }
        return i;
    }

    public Symbol nodeAt(int i) {
        return nodes.get(i);
    }

    public int get(int i, int j) {
        return cells[i][j];
    }

    public int get(Symbol from, Symbol to) {
        return cells[indexOf(from)][indexOf(to)];
    }

    /**
     * Return a copy of the matrix.
     */
    public int[][] toArray() {
        int[][] r = new int[cells.length][];
        for (int i = 0; i != cells.length; ++i) {
            r[i] = cells[i].clone();
        }
        return r;
    }

    public String toString() {
        StringBuilder b = new StringBuilder();
        for (int i = 0; i != cells.length; ++i) {
            b.append(nodes.get(i)).append(':');
            for (int j = 0; j != cells.length; ++j) {
                b.append(' ').append(cells[i][j]);
            }
            b.append('\n');
        }
        return b.toString();
    }
}
