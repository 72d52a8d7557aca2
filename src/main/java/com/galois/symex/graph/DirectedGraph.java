package com.galois.symex.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.galois.symex.Expression;
import com.galois.symex.Symbol;
import com.galois.symex.SymbolTable;
import com.galois.symex.proto.Protos;

/**
 * A directed graph whose nodes are symbols.
 *
 * <p>
 * Several edges may connect the same pair of nodes as long as their labels
 * differ; connecting a pair again with an existing label has no effect.
 */
public final class DirectedGraph {
    /** Outgoing edges of each node, in insertion order. */
    private final Map<Symbol, Set<Edge>> nodes = new LinkedHashMap<Symbol, Set<Edge>>();

    public DirectedGraph() {}

    /**
     * Add a node if it is not already present.
     */
    public void addNode(Symbol node) {
        if (node == null) throw new NullPointerException("node");
        if (!nodes.containsKey(node)) {
            nodes.put(node, new LinkedHashSet<Edge>());
        }
    }

    /**
     * Add an unlabelled edge from <code>a</code> to <code>b</code>.
     */
    public void connect(Symbol a, Symbol b) {
        connect(a, b, null);
    }

    /**
     * Add an edge from <code>a</code> to <code>b</code>, adding the nodes
     * if needed.
     *
     * @param label The label, or <code>null</code>.
     */
    public void connect(Symbol a, Symbol b, Expression label) {
        addNode(a);
        addNode(b);
        nodes.get(a).add(new Edge(a, b, label));
    }

    public boolean containsNode(Symbol node) {
        return nodes.containsKey(node);
    }

    public Set<Symbol> getNodes() {
        return Collections.unmodifiableSet(nodes.keySet());
    }

    public int getNodeCount() {
        return nodes.size();
    }

    public int getEdgeCount() {
        int n = 0;
        for (Set<Edge> s : nodes.values()) {
            n += s.size();
        }
        return n;
    }

    /**
     * Return the edges leaving <code>node</code>.
     */
    public Set<Edge> outgoing(Symbol node) {
        Set<Edge> s = nodes.get(node);
        if (s == null) {
            throw new IllegalArgumentException("Not a node of the graph: " + node);
        }
        return Collections.unmodifiableSet(s);
    }

    /**
     * Return the distinct targets of the edges leaving <code>node</code>.
     */
    public Set<Symbol> successors(Symbol node) {
        Set<Symbol> r = new LinkedHashSet<Symbol>();
        for (Edge e : outgoing(node)) {
            r.add(e.getTarget());
        }
        return r;
    }

    /**
     * Number the nodes and build the adjacency matrix.  Nodes are numbered
     * in the order they were added.
     */
    public AdjacencyMatrix adjacencyMatrix() {
        Map<Symbol, Integer> index = new HashMap<Symbol, Integer>();
        List<Symbol> order = new ArrayList<Symbol>(nodes.keySet());
        for (int i = 0; i != order.size(); ++i) {
            index.put(order.get(i), i);
        }

        int[][] cells = new int[order.size()][order.size()];
        for (Map.Entry<Symbol, Set<Edge>> e : nodes.entrySet()) {
            int i = index.get(e.getKey());
            for (Edge edge : e.getValue()) {
                cells[i][index.get(edge.getTarget())] = 1;
            }
        }
        return new AdjacencyMatrix(index, order, cells);
    }

    /**
     * Get representation of the graph in protocol buffer format.
     */
    public Protos.Graph getGraphRep() {
        Protos.Graph.Builder b = Protos.Graph.newBuilder();
        for (Map.Entry<Symbol, Set<Edge>> e : nodes.entrySet()) {
            b.addNode(e.getKey().getName());
            for (Edge edge : e.getValue()) {
                Protos.Edge.Builder eb = Protos.Edge.newBuilder()
                    .setSource(edge.getSource().getName())
                    .setTarget(edge.getTarget().getName());
                if (edge.getLabel() != null) {
                    eb.setLabel(edge.getLabel().getExprRep());
                }
                b.addEdge(eb);
            }
        }
        return b.build();
    }

    /**
     * Create a graph from its protocol buffer representation.
     */
    public static DirectedGraph fromGraphRep(SymbolTable t, Protos.Graph rep) {
        DirectedGraph g = new DirectedGraph();
        for (String n : rep.getNodeList()) {
            g.addNode(t.symbol(n));
        }
        for (Protos.Edge e : rep.getEdgeList()) {
            Expression label = e.hasLabel() ? t.fromExprRep(e.getLabel()) : null;
            g.connect(t.symbol(e.getSource()), t.symbol(e.getTarget()), label);
        }
        return g;
    }

    public String toString() {
        StringBuilder b = new StringBuilder("DirectedGraph{");
        boolean first = true;
        for (Map.Entry<Symbol, Set<Edge>> e : nodes.entrySet()) {
            if (!first) b.append(", ");
            first = false;
            b.append(e.getKey()).append(": ").append(e.getValue());
        }
        return b.append('}').toString();
    }
}
