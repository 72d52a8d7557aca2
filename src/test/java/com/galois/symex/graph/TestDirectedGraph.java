package com.galois.symex.graph;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import com.galois.symex.Symbol;
import com.galois.symex.SymbolTable;

public class TestDirectedGraph {
    SymbolTable t;
    Symbol x, y, z, w;
    DirectedGraph g;

    @Before
    public void setUp() {
        t = new SymbolTable();
        Symbol[] n = t.symbols("x y z w");
        x = n[0]; y = n[1]; z = n[2]; w = n[3];

        g = new DirectedGraph();
        g.connect(x, y, t.symbol("e1"));
        g.connect(y, z, t.symbol("e2"));
        g.connect(z, w);
        g.connect(x, w);
    }

    @Test
    public void nodesAndEdges() {
        Assert.assertEquals(4, g.getNodeCount());
        Assert.assertEquals(4, g.getEdgeCount());
        Assert.assertEquals(2, g.outgoing(x).size());
        Assert.assertTrue(g.outgoing(w).isEmpty());
        Assert.assertTrue(g.successors(x).contains(y));
        Assert.assertTrue(g.successors(x).contains(w));
    }

    @Test
    public void labelledEdges() {
        Edge e = g.outgoing(y).iterator().next();
        Assert.assertEquals(y, e.getSource());
        Assert.assertEquals(z, e.getTarget());
        Assert.assertEquals(t.symbol("e2"), e.getLabel());
        Assert.assertNull(g.outgoing(z).iterator().next().getLabel());
    }

    @Test
    public void parallelEdgesNeedDistinctLabels() {
        g.connect(x, y, t.symbol("e1"));
        Assert.assertEquals(2, g.outgoing(x).size());
        g.connect(x, y, t.symbol("e3"));
        Assert.assertEquals(3, g.outgoing(x).size());
        Assert.assertEquals(2, g.successors(x).size());
    }

    @Test(expected = IllegalArgumentException.class)
    public void outgoingOfUnknownNode() {
        g.outgoing(t.symbol("v"));
    }

    @Test
    public void adjacencyMatrix() {
        AdjacencyMatrix m = g.adjacencyMatrix();
        Assert.assertEquals(4, m.size());
        Assert.assertEquals(0, m.indexOf(x));
        Assert.assertEquals(w, m.nodeAt(3));
        Assert.assertEquals(1, m.get(x, y));
        Assert.assertEquals(0, m.get(x, x));
        Assert.assertEquals(0, m.get(y, x));
        Assert.assertEquals(1, m.get(m.indexOf(z), m.indexOf(w)));

        int[][] a = m.toArray();
        a[0][0] = 1;
        Assert.assertEquals(0, m.get(x, x));
    }

    @Test
    public void selfLoopSetsDiagonal() {
        g.connect(x, x);
        AdjacencyMatrix m = g.adjacencyMatrix();
        Assert.assertEquals(1, m.get(x, x));
        Assert.assertEquals(0, m.get(y, y));
    }

    @Test
    public void indexMapNumbersEveryNode() {
        AdjacencyMatrix m = g.adjacencyMatrix();
        Map<Symbol, Integer> index = m.getIndexMap();
        Assert.assertEquals(g.getNodes(), index.keySet());
        Set<Integer> seen = new HashSet<Integer>(index.values());
        Assert.assertEquals(m.size(), seen.size());
        for (Map.Entry<Symbol, Integer> e : index.entrySet()) {
            int i = e.getValue();
            Assert.assertTrue(0 <= i && i < m.size());
            Assert.assertEquals(e.getKey(), m.nodeAt(i));
        }
    }

    @Test
    public void protocolBufferRepresentation() {
        g.addNode(t.symbol("lonely"));
        SymbolTable other = new SymbolTable();
        DirectedGraph h = DirectedGraph.fromGraphRep(other, g.getGraphRep());
        Assert.assertEquals(5, h.getNodeCount());
        Assert.assertEquals(4, h.getEdgeCount());
        Assert.assertEquals(g.outgoing(x), h.outgoing(x));
        Assert.assertTrue(h.containsNode(t.symbol("lonely")));
    }
}
