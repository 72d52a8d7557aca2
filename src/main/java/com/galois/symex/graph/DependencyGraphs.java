package com.galois.symex.graph;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import com.galois.symex.Expression;
import com.galois.symex.Operation;
import com.galois.symex.Symbol;
import com.galois.symex.exec.MachineState;

/**
 * Builds graphs recording which symbols a machine state's values refer to.
 */
public final class DependencyGraphs {
    private DependencyGraphs() {}

    /**
     * Build a graph with an edge from each symbol-keyed entry of
     * <code>state</code> to every symbol occurring in its value, labelled
     * with the value.  Memory cells and IR slots are left out.
     *
     * Use {@link GraphAlgorithms#pathQ} on the result to ask whether a
     * register depends on a given initial value.
     */
    public static DirectedGraph fromState(MachineState state) {
        DirectedGraph g = new DirectedGraph();
        for (Map.Entry<Expression, Expression> e : state.asMap().entrySet()) {
            if (e.getKey().kind() != Expression.Kind.SYMBOL) {
                continue;
            }
            Symbol key = (Symbol) e.getKey();
            g.addNode(key);
            for (Symbol s : operandSymbols(e.getValue())) {
                g.connect(key, s, e.getValue());
            }
        }
        return g;
    }

    /**
     * Return the symbols occurring in <code>e</code> other than as the head
     * of an operation.
     */
    public static Set<Symbol> operandSymbols(Expression e) {
        Set<Symbol> r = new LinkedHashSet<Symbol>();
        collect(e, r);
        return r;
    }

    private static void collect(Expression e, Set<Symbol> r) {
        switch (e.kind()) {
        case SYMBOL:
            r.add((Symbol) e);
            break;
        case OPERATION:
            for (Expression o : ((Operation) e).getOperands()) {
                collect(o, r);
            }
            break;
        default:
            break;
        }
    }
}
