package com.galois.symex.exec;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.galois.symex.Expression;
import com.galois.symex.SymbolTable;
import com.galois.symex.proto.Protos;

/**
 * The values of registers, memory cells and IR slots at one point of a
 * symbolic execution.
 *
 * <p>
 * Keys are register symbols, <code>MEMORY(size, addr)</code> terms whose
 * address has been resolved against the state and simplified, or IR slot
 * terms.  The executor hands every handler its own {@link #copy}, so a
 * state held by a caller is never changed by execution.
 */
public final class MachineState {
    private final LinkedHashMap<Expression, Expression> values;

    public MachineState() {
        this.values = new LinkedHashMap<Expression, Expression>();
    }

    private MachineState(MachineState other) {
        this.values = new LinkedHashMap<Expression, Expression>(other.values);
    }

    /**
     * Return an independent copy of this state.
     */
    public MachineState copy() {
        return new MachineState(this);
    }

    /**
     * Return the value stored for <code>key</code>, or <code>null</code>.
     */
    public Expression get(Expression key) {
        return values.get(key);
    }

    /**
     * Return the value stored for <code>key</code>, or the key itself if
     * nothing is known about it.
     */
    public Expression resolve(Expression key) {
        Expression v = values.get(key);
        return v != null ? v : key;
    }

    public boolean containsKey(Expression key) {
        return values.containsKey(key);
    }

    public void put(Expression key, Expression value) {
        if (key == null) throw new NullPointerException("key");
        if (value == null) throw new NullPointerException("value");
        values.put(key, value);
    }

    public void remove(Expression key) {
        values.remove(key);
    }

    public int size() {
        return values.size();
    }

    /**
     * Return a read-only view of the state, suitable for
     * {@link Expression#substitute}.
     */
    public Map<Expression, Expression> asMap() {
        return Collections.unmodifiableMap(values);
    }

    /**
     * Get representation of the state in protocol buffer format.
     */
    public Protos.MachineState getStateRep() {
        Protos.MachineState.Builder b = Protos.MachineState.newBuilder();
        for (Map.Entry<Expression, Expression> e : values.entrySet()) {
            b.addEntry(Protos.StateEntry.newBuilder()
                       .setKey(e.getKey().getExprRep())
                       .setValue(e.getValue().getExprRep()));
        }
        return b.build();
    }

    /**
     * Create a state from its protocol buffer representation.
     */
    public static MachineState fromStateRep(SymbolTable table, Protos.MachineState rep) {
        MachineState r = new MachineState();
        for (Protos.StateEntry e : rep.getEntryList()) {
            r.put(table.fromExprRep(e.getKey()), table.fromExprRep(e.getValue()));
        }
        return r;
    }

    public boolean equals(Object o) {
        if (!(o instanceof MachineState)) return false;
        return values.equals(((MachineState) o).values);
    }

    public int hashCode() {
        return values.hashCode();
    }

    public String toString() {
        return values.toString();
    }
}
