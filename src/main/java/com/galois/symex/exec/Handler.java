package com.galois.symex.exec;

import com.galois.symex.Bindings;

/**
 * Implements the effect of one instruction on the machine state.
 */
public interface Handler {
    /**
     * Execute a matched instruction.
     *
     * @param state a copy of the current state that the handler may modify.
     * @param operands the wilds captured when matching the instruction.
     * @return the state after the instruction.
     */
    MachineState execute(MachineState state, Bindings operands);
}
