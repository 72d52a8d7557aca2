package com.galois.symex.exec;

import java.util.List;

import com.galois.symex.Expression;

/**
 * Observer called when an IR operation executes.
 *
 * Hooks are given resolved values only; they cannot change the state.
 */
public interface ExecutionHook {
    public void observe(String opcode, List<Expression> values);
}
