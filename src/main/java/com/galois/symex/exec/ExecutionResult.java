package com.galois.symex.exec;

import java.util.Collections;
import java.util.List;

import com.galois.symex.Expression;

/**
 * Outcome of {@link InstructionExecutor#run}.
 */
public final class ExecutionResult {
    public enum ErrorKind { NONE, NO_HANDLER_FOUND }

    private final MachineState state;
    private final ErrorKind error;
    private final Expression failedInstruction;
    private final int failedIndex;
    private final List<Expression> skipped;

    ExecutionResult(MachineState state,
                    ErrorKind error,
                    Expression failedInstruction,
                    int failedIndex,
                    List<Expression> skipped) {
        this.state = state;
        this.error = error;
        this.failedInstruction = failedInstruction;
        this.failedIndex = failedIndex;
        this.skipped = Collections.unmodifiableList(skipped);
    }

    /**
     * The state after the last instruction that executed.
     */
    public MachineState getState() {
        return state;
    }

    public ErrorKind getError() {
        return error;
    }

    public boolean isSuccess() {
        return error == ErrorKind.NONE;
    }

    /**
     * The instruction that had no handler, or <code>null</code>.  This may
     * be an instruction emitted by the handler of the input instruction at
     * {@link #getFailedIndex}.
     */
    public Expression getFailedInstruction() {
        return failedInstruction;
    }

    /**
     * Index of the failed instruction in the input, or -1.
     */
    public int getFailedIndex() {
        return failedIndex;
    }

    /**
     * Instructions passed over under {@link UnhandledPolicy#SKIP}.
     */
    public List<Expression> getSkipped() {
        return skipped;
    }

    public String toString() {
        if (isSuccess()) {
            return "ExecutionResult: " + state;
        }
        return "ExecutionResult: " + error + " at " + failedIndex + ": " + failedInstruction;
    }
}
