package com.galois.symex.exec;

/**
 * What {@link InstructionExecutor#run} does with an instruction that no
 * handler matches.
 */
public enum UnhandledPolicy {
    /** Stop and report the instruction. */
    ABORT,
    /** Leave the state unchanged and continue with the next instruction. */
    SKIP
}
