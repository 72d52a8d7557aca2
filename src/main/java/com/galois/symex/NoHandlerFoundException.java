package com.galois.symex;

/**
 * Thrown when no registered handler matches an instruction.
 */
public class NoHandlerFoundException extends SymexException {
    private final Expression instruction;

    public NoHandlerFoundException(Expression instruction) {
        super("No handler found for " + instruction);
        this.instruction = instruction;
    }

    /**
     * Return the instruction that could not be dispatched.
     */
    public Expression getInstruction() {
        return instruction;
    }
}
