/**
 * Symbolic execution of instructions.
 *
 * <p>
 * An {@link com.galois.symex.exec.InstructionExecutor} dispatches each
 * instruction to the most recently registered handler whose
 * {@link com.galois.symex.exec.Matcher} accepts it.  Machine instructions
 * are translated by their handlers into the small IR installed by
 * {@link com.galois.symex.exec.IrHandlers}, whose handlers update the
 * {@link com.galois.symex.exec.MachineState}.
 */
package com.galois.symex.exec;
