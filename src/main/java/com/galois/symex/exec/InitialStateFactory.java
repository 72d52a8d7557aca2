package com.galois.symex.exec;

/**
 * Builds the state used when execution starts without one.
 */
public interface InitialStateFactory {
    MachineState newInitialState();
}
