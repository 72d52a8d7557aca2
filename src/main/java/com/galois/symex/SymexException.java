package com.galois.symex;

/**
 * SymexException is the base class of the exceptions raised when symbolic
 * execution cannot proceed.
 */
public class SymexException extends RuntimeException {
    public SymexException(String message) {
        super(message);
    }

    public SymexException(String message, Throwable cause) {
        super(message, cause);
    }
}
