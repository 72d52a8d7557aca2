package com.galois.symex;

/**
 * Thrown when reading a wild that was not captured by a match.
 */
public class UnboundWildException extends SymexException {
    private final String wildName;

    public UnboundWildException(String wildName) {
        super("Wild '" + wildName + "' is not bound");
        this.wildName = wildName;
    }

    public String getWildName() {
        return wildName;
    }
}
