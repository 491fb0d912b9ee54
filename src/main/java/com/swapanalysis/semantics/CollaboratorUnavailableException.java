package com.swapanalysis.semantics;

/**
 * Thrown by a {@link TypeOracle} that cannot answer a query at all, for example because type
 * information was never computed for the node.
 */
public class CollaboratorUnavailableException extends RuntimeException {

    public CollaboratorUnavailableException(String message) {
        super(message);
    }

    public CollaboratorUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
