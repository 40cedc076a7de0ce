package com.hmmlab.server.hmm;

/**
 * Raised when training input violates a shape constraint (state or symbol
 * count, empty sequence, symbol index out of range, malformed matrix).
 * The message names the violated constraint.
 */
public class HmmValidationException extends IllegalArgumentException {

    public HmmValidationException(String message) {
        super(message);
    }
}
