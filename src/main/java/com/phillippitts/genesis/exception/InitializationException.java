package com.phillippitts.genesis.exception;

/**
 * Thrown when the runtime cannot reach a usable state at startup. Aborts application start.
 */
public class InitializationException extends GenesisException {

    public InitializationException(String message) {
        super(message);
    }

    public InitializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
