package com.phillippitts.genesis.exception;

/**
 * Base exception for all Genesis application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class GenesisException extends RuntimeException {

    public GenesisException(String message) {
        super(message);
    }

    public GenesisException(String message, Throwable cause) {
        super(message, cause);
    }

    public GenesisException(Throwable cause) {
        super(cause);
    }
}
