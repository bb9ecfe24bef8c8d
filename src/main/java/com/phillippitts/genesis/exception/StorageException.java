package com.phillippitts.genesis.exception;

/**
 * Thrown when the key/value store cannot persist a change.
 */
public class StorageException extends GenesisException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
