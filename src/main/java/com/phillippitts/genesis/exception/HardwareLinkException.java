package com.phillippitts.genesis.exception;

/**
 * Thrown when a hardware link primitive fails: handshake, speech, motion or memory read.
 */
public class HardwareLinkException extends GenesisException {

    private final String host;

    public HardwareLinkException(String message) {
        super(message);
        this.host = "unknown";
    }

    public HardwareLinkException(String message, String host) {
        super(message + " (host: " + host + ")");
        this.host = host;
    }

    public HardwareLinkException(String message, String host, Throwable cause) {
        super(message + " (host: " + host + ")", cause);
        this.host = host;
    }

    public String getHost() {
        return host;
    }
}
