package com.alterante.weave.protocol;

/**
 * Thrown when bytes received from the transport cannot be decoded.
 */
public class PacketException extends Exception {

    public PacketException(String message) {
        super(message);
    }

    public PacketException(String message, Throwable cause) {
        super(message, cause);
    }
}
