package com.alterante.weave.transport;

import java.util.Arrays;

/**
 * Outcome of feeding one packet into a {@link Packetizer}.
 */
public record ReassemblyResult(Status status, byte[] message, FramingError error) {

    public enum Status {
        INCOMPLETE,
        COMPLETE,
        ERROR
    }

    private static final ReassemblyResult INCOMPLETE = new ReassemblyResult(Status.INCOMPLETE, null, null);

    public static ReassemblyResult incomplete() {
        return INCOMPLETE;
    }

    public static ReassemblyResult complete(byte[] message) {
        return new ReassemblyResult(Status.COMPLETE, message, null);
    }

    public static ReassemblyResult error(FramingError error) {
        return new ReassemblyResult(Status.ERROR, null, error);
    }

    public boolean isComplete() {
        return status == Status.COMPLETE;
    }

    public boolean isError() {
        return status == Status.ERROR;
    }

    @Override
    public String toString() {
        return switch (status) {
            case COMPLETE -> "COMPLETE[" + message.length + " bytes]";
            case ERROR -> "ERROR[" + error + "]";
            default -> "INCOMPLETE";
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ReassemblyResult)) return false;
        ReassemblyResult other = (ReassemblyResult) o;
        return status == other.status && error == other.error && Arrays.equals(message, other.message);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * status.hashCode() + Arrays.hashCode(message)) + (error != null ? error.hashCode() : 0);
    }
}
