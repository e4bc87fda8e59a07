package com.alterante.weave.transport;

/**
 * Terminal outcome of a {@link WriteRequest}, reported exactly once.
 *
 * @param state         COMPLETED, FAILED or CANCELLED
 * @param packetsSent   packets the transport accepted before the outcome
 * @param packetCount   packets in the request
 * @param cause         the submission error for FAILED, otherwise null
 */
public record WriteResult(WriteState state, int packetsSent, int packetCount, Throwable cause) {

    public WriteResult {
        if (state == null || !state.isTerminal()) {
            throw new IllegalArgumentException("result state must be terminal: " + state);
        }
    }

    public static WriteResult completed(int packetCount) {
        return new WriteResult(WriteState.COMPLETED, packetCount, packetCount, null);
    }

    public static WriteResult failed(int packetsSent, int packetCount, Throwable cause) {
        return new WriteResult(WriteState.FAILED, packetsSent, packetCount, cause);
    }

    public static WriteResult cancelled(int packetsSent, int packetCount) {
        return new WriteResult(WriteState.CANCELLED, packetsSent, packetCount, null);
    }

    public boolean isSuccess() {
        return state == WriteState.COMPLETED;
    }

    @Override
    public String toString() {
        String base = String.format("WriteResult[%s, %d/%d packets", state, packetsSent, packetCount);
        return cause != null ? base + ", cause=" + cause + "]" : base + "]";
    }
}
