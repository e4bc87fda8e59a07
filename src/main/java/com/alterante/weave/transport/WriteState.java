package com.alterante.weave.transport;

/**
 * Life-cycle of a {@link WriteRequest}. COMPLETED, FAILED and CANCELLED are terminal.
 */
public enum WriteState {
    PENDING,        // created, nothing submitted yet
    IN_FLIGHT,      // packets being submitted one at a time
    COMPLETED,      // every packet accepted by the transport
    FAILED,         // a submission failed; partial delivery is never success
    CANCELLED;      // cancelled before completion; late transport results are ignored

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
