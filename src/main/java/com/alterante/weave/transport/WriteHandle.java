package com.alterante.weave.transport;

import com.alterante.weave.protocol.PacketType;

import java.util.concurrent.CompletionStage;

/**
 * Caller's view of a write queued on a {@link WeaveChannel}.
 */
public final class WriteHandle {

    private final WriteRequest request;
    private final WeaveChannel channel;

    WriteHandle(WriteRequest request, WeaveChannel channel) {
        this.request = request;
        this.channel = channel;
    }

    /** Completes exactly once with COMPLETED, FAILED or CANCELLED. */
    public CompletionStage<WriteResult> result() {
        return request.result();
    }

    /** Request cancellation; the outcome is reported through {@link #result()}. */
    public void cancel() {
        channel.cancel(this);
    }

    public PacketType type() {
        return request.type();
    }

    public int packetCount() {
        return request.packetCount();
    }

    WriteRequest request() {
        return request;
    }
}
