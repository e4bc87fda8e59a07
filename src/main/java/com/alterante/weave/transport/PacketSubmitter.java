package com.alterante.weave.transport;

import java.util.concurrent.CompletionStage;

/**
 * Hands one encoded packet to the transport.
 */
@FunctionalInterface
public interface PacketSubmitter {

    /**
     * Submit one packet for transmission.
     *
     * @return a stage completing normally once the transport accepted the write,
     *         or exceptionally with the reason it could not
     */
    CompletionStage<Void> submit(byte[] packet);
}
