package com.alterante.weave.transport;

/**
 * What the protocol needs from the underlying link (a GATT characteristic, a socket, ...).
 * Incoming packets are pushed into {@link WeaveChannel#onPacketReceived(byte[], int)}.
 */
public interface PacketTransport extends PacketSubmitter {

    /** Maximum packet size of the current connection, header included. */
    int maxPacketSize();
}
