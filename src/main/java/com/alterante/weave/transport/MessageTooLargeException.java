package com.alterante.weave.transport;

/**
 * Thrown when a payload would need more packets than a write request allows.
 * Raised at creation; nothing is submitted.
 */
public class MessageTooLargeException extends IllegalArgumentException {

    private final int packetCount;
    private final int maxPackets;

    public MessageTooLargeException(int packetCount, int maxPackets) {
        super("message needs " + packetCount + " packets, limit is " + maxPackets);
        this.packetCount = packetCount;
        this.maxPackets = maxPackets;
    }

    public int packetCount() { return packetCount; }
    public int maxPackets()  { return maxPackets; }
}
