package com.alterante.weave.protocol;

import java.util.Arrays;

/**
 * Immutable representation of one wire fragment.
 *
 * The counter is left at 0 by the packetizer and stamped by the write request
 * right before submission, see {@link #withCounter(int)}. Size limits depend on
 * the connection and are enforced by {@link PacketCodec#encode(Packet, int)}.
 */
public final class Packet {

    private final PacketType type;
    private final boolean firstPacket;
    private final boolean lastPacket;
    private final int counter;
    private final byte[] payload;

    public Packet(PacketType type, boolean firstPacket, boolean lastPacket, int counter, byte[] payload) {
        if (type == null) {
            throw new IllegalArgumentException("type must not be null");
        }
        if (counter < 0) {
            throw new IllegalArgumentException("counter must not be negative: " + counter);
        }
        this.type = type;
        this.firstPacket = firstPacket;
        this.lastPacket = lastPacket;
        this.counter = counter;
        this.payload = payload != null ? Arrays.copyOf(payload, payload.length) : new byte[0];
    }

    /** Convenience constructor for a single-fragment packet. */
    public Packet(PacketType type, int counter, byte[] payload) {
        this(type, true, true, counter, payload);
    }

    /** Returns a copy of this packet carrying the given counter. */
    public Packet withCounter(int newCounter) {
        return new Packet(type, firstPacket, lastPacket, newCounter, payload);
    }

    public PacketType type()        { return type; }
    public boolean isFirstPacket()  { return firstPacket; }
    public boolean isLastPacket()   { return lastPacket; }
    public int counter()            { return counter; }
    public byte[] payload()         { return Arrays.copyOf(payload, payload.length); }
    public int payloadLength()      { return payload.length; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Packet)) return false;
        Packet other = (Packet) o;
        return type == other.type
                && firstPacket == other.firstPacket
                && lastPacket == other.lastPacket
                && counter == other.counter
                && Arrays.equals(payload, other.payload);
    }

    @Override
    public int hashCode() {
        int h = type.hashCode();
        h = 31 * h + (firstPacket ? 1 : 0);
        h = 31 * h + (lastPacket ? 1 : 0);
        h = 31 * h + counter;
        return 31 * h + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return String.format("Packet[type=%s, first=%b, last=%b, counter=%d, payload=%d bytes]",
                type, firstPacket, lastPacket, counter, payload.length);
    }
}
