package com.alterante.weave.protocol;

/**
 * The two kinds of traffic multiplexed onto one packet stream.
 * Encoded as the most significant bit of the packet header.
 */
public enum PacketType {

    DATA    (0),
    CONTROL (1);

    private final int bit;

    PacketType(int bit) {
        this.bit = bit;
    }

    public int bit() {
        return bit;
    }

    /**
     * Look up a PacketType by its header bit.
     */
    public static PacketType fromBit(int bit) {
        return (bit & 1) == 1 ? CONTROL : DATA;
    }
}
