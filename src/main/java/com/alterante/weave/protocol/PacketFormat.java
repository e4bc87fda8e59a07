package com.alterante.weave.protocol;

/**
 * Width of the cyclic packet counter, and the header size that follows from it.
 *
 * The header carries 1 type bit, {@code counterBits} counter bits, a first-packet
 * bit and a last-packet bit, zero-padded to a whole number of bytes.
 * {@link #DEFAULT} (3 counter bits) gives the one-byte Weave header.
 */
public record PacketFormat(int counterBits) {

    public static final int MIN_COUNTER_BITS = 1;
    public static final int MAX_COUNTER_BITS = 16;

    /** Type, first and last flags. */
    private static final int FLAG_BITS = 3;

    public static final PacketFormat DEFAULT = new PacketFormat(3);

    public PacketFormat {
        if (counterBits < MIN_COUNTER_BITS || counterBits > MAX_COUNTER_BITS) {
            throw new IllegalArgumentException("counterBits must be in ["
                    + MIN_COUNTER_BITS + ", " + MAX_COUNTER_BITS + "], got: " + counterBits);
        }
    }

    /** Header size in bytes. */
    public int headerSize() {
        return (FLAG_BITS + counterBits + 7) / 8;
    }

    /** Number of distinct counter values; counters wrap to 0 after {@code counterSpace() - 1}. */
    public int counterSpace() {
        return 1 << counterBits;
    }

    public int maxCounter() {
        return counterSpace() - 1;
    }

    /** Largest payload a single packet can carry at the given packet size. */
    public int maxPayload(int maxPacketSize) {
        return maxPacketSize - headerSize();
    }

    @Override
    public String toString() {
        return String.format("PacketFormat[counterBits=%d, headerSize=%d]", counterBits, headerSize());
    }
}
