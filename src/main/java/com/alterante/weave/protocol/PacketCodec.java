package com.alterante.weave.protocol;

/**
 * Encodes and decodes {@link Packet} instances to/from byte arrays.
 *
 * Header layout, most significant bit first, big-endian across header bytes:
 * <pre>
 * Bit               Field
 * W-1               Type (1 = CONTROL, 0 = DATA)
 * next counterBits  Counter
 * next 1            First packet
 * next 1            Last packet
 * remaining         Reserved (0)
 * </pre>
 * where W is 8 times {@link PacketFormat#headerSize()}. With the default format
 * this is a single byte: {@code T CCC F L 0 0}. The payload follows the header.
 */
public final class PacketCodec {

    private final PacketFormat format;
    private final int headerSize;
    private final int typeShift;
    private final int counterShift;
    private final int firstShift;
    private final int lastShift;
    private final int reservedMask;

    public PacketCodec(PacketFormat format) {
        if (format == null) {
            throw new IllegalArgumentException("format must not be null");
        }
        this.format = format;
        this.headerSize = format.headerSize();
        int headerBits = headerSize * 8;
        this.typeShift = headerBits - 1;
        this.counterShift = typeShift - format.counterBits();
        this.firstShift = counterShift - 1;
        this.lastShift = counterShift - 2;
        this.reservedMask = (1 << lastShift) - 1;
    }

    public PacketFormat format() {
        return format;
    }

    public int headerSize() {
        return headerSize;
    }

    /**
     * Encode a Packet into the bytes handed to the transport.
     *
     * @param packet        the packet to encode
     * @param maxPacketSize the connection's maximum packet size
     * @throws IllegalArgumentException if the packet does not fit or its counter exceeds the counter width
     */
    public byte[] encode(Packet packet, int maxPacketSize) {
        int payloadLen = packet.payloadLength();
        if (headerSize + payloadLen > maxPacketSize) {
            throw new IllegalArgumentException("packet too large: " + (headerSize + payloadLen)
                    + " > " + maxPacketSize);
        }
        if (packet.counter() > format.maxCounter()) {
            throw new IllegalArgumentException("counter " + packet.counter()
                    + " exceeds " + format.counterBits() + "-bit counter space");
        }

        int header = (packet.type().bit() << typeShift)
                | (packet.counter() << counterShift)
                | ((packet.isFirstPacket() ? 1 : 0) << firstShift)
                | ((packet.isLastPacket() ? 1 : 0) << lastShift);

        byte[] out = new byte[headerSize + payloadLen];
        for (int i = 0; i < headerSize; i++) {
            out[i] = (byte) (header >>> (8 * (headerSize - 1 - i)));
        }
        if (payloadLen > 0) {
            System.arraycopy(packet.payload(), 0, out, headerSize, payloadLen);
        }
        return out;
    }

    /**
     * Decode bytes received from the transport into a Packet.
     *
     * @param data   the raw packet bytes
     * @param length number of valid bytes in {@code data}
     * @return the decoded Packet
     * @throws PacketException if the data is shorter than a header or reserved bits are set
     */
    public Packet decode(byte[] data, int length) throws PacketException {
        if (length < headerSize) {
            throw new PacketException("packet too short: " + length + " < " + headerSize);
        }

        int header = 0;
        for (int i = 0; i < headerSize; i++) {
            header = (header << 8) | Byte.toUnsignedInt(data[i]);
        }

        if ((header & reservedMask) != 0) {
            throw new PacketException(String.format("reserved header bits set: 0x%0" + (headerSize * 2) + "X",
                    header));
        }

        PacketType type = PacketType.fromBit(header >>> typeShift);
        int counter = (header >>> counterShift) & format.maxCounter();
        boolean first = ((header >>> firstShift) & 1) == 1;
        boolean last = ((header >>> lastShift) & 1) == 1;

        byte[] payload = new byte[length - headerSize];
        System.arraycopy(data, headerSize, payload, 0, payload.length);

        return new Packet(type, first, last, counter, payload);
    }

    /** Decode a whole array. */
    public Packet decode(byte[] data) throws PacketException {
        return decode(data, data.length);
    }
}
