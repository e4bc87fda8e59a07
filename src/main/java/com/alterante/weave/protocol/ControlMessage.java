package com.alterante.weave.protocol;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;

/**
 * Connection setup and error signaling, encoded as a control packet payload.
 *
 * <pre>
 * CONNECTION_REQUEST: [cmd:1] [minVersion:2] [maxVersion:2] [maxPacketSize:2] [data]
 * CONNECTION_CONFIRM: [cmd:1] [selectedVersion:2] [packetSize:2] [data]
 * ERROR:              [cmd:1]
 * </pre>
 *
 * For CONNECTION_CONFIRM, {@code minVersion} and {@code maxVersion} both hold the
 * selected version. Unused fields are zero.
 */
public record ControlMessage(ControlCommand command, int minVersion, int maxVersion,
                             int packetSize, byte[] data) {

    public static final int PROTOCOL_VERSION = 1;

    private static final int REQUEST_FIXED_SIZE = 1 + 2 + 2 + 2;
    private static final int CONFIRM_FIXED_SIZE = 1 + 2 + 2;

    public ControlMessage {
        if (command == null) {
            throw new IllegalArgumentException("command must not be null");
        }
        checkUnsignedShort("minVersion", minVersion);
        checkUnsignedShort("maxVersion", maxVersion);
        checkUnsignedShort("packetSize", packetSize);
        data = data != null ? Arrays.copyOf(data, data.length) : new byte[0];
    }

    public static ControlMessage connectionRequest(int minVersion, int maxVersion, int maxPacketSize, byte[] data) {
        if (minVersion > maxVersion) {
            throw new IllegalArgumentException("minVersion " + minVersion + " > maxVersion " + maxVersion);
        }
        return new ControlMessage(ControlCommand.CONNECTION_REQUEST, minVersion, maxVersion, maxPacketSize, data);
    }

    public static ControlMessage connectionConfirm(int selectedVersion, int packetSize, byte[] data) {
        return new ControlMessage(ControlCommand.CONNECTION_CONFIRM, selectedVersion, selectedVersion, packetSize, data);
    }

    public static ControlMessage error() {
        return new ControlMessage(ControlCommand.ERROR, 0, 0, 0, null);
    }

    /** The version picked by a CONNECTION_CONFIRM. */
    public int selectedVersion() {
        return minVersion;
    }

    /**
     * Encode to control packet payload bytes.
     */
    public byte[] encode() {
        ByteBuffer buf;
        switch (command) {
            case CONNECTION_REQUEST -> {
                buf = ByteBuffer.allocate(REQUEST_FIXED_SIZE + data.length).order(ByteOrder.BIG_ENDIAN);
                buf.put(command.code());
                buf.putShort((short) minVersion);
                buf.putShort((short) maxVersion);
                buf.putShort((short) packetSize);
                buf.put(data);
            }
            case CONNECTION_CONFIRM -> {
                buf = ByteBuffer.allocate(CONFIRM_FIXED_SIZE + data.length).order(ByteOrder.BIG_ENDIAN);
                buf.put(command.code());
                buf.putShort((short) minVersion);
                buf.putShort((short) packetSize);
                buf.put(data);
            }
            default -> {
                buf = ByteBuffer.allocate(1);
                buf.put(command.code());
            }
        }
        return buf.array();
    }

    /**
     * Decode from control packet payload bytes.
     *
     * @throws PacketException if the command is unknown or the payload is too short for it
     */
    public static ControlMessage decode(byte[] payload) throws PacketException {
        if (payload.length < 1) {
            throw new PacketException("empty control payload");
        }
        ControlCommand command = ControlCommand.fromCode(payload[0]);
        if (command == null) {
            throw new PacketException(String.format("unknown control command: 0x%02X", payload[0]));
        }

        ByteBuffer buf = ByteBuffer.wrap(payload).order(ByteOrder.BIG_ENDIAN);
        buf.get(); // command
        switch (command) {
            case CONNECTION_REQUEST -> {
                if (payload.length < REQUEST_FIXED_SIZE) {
                    throw new PacketException("connection request too short: " + payload.length);
                }
                int minVersion = Short.toUnsignedInt(buf.getShort());
                int maxVersion = Short.toUnsignedInt(buf.getShort());
                int maxPacketSize = Short.toUnsignedInt(buf.getShort());
                byte[] data = new byte[buf.remaining()];
                buf.get(data);
                return new ControlMessage(command, minVersion, maxVersion, maxPacketSize, data);
            }
            case CONNECTION_CONFIRM -> {
                if (payload.length < CONFIRM_FIXED_SIZE) {
                    throw new PacketException("connection confirm too short: " + payload.length);
                }
                int version = Short.toUnsignedInt(buf.getShort());
                int packetSize = Short.toUnsignedInt(buf.getShort());
                byte[] data = new byte[buf.remaining()];
                buf.get(data);
                return new ControlMessage(command, version, version, packetSize, data);
            }
            default -> {
                return error();
            }
        }
    }

    @Override
    public byte[] data() {
        return Arrays.copyOf(data, data.length);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ControlMessage)) return false;
        ControlMessage other = (ControlMessage) o;
        return command == other.command
                && minVersion == other.minVersion
                && maxVersion == other.maxVersion
                && packetSize == other.packetSize
                && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        int h = command.hashCode();
        h = 31 * h + minVersion;
        h = 31 * h + maxVersion;
        h = 31 * h + packetSize;
        return 31 * h + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return switch (command) {
            case CONNECTION_REQUEST -> String.format("ControlMessage[%s, versions=%d-%d, maxPacketSize=%d, data=%d bytes]",
                    command, minVersion, maxVersion, packetSize, data.length);
            case CONNECTION_CONFIRM -> String.format("ControlMessage[%s, version=%d, packetSize=%d, data=%d bytes]",
                    command, minVersion, packetSize, data.length);
            default -> "ControlMessage[" + command + "]";
        };
    }

    private static void checkUnsignedShort(String name, int value) {
        if (value < 0 || value > 0xFFFF) {
            throw new IllegalArgumentException(name + " out of range: " + value);
        }
    }
}
