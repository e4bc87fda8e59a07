package com.alterante.weave.transport;

import com.alterante.weave.protocol.Packet;
import com.alterante.weave.protocol.PacketFormat;
import com.alterante.weave.protocol.PacketType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits outbound payloads into packets and reassembles an inbound packet stream.
 *
 * Fragmentation is a pure static function; counters are left at 0 and stamped by
 * the {@link WriteRequest} that submits the packets. Reassembly state lives in an
 * instance, one per inbound stream (data and control are reassembled separately).
 *
 * Reassembly rules:
 * <ul>
 *   <li>a first packet starts a message; if it is also the last packet the message completes at once</li>
 *   <li>a first packet while a message is in progress is {@link FramingError#UNEXPECTED_FIRST_PACKET}</li>
 *   <li>a continuation with no message in progress is {@link FramingError#UNEXPECTED_CONTINUATION}</li>
 *   <li>a continuation whose counter is not previous + 1 (mod counter space) is
 *       {@link FramingError#SEQUENCE_GAP}; this covers both loss and duplication</li>
 * </ul>
 * A message may span at most {@code maxPacketsPerMessage} packets; one packet more is
 * {@link FramingError#MESSAGE_TOO_LARGE}. Every error clears the partial message.
 *
 * Thread-safety: callers must synchronize externally.
 */
public class Packetizer {

    private static final Logger log = LoggerFactory.getLogger(Packetizer.class);

    private final PacketFormat format;
    private final int maxPacketsPerMessage;

    private final ByteArrayOutputStream partialPayload = new ByteArrayOutputStream();
    private int expectedNextCounter;
    private boolean inProgress;
    private int packetsInMessage;

    public Packetizer(PacketFormat format) {
        this(format, WriteRequest.DEFAULT_MAX_PACKETS);
    }

    public Packetizer(PacketFormat format, int maxPacketsPerMessage) {
        if (maxPacketsPerMessage < 1) {
            throw new IllegalArgumentException("maxPacketsPerMessage must be positive: " + maxPacketsPerMessage);
        }
        this.format = format;
        this.maxPacketsPerMessage = maxPacketsPerMessage;
    }

    /**
     * Split a payload into an ordered list of packets bounded by {@code maxPacketSize}.
     * An empty payload produces exactly one empty packet.
     *
     * @throws IllegalArgumentException if no payload byte fits next to the header
     */
    public static List<Packet> packetize(PacketType type, byte[] payload, int maxPacketSize, PacketFormat format) {
        if (type == null) {
            throw new IllegalArgumentException("type must not be null");
        }
        if (payload == null) {
            throw new IllegalArgumentException("payload must not be null");
        }
        int chunkSize = format.maxPayload(maxPacketSize);
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("max packet size " + maxPacketSize
                    + " leaves no room for payload after a " + format.headerSize() + "-byte header");
        }

        int packetCount = Math.max(1, (payload.length + chunkSize - 1) / chunkSize);
        List<Packet> packets = new ArrayList<>(packetCount);
        for (int i = 0; i < packetCount; i++) {
            int offset = i * chunkSize;
            int len = Math.min(chunkSize, payload.length - offset);
            byte[] chunk = new byte[len];
            System.arraycopy(payload, offset, chunk, 0, len);
            packets.add(new Packet(type, i == 0, i == packetCount - 1, 0, chunk));
        }
        return packets;
    }

    /** Number of packets {@link #packetize} would produce, without copying anything. */
    public static int packetCount(int payloadLength, int maxPacketSize, PacketFormat format) {
        int chunkSize = format.maxPayload(maxPacketSize);
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("max packet size " + maxPacketSize
                    + " leaves no room for payload after a " + format.headerSize() + "-byte header");
        }
        return Math.max(1, (payloadLength + chunkSize - 1) / chunkSize);
    }

    /**
     * Feed one received packet into the reassembly state.
     *
     * @return the completed message, an error, or {@link ReassemblyResult#incomplete()}
     */
    public ReassemblyResult onPacketReceived(Packet packet) {
        if (packet.isFirstPacket()) {
            if (inProgress) {
                log.debug("First packet (counter={}) while {} packets of a message were pending",
                        packet.counter(), packetsInMessage);
                reset();
                return ReassemblyResult.error(FramingError.UNEXPECTED_FIRST_PACKET);
            }
            inProgress = true;
            expectedNextCounter = nextCounter(packet.counter());
            packetsInMessage = 1;
            partialPayload.writeBytes(packet.payload());
            return packet.isLastPacket() ? finish() : ReassemblyResult.incomplete();
        }

        if (!inProgress) {
            log.debug("Continuation packet (counter={}) with no message in progress", packet.counter());
            return ReassemblyResult.error(FramingError.UNEXPECTED_CONTINUATION);
        }

        if (packet.counter() != expectedNextCounter) {
            log.debug("Sequence gap: expected counter {} but got {}", expectedNextCounter, packet.counter());
            reset();
            return ReassemblyResult.error(FramingError.SEQUENCE_GAP);
        }

        if (packetsInMessage == maxPacketsPerMessage) {
            log.debug("Inbound message exceeds {} packets, discarding {} bytes",
                    maxPacketsPerMessage, partialPayload.size());
            reset();
            return ReassemblyResult.error(FramingError.MESSAGE_TOO_LARGE);
        }

        expectedNextCounter = nextCounter(packet.counter());
        packetsInMessage++;
        partialPayload.writeBytes(packet.payload());
        return packet.isLastPacket() ? finish() : ReassemblyResult.incomplete();
    }

    /** Discard any partial message. */
    public void reset() {
        partialPayload.reset();
        inProgress = false;
        expectedNextCounter = 0;
        packetsInMessage = 0;
    }

    public boolean isInProgress() {
        return inProgress;
    }

    /** Bytes accumulated for the message in progress. */
    public int pendingBytes() {
        return partialPayload.size();
    }

    private ReassemblyResult finish() {
        byte[] message = partialPayload.toByteArray();
        log.debug("Reassembled {} bytes from {} packets", message.length, packetsInMessage);
        reset();
        return ReassemblyResult.complete(message);
    }

    private int nextCounter(int counter) {
        return (counter + 1) % format.counterSpace();
    }
}
