package com.alterante.weave.transport;

import com.alterante.weave.protocol.Packet;
import com.alterante.weave.protocol.PacketCodec;
import com.alterante.weave.protocol.PacketFormat;
import com.alterante.weave.protocol.PacketType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;

/**
 * Drives the packets of one outbound message (or one control payload) onto the
 * transport, one submission at a time.
 *
 * <pre>
 * PENDING -> IN_FLIGHT -> COMPLETED | FAILED | CANCELLED
 * PENDING -> CANCELLED
 * </pre>
 *
 * Each packet is stamped with the next sequence number right before it is
 * submitted; the following packet is only stamped once the transport reports
 * the previous submission's outcome. Any submission error fails the whole
 * request, however many packets were already accepted. Cancellation is
 * cooperative: a submission already handed to the transport is not retracted,
 * its result is ignored.
 *
 * The result stage completes exactly once, always normally, with a {@link WriteResult}.
 *
 * Thread-safety: not thread-safe. {@link WeaveChannel} confines every call to its
 * executor; transport completions for a standalone request must arrive on the
 * thread that drives it.
 */
public final class WriteRequest {

    private static final Logger log = LoggerFactory.getLogger(WriteRequest.class);

    /** Default ceiling on packets per data message. */
    public static final int DEFAULT_MAX_PACKETS = 16_384;

    /** Control payloads are never fragmented. */
    public static final int MAX_CONTROL_PACKETS = 1;

    private final PacketType type;
    private final List<Packet> packets;
    private final PacketCodec codec;
    private final int maxPacketSize;
    private final CancellationFlag cancellationFlag;
    private final CompletableFuture<WriteResult> result = new CompletableFuture<>();
    private final CompletionStage<WriteResult> resultView = result.minimalCompletionStage();

    private WriteState state = WriteState.PENDING;
    private int sendIndex;
    private PacketSubmitter submitter;
    private PacketSequenceNumberGenerator sequence;

    // Trampoline: a transport completing synchronously must not recurse once per packet.
    private boolean pumping;
    private boolean submitDue;

    private WriteRequest(PacketType type, byte[] payload, int maxPacketSize, PacketFormat format,
                         int maxPackets, CancellationFlag cancellationFlag) {
        if (payload == null) {
            throw new IllegalArgumentException("payload must not be null");
        }
        int packetCount = Packetizer.packetCount(payload.length, maxPacketSize, format);
        if (packetCount > maxPackets) {
            throw new MessageTooLargeException(packetCount, maxPackets);
        }
        this.type = type;
        this.packets = List.copyOf(Packetizer.packetize(type, payload, maxPacketSize, format));
        this.codec = new PacketCodec(format);
        this.maxPacketSize = maxPacketSize;
        this.cancellationFlag = cancellationFlag;
    }

    public static WriteRequest forMessage(byte[] message, int maxPacketSize, PacketFormat format) {
        return forMessage(message, maxPacketSize, format, DEFAULT_MAX_PACKETS, null);
    }

    /**
     * Fragment a data message.
     *
     * @param maxPackets       ceiling on the number of packets
     * @param cancellationFlag optional, may be null
     * @throws IllegalArgumentException  if {@code maxPacketSize} leaves no room for payload
     * @throws MessageTooLargeException  if the message needs more than {@code maxPackets} packets
     */
    public static WriteRequest forMessage(byte[] message, int maxPacketSize, PacketFormat format,
                                          int maxPackets, CancellationFlag cancellationFlag) {
        if (maxPackets < 1) {
            throw new IllegalArgumentException("maxPackets must be positive: " + maxPackets);
        }
        return new WriteRequest(PacketType.DATA, message, maxPacketSize, format, maxPackets, cancellationFlag);
    }

    public static WriteRequest forControl(byte[] payload, int maxPacketSize, PacketFormat format) {
        return forControl(payload, maxPacketSize, format, null);
    }

    /**
     * Wrap a control payload, which must fit in a single packet.
     *
     * @throws MessageTooLargeException if the payload does not fit in one packet
     */
    public static WriteRequest forControl(byte[] payload, int maxPacketSize, PacketFormat format,
                                          CancellationFlag cancellationFlag) {
        return new WriteRequest(PacketType.CONTROL, payload, maxPacketSize, format,
                MAX_CONTROL_PACKETS, cancellationFlag);
    }

    /**
     * Submit the first packet. Later packets follow as submissions succeed.
     *
     * @throws IllegalStateException if the request was already started or is terminal
     */
    public void start(PacketSubmitter submitter, PacketSequenceNumberGenerator sequence) {
        if (state != WriteState.PENDING) {
            throw new IllegalStateException("cannot start a request in state " + state);
        }
        this.submitter = submitter;
        this.sequence = sequence;
        if (cancellationRequested()) {
            cancel();
            return;
        }
        state = WriteState.IN_FLIGHT;
        log.debug("Starting {} write: {} packets", type, packets.size());
        submitDue = true;
        pump();
    }

    /**
     * Cancel the request if it has not reached a terminal state.
     *
     * @return true if this call cancelled the request, false if it was already terminal
     */
    public boolean cancel() {
        if (state.isTerminal()) {
            return false;
        }
        log.debug("{} write cancelled after {}/{} packets", type, sendIndex, packets.size());
        state = WriteState.CANCELLED;
        result.complete(WriteResult.cancelled(sendIndex, packets.size()));
        return true;
    }

    private void pump() {
        if (pumping) {
            return;
        }
        pumping = true;
        try {
            while (submitDue && state == WriteState.IN_FLIGHT) {
                submitDue = false;
                submitCurrent();
            }
        } finally {
            pumping = false;
        }
    }

    private void submitCurrent() {
        if (cancellationRequested()) {
            cancel();
            return;
        }
        Packet packet = packets.get(sendIndex).withCounter(sequence.next());
        CompletionStage<Void> submission;
        try {
            byte[] encoded = codec.encode(packet, maxPacketSize);
            submission = submitter.submit(encoded);
        } catch (RuntimeException e) {
            fail(e);
            return;
        }
        if (submission == null) {
            fail(new IllegalStateException("transport returned no completion for " + packet));
            return;
        }
        log.debug("Submitted {}", packet);
        submission.whenComplete((ignored, error) -> onSubmitResult(error));
    }

    private void onSubmitResult(Throwable error) {
        if (state != WriteState.IN_FLIGHT) {
            log.debug("Ignoring submission result for {} {} write", state, type);
            return;
        }
        if (error != null) {
            fail(error instanceof CompletionException && error.getCause() != null ? error.getCause() : error);
            return;
        }
        if (cancellationRequested()) {
            cancel();
            return;
        }

        sendIndex++;
        if (sendIndex == packets.size()) {
            log.debug("{} write completed: {} packets", type, packets.size());
            state = WriteState.COMPLETED;
            result.complete(WriteResult.completed(packets.size()));
            return;
        }
        submitDue = true;
        pump();
    }

    private void fail(Throwable cause) {
        log.debug("{} write failed after {}/{} packets: {}", type, sendIndex, packets.size(), cause.toString());
        state = WriteState.FAILED;
        result.complete(WriteResult.failed(sendIndex, packets.size(), cause));
    }

    private boolean cancellationRequested() {
        return cancellationFlag != null && cancellationFlag.isCancelled();
    }

    /** Completes exactly once with the terminal outcome. */
    public CompletionStage<WriteResult> result() {
        return resultView;
    }

    public PacketType type()                    { return type; }
    public WriteState state()                   { return state; }
    public List<Packet> packets()               { return packets; }
    public int packetCount()                    { return packets.size(); }
    public int packetsSent()                    { return sendIndex; }
    public CancellationFlag cancellationFlag()  { return cancellationFlag; }

    @Override
    public String toString() {
        return String.format("WriteRequest[type=%s, state=%s, sent=%d/%d]", type, state, sendIndex, packets.size());
    }
}
