package com.alterante.weave.transport;

import com.alterante.weave.protocol.ControlMessage;
import com.alterante.weave.protocol.Packet;
import com.alterante.weave.protocol.PacketCodec;
import com.alterante.weave.protocol.PacketException;
import com.alterante.weave.protocol.PacketFormat;
import com.alterante.weave.protocol.PacketType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

/**
 * One logical Weave connection over a {@link PacketTransport}.
 *
 * Outbound messages are fragmented into {@link WriteRequest}s and sent strictly
 * one at a time: a queued request starts only once the active one is terminal, so
 * fragments of two messages never interleave and sequence numbers are stamped in
 * transmission order. Inbound packets are decoded and reassembled on two streams,
 * one for data and one for control.
 *
 * All protocol state (sequence generator, reassembly streams, write queue) is
 * confined to a single serial executor. Every public entry point, and every
 * transport completion, is posted to it. Callbacks run on that executor.
 */
public class WeaveChannel implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WeaveChannel.class);

    private final PacketTransport transport;
    private final PacketFormat format;
    private final PacketCodec codec;
    private final int maxPacketsPerMessage;
    private final Executor executor;
    private final ExecutorService ownedExecutor;

    // Confined to the executor
    private final PacketSequenceNumberGenerator sequence;
    private final Packetizer dataStream;
    private final Packetizer controlStream;
    private final Deque<WriteRequest> queue = new ArrayDeque<>();
    private WriteRequest active;

    // Callbacks
    private volatile Consumer<byte[]> onMessageReceived;
    private volatile Consumer<byte[]> onControlReceived;
    private volatile Consumer<FramingError> onFramingError;

    // State
    private volatile boolean closed;
    private long totalPacketsSent;
    private long totalPacketsReceived;
    private long totalMessagesSent;
    private long totalMessagesReceived;
    private long totalFramingErrors;

    /**
     * @param transport            the link packets are submitted to
     * @param format               counter width and header layout
     * @param maxPacketsPerMessage ceiling on packets per outbound data message
     * @param executor             serial executor owning all protocol state; must run tasks one at a time, in order
     */
    public WeaveChannel(PacketTransport transport, PacketFormat format, int maxPacketsPerMessage, Executor executor) {
        this(transport, format, maxPacketsPerMessage, executor, false);
    }

    /** Channel with the default format and its own single-threaded executor. */
    public WeaveChannel(PacketTransport transport) {
        this(transport, PacketFormat.DEFAULT, WriteRequest.DEFAULT_MAX_PACKETS, newChannelExecutor(), true);
    }

    private WeaveChannel(PacketTransport transport, PacketFormat format, int maxPacketsPerMessage,
                         Executor executor, boolean ownsExecutor) {
        if (transport == null || format == null || executor == null) {
            throw new IllegalArgumentException("transport, format and executor are required");
        }
        if (maxPacketsPerMessage < 1) {
            throw new IllegalArgumentException("maxPacketsPerMessage must be positive: " + maxPacketsPerMessage);
        }
        this.transport = transport;
        this.format = format;
        this.codec = new PacketCodec(format);
        this.maxPacketsPerMessage = maxPacketsPerMessage;
        this.executor = executor;
        this.ownedExecutor = ownsExecutor ? (ExecutorService) executor : null;
        this.sequence = new PacketSequenceNumberGenerator(format);
        this.dataStream = new Packetizer(format, maxPacketsPerMessage);
        this.controlStream = new Packetizer(format, maxPacketsPerMessage);

        log.debug("WeaveChannel created: {}, maxPacketsPerMessage={}", format, maxPacketsPerMessage);
    }

    /** Set callback for reassembled data messages. */
    public void onMessageReceived(Consumer<byte[]> handler) {
        this.onMessageReceived = handler;
    }

    /** Set callback for reassembled control payloads (see {@link ControlMessage#decode(byte[])}). */
    public void onControlReceived(Consumer<byte[]> handler) {
        this.onControlReceived = handler;
    }

    /** Set callback for framing errors on the inbound stream. */
    public void onFramingError(Consumer<FramingError> handler) {
        this.onFramingError = handler;
    }

    /**
     * Queue a data message.
     *
     * @throws IOException               if the channel is closed or its executor no longer accepts work
     * @throws IllegalArgumentException  if the current packet size cannot carry any payload
     * @throws MessageTooLargeException  if the message needs too many packets
     */
    public WriteHandle sendMessage(byte[] message) throws IOException {
        return sendMessage(message, null);
    }

    public WriteHandle sendMessage(byte[] message, CancellationFlag cancellationFlag) throws IOException {
        if (closed) throw new IOException("Channel is closed");
        WriteRequest request = WriteRequest.forMessage(message, transport.maxPacketSize(), format,
                maxPacketsPerMessage, cancellationFlag);
        return enqueue(request);
    }

    /**
     * Queue a control payload. It must fit in a single packet.
     *
     * @throws IOException               if the channel is closed
     * @throws MessageTooLargeException  if the payload does not fit in one packet
     */
    public WriteHandle sendControl(byte[] payload) throws IOException {
        return sendControl(payload, null);
    }

    public WriteHandle sendControl(byte[] payload, CancellationFlag cancellationFlag) throws IOException {
        if (closed) throw new IOException("Channel is closed");
        WriteRequest request = WriteRequest.forControl(payload, transport.maxPacketSize(), format, cancellationFlag);
        return enqueue(request);
    }

    public WriteHandle sendControl(ControlMessage message) throws IOException {
        return sendControl(message.encode());
    }

    /** Cancel a queued or in-flight write. No-op once it is terminal. */
    public void cancel(WriteHandle handle) {
        WriteRequest request = handle.request();
        execute(request::cancel);
    }

    /**
     * Entry point for raw packets from the transport. The bytes are copied.
     *
     * @throws IllegalArgumentException if {@code length} is outside {@code [0, data.length]}
     */
    public void onPacketReceived(byte[] data, int length) {
        if (data == null || length < 0 || length > data.length) {
            throw new IllegalArgumentException("invalid packet length " + length + " for buffer of "
                    + (data == null ? "null" : data.length + " bytes"));
        }
        byte[] copy = new byte[length];
        System.arraycopy(data, 0, copy, 0, length);
        execute(() -> handleInbound(copy));
    }

    /**
     * Start over for a new logical connection: cancels queued and in-flight
     * writes, resets the sequence generator and both reassembly streams.
     */
    public void reset() {
        execute(() -> {
            cancelAll();
            sequence.reset();
            dataStream.reset();
            controlStream.reset();
            log.debug("Channel reset");
        });
    }

    /** Cancel outstanding writes and reject further sends. */
    @Override
    public void close() {
        if (closed) return;
        closed = true;
        execute(() -> {
            cancelAll();
            dataStream.reset();
            controlStream.reset();
            log.debug("Channel closed: sent={} received={} framingErrors={}",
                    totalMessagesSent, totalMessagesReceived, totalFramingErrors);
        });
        if (ownedExecutor != null) {
            ownedExecutor.shutdown();
        }
    }

    public boolean isClosed() {
        return closed;
    }

    // --- Outbound ---

    private WriteHandle enqueue(WriteRequest request) throws IOException {
        WriteHandle handle = new WriteHandle(request, this);
        CancellationFlag flag = request.cancellationFlag();
        Runnable cancelOnFlag = () -> execute(request::cancel);

        // Registered before the request can finish, so the removal below always finds it.
        if (flag != null) {
            flag.addListener(cancelOnFlag);
        }
        request.result().whenComplete((result, error) -> {
            if (flag != null) {
                flag.removeListener(cancelOnFlag);
            }
            execute(() -> onWriteFinished(request, result));
        });

        try {
            executor.execute(() -> {
                if (closed) {
                    request.cancel();
                    return;
                }
                queue.add(request);
                startNextIfIdle();
            });
        } catch (RejectedExecutionException e) {
            request.cancel();
            throw new IOException("Channel is closed", e);
        }
        return handle;
    }

    private void startNextIfIdle() {
        while (active == null && !queue.isEmpty()) {
            WriteRequest next = queue.poll();
            if (next.state() != WriteState.PENDING) {
                continue; // cancelled while queued
            }
            active = next;
            next.start(this::submitOnChannel, sequence);
        }
    }

    private void onWriteFinished(WriteRequest request, WriteResult result) {
        if (result.isSuccess()) {
            totalMessagesSent++;
        } else if (result.state() == WriteState.FAILED) {
            log.warn("{} write failed after {}/{} packets: {}", request.type(),
                    result.packetsSent(), result.packetCount(), String.valueOf(result.cause()));
        }
        if (active == request) {
            active = null;
        } else {
            queue.remove(request);
        }
        startNextIfIdle();
    }

    /** Submit through the transport, re-posting the outcome onto the channel executor. */
    private CompletionStage<Void> submitOnChannel(byte[] packet) {
        CompletableFuture<Void> done = new CompletableFuture<>();
        transport.submit(packet).whenComplete((ignored, error) -> execute(() -> {
            if (error != null) {
                done.completeExceptionally(error);
            } else {
                totalPacketsSent++;
                done.complete(null);
            }
        }));
        return done;
    }

    private void cancelAll() {
        List<WriteRequest> queued = new ArrayList<>(queue);
        queue.clear();
        for (WriteRequest request : queued) {
            request.cancel();
        }
        WriteRequest current = active;
        active = null;
        if (current != null) {
            current.cancel();
        }
    }

    // --- Inbound ---

    private void handleInbound(byte[] data) {
        totalPacketsReceived++;
        Packet packet;
        try {
            packet = codec.decode(data, data.length);
        } catch (PacketException e) {
            log.warn("Malformed packet ({} bytes): {}", data.length, e.getMessage());
            dataStream.reset();
            controlStream.reset();
            reportFramingError(FramingError.MALFORMED_PACKET);
            return;
        }

        Packetizer stream = packet.type() == PacketType.CONTROL ? controlStream : dataStream;
        ReassemblyResult result = stream.onPacketReceived(packet);
        switch (result.status()) {
            case COMPLETE -> deliver(packet.type(), result.message());
            case ERROR -> {
                log.warn("Framing error on {} stream: {}", packet.type(), result.error());
                reportFramingError(result.error());
            }
            default -> {
                // waiting for more fragments
            }
        }
    }

    private void deliver(PacketType type, byte[] message) {
        Consumer<byte[]> handler;
        if (type == PacketType.CONTROL) {
            handler = onControlReceived;
        } else {
            totalMessagesReceived++;
            handler = onMessageReceived;
        }
        if (handler == null) {
            log.debug("No handler for {} message ({} bytes)", type, message.length);
            return;
        }
        try {
            handler.accept(message);
        } catch (RuntimeException e) {
            log.warn("{} handler threw: {}", type, e.getMessage(), e);
        }
    }

    private void reportFramingError(FramingError error) {
        totalFramingErrors++;
        Consumer<FramingError> handler = onFramingError;
        if (handler == null) {
            return;
        }
        try {
            handler.accept(error);
        } catch (RuntimeException e) {
            log.warn("Framing error handler threw: {}", e.getMessage(), e);
        }
    }

    private void execute(Runnable task) {
        try {
            executor.execute(task);
        } catch (RejectedExecutionException e) {
            log.debug("Channel executor rejected task: {}", e.getMessage());
        }
    }

    private static ExecutorService newChannelExecutor() {
        return Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "weave-channel");
            t.setDaemon(true);
            return t;
        });
    }

    // --- Stats ---

    public PacketFormat format() { return format; }
    public long totalPacketsSent() { return totalPacketsSent; }
    public long totalPacketsReceived() { return totalPacketsReceived; }
    public long totalMessagesSent() { return totalMessagesSent; }
    public long totalMessagesReceived() { return totalMessagesReceived; }
    public long totalFramingErrors() { return totalFramingErrors; }
}
