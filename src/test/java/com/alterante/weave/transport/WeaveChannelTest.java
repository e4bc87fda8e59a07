package com.alterante.weave.transport;

import com.alterante.weave.protocol.ControlMessage;
import com.alterante.weave.protocol.Packet;
import com.alterante.weave.protocol.PacketCodec;
import com.alterante.weave.protocol.PacketException;
import com.alterante.weave.protocol.PacketFormat;
import com.alterante.weave.protocol.PacketType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class WeaveChannelTest {

    private static final PacketFormat FORMAT = PacketFormat.DEFAULT;
    private static final PacketCodec CODEC = new PacketCodec(FORMAT);

    /** Transport whose submissions complete only when the test says so. */
    static class ManualTransport implements PacketTransport {
        int maxPacketSize = 20;
        final List<byte[]> packets = new ArrayList<>();
        final List<CompletableFuture<Void>> pending = new ArrayList<>();

        @Override
        public int maxPacketSize() {
            return maxPacketSize;
        }

        @Override
        public CompletionStage<Void> submit(byte[] packet) {
            packets.add(packet);
            CompletableFuture<Void> f = new CompletableFuture<>();
            pending.add(f);
            return f;
        }

        void succeedLast() {
            pending.get(pending.size() - 1).complete(null);
        }

        void succeedAll() {
            while (pending.stream().anyMatch(f -> !f.isDone())) {
                for (CompletableFuture<Void> f : new ArrayList<>(pending)) {
                    f.complete(null);
                }
            }
        }

        Packet decoded(int i) throws PacketException {
            return CODEC.decode(packets.get(i));
        }
    }

    private ManualTransport transport;
    private WeaveChannel channel;
    private final List<byte[]> messages = new ArrayList<>();
    private final List<byte[]> controls = new ArrayList<>();
    private final List<FramingError> errors = new ArrayList<>();

    @BeforeEach
    void setUp() {
        transport = new ManualTransport();
        channel = new WeaveChannel(transport, FORMAT, WriteRequest.DEFAULT_MAX_PACKETS, Runnable::run);
        channel.onMessageReceived(messages::add);
        channel.onControlReceived(controls::add);
        channel.onFramingError(errors::add);
    }

    private static WriteResult resultOf(WriteHandle handle) {
        return handle.result().toCompletableFuture().getNow(null);
    }

    private void receive(Packet packet) {
        byte[] encoded = CODEC.encode(packet, 20);
        channel.onPacketReceived(encoded, encoded.length);
    }

    @Test
    void secondMessageWaitsForFirst() throws Exception {
        WriteHandle first = channel.sendMessage(PacketizerTest.pattern(30));
        WriteHandle second = channel.sendMessage(new byte[]{1, 2, 3});

        assertEquals(1, transport.packets.size());
        transport.succeedLast();
        assertEquals(2, transport.packets.size());
        assertNull(resultOf(second), "second message must not start while first is in flight");
        transport.succeedLast();

        assertTrue(resultOf(first).isSuccess());
        assertEquals(3, transport.packets.size());
        assertTrue(transport.decoded(2).isFirstPacket());
        assertTrue(transport.decoded(2).isLastPacket());
        transport.succeedLast();
        assertTrue(resultOf(second).isSuccess());

        // counters continue across messages
        assertEquals(0, transport.decoded(0).counter());
        assertEquals(1, transport.decoded(1).counter());
        assertEquals(2, transport.decoded(2).counter());
        assertEquals(2, channel.totalMessagesSent());
        assertEquals(3, channel.totalPacketsSent());
    }

    @Test
    void failedWriteDoesNotBlockQueue() throws Exception {
        WriteHandle first = channel.sendMessage(PacketizerTest.pattern(30));
        WriteHandle second = channel.sendMessage(new byte[]{4});

        transport.pending.get(0).completeExceptionally(new IOException("link lost"));

        assertEquals(WriteState.FAILED, resultOf(first).state());
        assertEquals("link lost", resultOf(first).cause().getMessage());
        assertEquals(2, transport.packets.size());
        transport.succeedLast();
        assertTrue(resultOf(second).isSuccess());
    }

    @Test
    void cancelQueuedWrite() throws Exception {
        WriteHandle first = channel.sendMessage(new byte[]{1});
        WriteHandle second = channel.sendMessage(new byte[]{2});
        WriteHandle third = channel.sendMessage(new byte[]{3});

        second.cancel();
        assertEquals(WriteState.CANCELLED, resultOf(second).state());

        transport.succeedLast();
        assertTrue(resultOf(first).isSuccess());
        assertEquals(2, transport.packets.size());
        assertArrayEquals(new byte[]{3}, transport.decoded(1).payload());
        transport.succeedLast();
        assertTrue(resultOf(third).isSuccess());
    }

    @Test
    void cancelActiveWriteStartsNext() throws Exception {
        WriteHandle first = channel.sendMessage(PacketizerTest.pattern(60));
        WriteHandle second = channel.sendMessage(new byte[]{9});

        channel.cancel(first);
        assertEquals(WriteState.CANCELLED, resultOf(first).state());
        assertEquals(2, transport.packets.size(), "next message starts once the active one is cancelled");

        // the cancelled submission's late success is ignored
        transport.pending.get(0).complete(null);
        assertEquals(2, transport.packets.size());

        transport.succeedLast();
        assertTrue(resultOf(second).isSuccess());
    }

    @Test
    void cancellationFlagCancelsQueuedWrite() throws Exception {
        CancellationFlag flag = new CancellationFlag();
        channel.sendMessage(new byte[]{1});
        WriteHandle flagged = channel.sendMessage(new byte[]{2}, flag);

        flag.cancel();
        assertEquals(WriteState.CANCELLED, resultOf(flagged).state());
    }

    @Test
    void creationErrorsThrownToCaller() {
        transport.maxPacketSize = 1;
        assertThrows(IllegalArgumentException.class, () -> channel.sendMessage(new byte[4]));

        transport.maxPacketSize = 20;
        assertThrows(MessageTooLargeException.class, () -> channel.sendControl(new byte[40]));

        WeaveChannel small = new WeaveChannel(transport, FORMAT, 2, Runnable::run);
        assertThrows(MessageTooLargeException.class, () -> small.sendMessage(new byte[19 * 3]));
        assertTrue(transport.packets.isEmpty());
    }

    @Test
    void controlMessageSentAsControlPacket() throws Exception {
        WriteHandle handle = channel.sendControl(ControlMessage.connectionConfirm(1, 20, null));
        assertEquals(PacketType.CONTROL, handle.type());
        transport.succeedLast();

        Packet sent = transport.decoded(0);
        assertEquals(PacketType.CONTROL, sent.type());
        assertEquals(ControlMessage.connectionConfirm(1, 20, null), ControlMessage.decode(sent.payload()));
        assertTrue(resultOf(handle).isSuccess());
    }

    @Test
    void inboundDataReassembled() {
        receive(new Packet(PacketType.DATA, true, false, 3, new byte[]{1, 2}));
        assertTrue(messages.isEmpty());
        receive(new Packet(PacketType.DATA, false, true, 4, new byte[]{3}));

        assertEquals(1, messages.size());
        assertArrayEquals(new byte[]{1, 2, 3}, messages.get(0));
        assertEquals(1, channel.totalMessagesReceived());
        assertTrue(errors.isEmpty());
    }

    @Test
    void controlStreamDoesNotDisturbData() throws PacketException {
        receive(new Packet(PacketType.DATA, true, false, 0, new byte[]{1}));
        receive(new Packet(PacketType.CONTROL, 1, ControlMessage.error().encode()));
        receive(new Packet(PacketType.DATA, false, true, 1, new byte[]{2}));

        assertEquals(1, controls.size());
        assertEquals(ControlMessage.error(), ControlMessage.decode(controls.get(0)));
        assertEquals(1, messages.size());
        assertArrayEquals(new byte[]{1, 2}, messages.get(0));
    }

    @Test
    void framingErrorReportedAndChannelRecovers() {
        receive(new Packet(PacketType.DATA, true, false, 0, new byte[]{1}));
        receive(new Packet(PacketType.DATA, false, true, 2, new byte[]{2}));
        assertEquals(List.of(FramingError.SEQUENCE_GAP), errors);

        receive(new Packet(PacketType.DATA, false, true, 3, new byte[]{2}));
        assertEquals(FramingError.UNEXPECTED_CONTINUATION, errors.get(1));

        receive(new Packet(PacketType.DATA, true, true, 4, new byte[]{5}));
        assertEquals(1, messages.size());
        assertArrayEquals(new byte[]{5}, messages.get(0));
        assertEquals(2, channel.totalFramingErrors());
    }

    @Test
    void malformedPacketResetsReassembly() {
        receive(new Packet(PacketType.DATA, true, false, 0, new byte[]{1}));
        channel.onPacketReceived(new byte[]{0x03}, 1); // reserved bits set
        assertEquals(List.of(FramingError.MALFORMED_PACKET), errors);

        // the partial message is gone: its continuation is now unexpected
        receive(new Packet(PacketType.DATA, false, true, 1, new byte[]{2}));
        assertEquals(FramingError.UNEXPECTED_CONTINUATION, errors.get(1));

        channel.onPacketReceived(new byte[0], 0);
        assertEquals(FramingError.MALFORMED_PACKET, errors.get(2));
        assertTrue(messages.isEmpty());
    }

    @Test
    void onPacketReceivedHonoursLength() {
        byte[] buffer = new byte[32];
        byte[] encoded = CODEC.encode(new Packet(PacketType.DATA, 0, new byte[]{7, 8}), 20);
        System.arraycopy(encoded, 0, buffer, 0, encoded.length);
        channel.onPacketReceived(buffer, encoded.length);

        assertArrayEquals(new byte[]{7, 8}, messages.get(0));
    }

    @Test
    void throwingHandlerDoesNotBreakChannel() {
        channel.onMessageReceived(m -> { throw new IllegalStateException("handler bug"); });
        receive(new Packet(PacketType.DATA, 0, new byte[]{1}));

        channel.onMessageReceived(messages::add);
        receive(new Packet(PacketType.DATA, 1, new byte[]{2}));
        assertEquals(1, messages.size());
    }

    @Test
    void resetCancelsWritesAndRestartsCounters() throws Exception {
        channel.sendMessage(new byte[]{1});
        transport.succeedLast();
        WriteHandle active = channel.sendMessage(PacketizerTest.pattern(40));
        WriteHandle queued = channel.sendMessage(new byte[]{2});
        receive(new Packet(PacketType.DATA, true, false, 0, new byte[]{1}));

        channel.reset();
        assertEquals(WriteState.CANCELLED, resultOf(active).state());
        assertEquals(WriteState.CANCELLED, resultOf(queued).state());

        int before = transport.packets.size();
        channel.sendMessage(new byte[]{3});
        assertEquals(0, transport.decoded(before).counter());

        receive(new Packet(PacketType.DATA, false, true, 1, new byte[]{2}));
        assertEquals(FramingError.UNEXPECTED_CONTINUATION, errors.get(0));
    }

    @Test
    void closeRejectsFurtherSends() throws Exception {
        WriteHandle pending = channel.sendMessage(PacketizerTest.pattern(40));
        channel.close();

        assertTrue(channel.isClosed());
        assertEquals(WriteState.CANCELLED, resultOf(pending).state());
        assertThrows(IOException.class, () -> channel.sendMessage(new byte[1]));
        assertThrows(IOException.class, () -> channel.sendControl(new byte[1]));
    }

    @Test
    void sharedFlagKeepsNoListenersAfterWrites() throws Exception {
        ManualTransport immediate = new ManualTransport() {
            @Override
            public CompletionStage<Void> submit(byte[] packet) {
                packets.add(packet);
                return CompletableFuture.completedFuture(null);
            }
        };
        WeaveChannel direct = new WeaveChannel(immediate, FORMAT, WriteRequest.DEFAULT_MAX_PACKETS, Runnable::run);
        CancellationFlag flag = new CancellationFlag();

        for (int i = 0; i < 100; i++) {
            assertTrue(resultOf(direct.sendMessage(PacketizerTest.pattern(30), flag)).isSuccess());
        }
        assertEquals(0, flag.listenerCount());
        assertEquals(200, immediate.packets.size());
    }

    @Test
    void sendAfterExecutorShutdownFails() {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        WeaveChannel stopped = new WeaveChannel(transport, FORMAT, WriteRequest.DEFAULT_MAX_PACKETS, executor);
        executor.shutdown();
        CancellationFlag flag = new CancellationFlag();

        assertThrows(IOException.class, () -> stopped.sendMessage(new byte[5], flag));
        assertThrows(IOException.class, () -> stopped.sendControl(new byte[1]));
        assertEquals(0, flag.listenerCount());
        assertTrue(transport.packets.isEmpty());
    }

    @Test
    void invalidInboundLengthRejected() {
        assertThrows(IllegalArgumentException.class, () -> channel.onPacketReceived(new byte[2], 5));
        assertThrows(IllegalArgumentException.class, () -> channel.onPacketReceived(new byte[2], -1));
        assertThrows(IllegalArgumentException.class, () -> channel.onPacketReceived(null, 0));
        assertEquals(0, channel.totalPacketsReceived());
    }

    @Test
    void inboundMessageLimitedToMaxPackets() {
        WeaveChannel small = new WeaveChannel(transport, FORMAT, 2, Runnable::run);
        List<FramingError> smallErrors = new ArrayList<>();
        List<byte[]> smallMessages = new ArrayList<>();
        small.onFramingError(smallErrors::add);
        small.onMessageReceived(smallMessages::add);

        byte[][] wire = {
                CODEC.encode(new Packet(PacketType.DATA, true, false, 0, new byte[]{1}), 20),
                CODEC.encode(new Packet(PacketType.DATA, false, false, 1, new byte[]{2}), 20),
                CODEC.encode(new Packet(PacketType.DATA, false, true, 2, new byte[]{3}), 20),
        };
        for (byte[] packet : wire) {
            small.onPacketReceived(packet, packet.length);
        }
        assertEquals(List.of(FramingError.MESSAGE_TOO_LARGE), smallErrors);
        assertTrue(smallMessages.isEmpty());
    }

    @Test
    void ownExecutorConfinesWork() throws Exception {
        ManualTransport async = new ManualTransport() {
            @Override
            public CompletionStage<Void> submit(byte[] packet) {
                return CompletableFuture.runAsync(() -> { });
            }
        };
        WeaveChannel threaded = new WeaveChannel(async);
        try {
            CountDownLatch received = new CountDownLatch(1);
            threaded.onMessageReceived(m -> received.countDown());

            WriteResult result = threaded.sendMessage(PacketizerTest.pattern(200))
                    .result().toCompletableFuture().get(5, TimeUnit.SECONDS);
            assertTrue(result.isSuccess());
            assertEquals(11, result.packetCount());

            byte[] encoded = CODEC.encode(new Packet(PacketType.DATA, 0, new byte[]{1}), 20);
            threaded.onPacketReceived(encoded, encoded.length);
            assertTrue(received.await(5, TimeUnit.SECONDS));
        } finally {
            threaded.close();
        }
    }
}
