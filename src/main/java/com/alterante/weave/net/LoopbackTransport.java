package com.alterante.weave.net;

import com.alterante.weave.transport.PacketTransport;
import com.alterante.weave.transport.WeaveChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * In-memory link between two endpoints, standing in for a GATT characteristic.
 *
 * A submission on one endpoint is delivered to the peer's receiver, then its
 * future completes. Faults can be injected per submission index (0-based, counted
 * per endpoint): a dropped submission reports success but is never delivered
 * (simulated loss), a failed one completes exceptionally and is not delivered.
 * While {@link #holdSubmissions(boolean) holding}, completions queue up until
 * {@link #releaseHeld()}.
 */
public class LoopbackTransport implements PacketTransport {

    private static final Logger log = LoggerFactory.getLogger(LoopbackTransport.class);

    /** Two connected endpoints. */
    public record Pair(LoopbackTransport left, LoopbackTransport right) {}

    private final String name;
    private final int maxPacketSize;
    private LoopbackTransport peer;
    private volatile Consumer<byte[]> receiver;

    private final AtomicInteger submissions = new AtomicInteger();
    private final Set<Integer> drops = ConcurrentHashMap.newKeySet();
    private final Map<Integer, Throwable> failures = new ConcurrentHashMap<>();
    private final Queue<Runnable> held = new ConcurrentLinkedQueue<>();
    private final List<byte[]> submitted = new ArrayList<>();
    private volatile boolean holding;

    private LoopbackTransport(String name, int maxPacketSize) {
        this.name = name;
        this.maxPacketSize = maxPacketSize;
    }

    /** Create two endpoints wired to each other. */
    public static Pair pair(int maxPacketSize) {
        LoopbackTransport left = new LoopbackTransport("left", maxPacketSize);
        LoopbackTransport right = new LoopbackTransport("right", maxPacketSize);
        left.peer = right;
        right.peer = left;
        return new Pair(left, right);
    }

    /** Deliver packets arriving at this endpoint to the given channel. */
    public void attach(WeaveChannel channel) {
        onReceive(data -> channel.onPacketReceived(data, data.length));
    }

    /** Set the consumer of packets arriving at this endpoint. */
    public void onReceive(Consumer<byte[]> receiver) {
        this.receiver = receiver;
    }

    @Override
    public int maxPacketSize() {
        return maxPacketSize;
    }

    @Override
    public CompletionStage<Void> submit(byte[] packet) {
        int index = submissions.getAndIncrement();
        synchronized (submitted) {
            submitted.add(packet.clone());
        }
        if (packet.length > maxPacketSize) {
            return CompletableFuture.failedFuture(new IOException(
                    "packet of " + packet.length + " bytes exceeds max packet size " + maxPacketSize));
        }

        CompletableFuture<Void> future = new CompletableFuture<>();
        Runnable completion = () -> {
            Throwable failure = failures.remove(index);
            if (failure != null) {
                log.debug("[{}] failing submission {}", name, index);
                future.completeExceptionally(failure);
                return;
            }
            if (drops.remove(index)) {
                log.debug("[{}] dropping submission {}", name, index);
            } else {
                peer.deliver(packet);
            }
            future.complete(null);
        };

        if (holding) {
            held.add(completion);
        } else {
            completion.run();
        }
        return future;
    }

    /** Report success for the given submission but never deliver it. */
    public void dropSubmission(int index) {
        drops.add(index);
    }

    /** Fail the given submission with {@code cause}. */
    public void failSubmission(int index, Throwable cause) {
        failures.put(index, cause);
    }

    /** While true, submissions are neither delivered nor completed until {@link #releaseHeld()}. */
    public void holdSubmissions(boolean hold) {
        this.holding = hold;
    }

    /**
     * Complete the submissions held at the time of the call, in order. Submissions
     * made while releasing are held for the next call.
     */
    public int releaseHeld() {
        List<Runnable> batch = new ArrayList<>();
        Runnable completion;
        while ((completion = held.poll()) != null) {
            batch.add(completion);
        }
        batch.forEach(Runnable::run);
        return batch.size();
    }

    /** Every packet handed to {@link #submit}, in order. */
    public List<byte[]> submittedPackets() {
        synchronized (submitted) {
            return new ArrayList<>(submitted);
        }
    }

    public int submissionCount() {
        return submissions.get();
    }

    private void deliver(byte[] packet) {
        Consumer<byte[]> r = receiver;
        if (r == null) {
            log.debug("[{}] no receiver, discarding {} bytes", name, packet.length);
            return;
        }
        r.accept(packet.clone());
    }
}
