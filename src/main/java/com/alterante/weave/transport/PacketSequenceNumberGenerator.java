package com.alterante.weave.transport;

import com.alterante.weave.protocol.PacketFormat;

/**
 * Cyclic counter stamped into each outgoing packet header.
 *
 * One instance per logical connection. Values wrap to 0 after
 * {@link PacketFormat#maxCounter()}.
 *
 * Thread-safety: callers must synchronize externally.
 */
public class PacketSequenceNumberGenerator {

    private static final int INITIAL_VALUE = 0;

    private final int counterSpace;
    private int nextValue = INITIAL_VALUE;

    public PacketSequenceNumberGenerator(PacketFormat format) {
        this.counterSpace = format.counterSpace();
    }

    /** Return the current value and advance. */
    public int next() {
        int value = nextValue;
        nextValue = (nextValue + 1) % counterSpace;
        return value;
    }

    /** The value the next call to {@link #next()} will return. */
    public int peek() {
        return nextValue;
    }

    /** Start over for a new logical connection. */
    public void reset() {
        nextValue = INITIAL_VALUE;
    }

    public int counterSpace() {
        return counterSpace;
    }
}
