package com.alterante.weave.transport;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One-way cancellation signal shared between a caller and its write requests.
 * Listeners run once, on the thread that calls {@link #cancel()}.
 */
public final class CancellationFlag {

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    /** Raise the flag. Only the first call notifies listeners. */
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            for (Runnable listener : listeners) {
                if (listeners.remove(listener)) {
                    listener.run();
                }
            }
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /** Register a listener; runs immediately if the flag is already raised. */
    public void addListener(Runnable listener) {
        listeners.add(listener);
        if (cancelled.get() && listeners.remove(listener)) {
            listener.run();
        }
    }

    public void removeListener(Runnable listener) {
        listeners.remove(listener);
    }

    int listenerCount() {
        return listeners.size();
    }
}
