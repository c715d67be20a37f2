package com.phillippitts.voicerelay.util;

import com.phillippitts.voicerelay.exception.CallCancelledException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation signal for one turn's outstanding work.
 *
 * <p>Resources register close actions with {@link #onCancel(Runnable)}; {@link #cancel()} runs
 * each action once. Actions registered after cancellation run immediately.
 */
public final class CancellationToken {

    private static final Logger LOG = LogManager.getLogger(CancellationToken.class);

    private final String callId;
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final List<Runnable> actions = new CopyOnWriteArrayList<>();

    public CancellationToken(String callId) {
        this.callId = callId;
    }

    public String callId() {
        return callId;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Throws if cancelled.
     *
     * @throws CallCancelledException when {@link #cancel()} was called
     */
    public void throwIfCancelled() {
        if (cancelled.get()) {
            throw new CallCancelledException(callId);
        }
    }

    public void onCancel(Runnable action) {
        actions.add(action);
        if (cancelled.get() && actions.remove(action)) {
            run(action);
        }
    }

    /** Cancels and runs the registered actions. Idempotent. */
    public void cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        for (Runnable action : actions) {
            if (actions.remove(action)) {
                run(action);
            }
        }
    }

    private void run(Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            LOG.warn("Cancellation action failed for call {}: {}", callId, e.toString());
        }
    }
}
