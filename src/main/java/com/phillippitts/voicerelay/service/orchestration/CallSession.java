package com.phillippitts.voicerelay.service.orchestration;

import com.phillippitts.voicerelay.domain.ConversationContext;
import com.phillippitts.voicerelay.domain.ConversationTurn;
import com.phillippitts.voicerelay.domain.TurnResult;
import com.phillippitts.voicerelay.util.CancellationToken;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * State of one live call: its conversation context, turn counter and the turn chain.
 *
 * <p>Turns of a call run one after another; {@link #enqueue(Function)} chains each turn on the
 * previous one. The context only grows, and is discarded with the session.
 */
public final class CallSession {

    private final String callId;
    private final Instant startedAt;
    private final AtomicInteger turnCounter = new AtomicInteger();
    private final ReentrantLock lock = new ReentrantLock();

    private ConversationContext context;
    private CompletableFuture<TurnResult> tail = CompletableFuture.completedFuture(null);
    private CancellationToken currentTurn;
    private boolean ended;

    CallSession(String callId, ConversationContext context, Instant startedAt) {
        this.callId = Objects.requireNonNull(callId, "callId");
        this.context = Objects.requireNonNull(context, "context");
        this.startedAt = startedAt;
    }

    public String callId() {
        return callId;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public ConversationContext context() {
        lock.lock();
        try {
            return context;
        } finally {
            lock.unlock();
        }
    }

    /** Number of turns submitted so far. */
    public int turnCount() {
        return turnCounter.get();
    }

    public boolean isEnded() {
        lock.lock();
        try {
            return ended;
        } finally {
            lock.unlock();
        }
    }

    /** Flags the call as a multi-turn conversation for complexity scoring. */
    public void flagMultiTurn() {
        lock.lock();
        try {
            context = context.withMultiTurn(true);
        } finally {
            lock.unlock();
        }
    }

    /** Appends finalized turns in order. */
    void append(ConversationTurn... turns) {
        lock.lock();
        try {
            for (ConversationTurn turn : turns) {
                context = context.append(turn);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Chains a turn behind the previous one.
     *
     * @param turn runs the turn given its 1-based number; called once the previous turn finished
     * @return future of this turn's result
     */
    CompletableFuture<TurnResult> enqueue(Function<Integer, CompletableFuture<TurnResult>> turn) {
        lock.lock();
        try {
            int turnNumber = turnCounter.incrementAndGet();
            CompletableFuture<TurnResult> next = tail
                    .handle((previous, error) -> turnNumber)
                    .thenCompose(turn);
            tail = next;
            return next;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Registers the token of the turn that is starting.
     *
     * @return false when the call already ended; the token is then cancelled
     */
    boolean beginTurn(CancellationToken token) {
        lock.lock();
        try {
            if (ended) {
                token.cancel();
                return false;
            }
            currentTurn = token;
            return true;
        } finally {
            lock.unlock();
        }
    }

    void endTurn(CancellationToken token) {
        lock.lock();
        try {
            if (currentTurn == token) {
                currentTurn = null;
            }
        } finally {
            lock.unlock();
        }
    }

    /** Ends the call and cancels the turn in flight. Idempotent. */
    void hangup() {
        CancellationToken inFlight;
        lock.lock();
        try {
            ended = true;
            inFlight = currentTurn;
            currentTurn = null;
        } finally {
            lock.unlock();
        }
        if (inFlight != null) {
            inFlight.cancel();
        }
    }
}
