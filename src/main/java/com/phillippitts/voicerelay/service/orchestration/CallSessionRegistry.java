package com.phillippitts.voicerelay.service.orchestration;

import com.phillippitts.voicerelay.domain.ConversationContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Live calls by call identifier.
 *
 * <p>A call starts with {@link #startCall}, and {@link #hangup} ends it: the turn in flight is
 * cancelled and the session with its conversation context is dropped.
 */
@Component
public class CallSessionRegistry {

    private static final Logger LOG = LogManager.getLogger(CallSessionRegistry.class);

    private final ConcurrentMap<String, CallSession> sessions = new ConcurrentHashMap<>();
    private final Clock clock;

    public CallSessionRegistry(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Starts a call.
     *
     * @param callId         call identifier from the telephony layer
     * @param tenantId       tenant owning the call
     * @param agentConfigRef agent configuration reference
     * @param regionHint     caller's region (nullable)
     * @return the new session
     * @throws IllegalStateException if the call is already live
     */
    public CallSession startCall(String callId, String tenantId, String agentConfigRef, String regionHint) {
        Objects.requireNonNull(callId, "callId");
        CallSession session = new CallSession(callId,
                ConversationContext.start(tenantId, agentConfigRef, regionHint), clock.instant());
        if (sessions.putIfAbsent(callId, session) != null) {
            throw new IllegalStateException("Call already started: " + callId);
        }
        LOG.info("Call started: callId={}, tenant={}, region={}", callId, tenantId, regionHint);
        return session;
    }

    public Optional<CallSession> find(String callId) {
        return Optional.ofNullable(sessions.get(callId));
    }

    /**
     * Ends a call, cancelling its turn in flight. Unknown calls are ignored.
     *
     * @return true if the call was live
     */
    public boolean hangup(String callId) {
        CallSession session = sessions.remove(callId);
        if (session == null) {
            LOG.debug("Hangup for unknown call {}", callId);
            return false;
        }
        session.hangup();
        LOG.info("Call ended: callId={}, turns={}", callId, session.turnCount());
        return true;
    }

    public int activeCalls() {
        return sessions.size();
    }

    @Scheduled(fixedDelay = 60_000)
    void logActiveCalls() {
        if (!sessions.isEmpty()) {
            LOG.info("Active calls: {}", sessions.size());
        }
    }
}
