package com.github.salilvnair.supportrouter.memory;

import com.github.salilvnair.supportrouter.config.SupportRouterProperties;
import com.github.salilvnair.supportrouter.escalation.EscalationState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Process-lifetime session store.
 * <p>
 * Each session has its own lock; requests for different sessions never contend. Callers run the
 * whole read-modify-write of a turn inside {@link #withSessionLock}, and {@link #update} is the only
 * way to change a session. Lead score and escalation are merged so that they can only move up.
 */
@Slf4j
@Component
public class ConversationMemory {

    private final Map<String, SessionHolder> sessions = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration ttl;

    public ConversationMemory(SupportRouterProperties properties, Clock clock) {
        this.clock = clock;
        this.ttl = properties.getSession().getTtl();
    }

    /**
     * Runs {@code work} while holding the session's exclusive lock.
     */
    public <T> T withSessionLock(String sessionId, Supplier<T> work) {
        SessionHolder holder = lockHolder(sessionId);
        try {
            return work.get();
        }
        finally {
            holder.lock.unlock();
        }
    }

    /** Current state, or a fresh snapshot when the session has not committed a turn yet. */
    public SessionSnapshot snapshot(String sessionId) {
        SessionHolder holder = sessions.get(sessionId);
        SessionSnapshot snapshot = holder == null ? null : holder.snapshot;
        return snapshot != null ? snapshot : SessionSnapshot.fresh(sessionId, clock.instant());
    }

    public Optional<SessionSnapshot> find(String sessionId) {
        SessionHolder holder = sessions.get(sessionId);
        return Optional.ofNullable(holder == null ? null : holder.snapshot);
    }

    /**
     * Merges one turn into the session, creating it on first use. The merge is all-or-nothing.
     */
    public SessionSnapshot update(String sessionId, SessionUpdate update) {
        SessionHolder holder = lockHolder(sessionId);
        try {
            SessionSnapshot current = holder.snapshot != null
                    ? holder.snapshot
                    : SessionSnapshot.fresh(sessionId, clock.instant());
            SessionSnapshot merged = merge(current, update);
            holder.snapshot = merged;
            holder.lastTouched = merged.lastActivity();
            return merged;
        }
        finally {
            holder.lock.unlock();
        }
    }

    /** Forgets the session, including its escalation. */
    public void reset(String sessionId) {
        SessionHolder holder = lockHolder(sessionId);
        try {
            sessions.remove(sessionId, holder);
            log.info("Session reset sessionId={}", sessionId);
        }
        finally {
            holder.lock.unlock();
        }
    }

    /**
     * Removes sessions idle for longer than the configured TTL. Sessions locked by an in-flight
     * request are left alone.
     *
     * @return number of sessions removed
     */
    public int reapExpired() {
        Instant cutoff = clock.instant().minus(ttl);
        int removed = 0;
        Iterator<Map.Entry<String, SessionHolder>> it = sessions.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, SessionHolder> entry = it.next();
            SessionHolder holder = entry.getValue();
            if (!holder.lastTouched.isBefore(cutoff) || !holder.lock.tryLock()) {
                continue;
            }
            try {
                if (holder.lastTouched.isBefore(cutoff) && sessions.remove(entry.getKey(), holder)) {
                    removed++;
                }
            }
            finally {
                holder.lock.unlock();
            }
        }
        return removed;
    }

    public int size() {
        return sessions.size();
    }

    private SessionHolder lockHolder(String sessionId) {
        while (true) {
            SessionHolder holder = sessions.computeIfAbsent(sessionId, id -> new SessionHolder(clock.instant()));
            holder.lock.lock();
            // the reaper or a reset may have removed this holder before we locked it
            if (sessions.get(sessionId) == holder) {
                return holder;
            }
            holder.lock.unlock();
        }
    }

    private SessionSnapshot merge(SessionSnapshot current, SessionUpdate update) {
        int leadScore = update.leadScore();
        if (leadScore < current.leadScore()) {
            log.warn("Lead score regression rejected sessionId={} current={} update={}",
                    current.sessionId(), current.leadScore(), leadScore);
            leadScore = current.leadScore();
        }
        boolean escalated = current.escalated() || update.escalated();
        if (current.escalated() && !update.escalated()) {
            log.warn("Escalation downgrade rejected sessionId={}", current.sessionId());
        }
        EscalationState state = current.escalationState().atLeast(update.escalationState());
        if (escalated) {
            state = EscalationState.ESCALATED;
        }

        Map<String, String> facts = new LinkedHashMap<>(current.knownFacts());
        facts.putAll(update.newFacts());

        return current.toBuilder()
                .turnCount(current.turnCount() + 1)
                .leadScore(leadScore)
                .knownFacts(facts)
                .escalated(escalated)
                .escalationState(state)
                .escalatedCategory(current.escalatedCategory() != null ? current.escalatedCategory() : update.escalatedCategory())
                .lastSentiment(update.sentiment())
                .consecutiveAngryTurns(update.consecutiveAngryTurns())
                .consecutiveFrustratedTurns(update.consecutiveFrustratedTurns())
                .highValueHits(current.highValueHits() + (update.highValueHit() ? 1 : 0))
                .lastActivity(clock.instant())
                .build();
    }

    private static final class SessionHolder {
        private final ReentrantLock lock = new ReentrantLock();
        private volatile SessionSnapshot snapshot;
        private volatile Instant lastTouched;

        private SessionHolder(Instant created) {
            this.lastTouched = created;
        }
    }
}
