package com.example.healthintake.session;

import com.example.healthintake.context.FieldValues;
import com.example.healthintake.model.Fields;
import com.example.healthintake.model.RiskState;
import com.example.healthintake.model.SessionRecord;
import com.example.healthintake.model.Target;
import com.example.healthintake.model.Turn;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads and appends to a user's session, keeping only the most recent turns.
 *
 * <p>Every write refreshes the TTL, so an active conversation never expires mid-flow. Store failures
 * are recovered here: a failed read behaves as "no session", a failed write drops only this turn.
 * A turn recorded without a snapshot only starts a new session; it never replaces one that is stored.
 */
@Service
public class TurnRecorder {

    private static final Logger logger = LoggerFactory.getLogger(TurnRecorder.class);

    private final SessionStore sessionStore;

    @Value("${app.session.ttl-seconds:3600}")
    private long ttlSeconds;

    @Value("${app.session.history-window:10}")
    private int historyWindow;

    public TurnRecorder(SessionStore sessionStore) {
        this.sessionStore = sessionStore;
    }

    @PostConstruct
    void validateSettings() {
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("app.session.ttl-seconds must be positive, got " + ttlSeconds);
        }
        if (historyWindow <= 0) {
            throw new IllegalArgumentException("app.session.history-window must be positive, got " + historyWindow);
        }
    }

    public Optional<SessionRecord> currentSession(String userId) {
        try {
            return sessionStore.get(userId);
        } catch (SessionUnavailableException e) {
            logger.warn("Session store unavailable for user {}, continuing without history: {}", userId, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Appends {@code turn} to the snapshot the turn was processed against, evicts the oldest turns beyond
     * the history window and writes the session back. The store is not read again.
     *
     * @param snapshot session as read at the start of the request, null when there was none
     * @return the session as written (or as it would have been, when the write failed)
     */
    public SessionRecord recordTurn(String userId, SessionRecord snapshot, Turn turn) {
        SessionRecord base = snapshot != null
                ? snapshot
                : SessionRecord.builder().userId(userId).build();

        List<Turn> turns = new ArrayList<>(base.getTurns());
        turns.add(turn);
        int overflow = turns.size() - historyWindow;
        if (overflow > 0) {
            turns = new ArrayList<>(turns.subList(overflow, turns.size()));
            logger.debug("Evicted {} oldest turn(s) for user {}", overflow, userId);
        }

        SessionRecord updated = base.toBuilder()
                .userId(userId)
                .turns(turns)
                .build();
        if (turn.getTarget() == Target.TRIAGE) {
            carryRisk(updated, turn);
        }

        try {
            if (snapshot != null) {
                sessionStore.put(userId, updated, Duration.ofSeconds(ttlSeconds));
            } else if (!sessionStore.create(userId, updated, Duration.ofSeconds(ttlSeconds))) {
                logger.warn("Session for user {} was not readable at the start of the turn, turn not recorded", userId);
            }
        } catch (SessionUnavailableException e) {
            logger.error("Could not persist turn for user {}, its context contribution is lost", userId, e);
        }
        return updated;
    }

    private void carryRisk(SessionRecord session, Turn turn) {
        Integer tier = RiskState.tierOf(turn.getFields().get(Fields.CAPA));
        if (tier != null) {
            Integer current = session.getRiskHighWaterMark();
            session.setRiskHighWaterMark(current == null ? tier : Math.max(current, tier));
        }
        List<String> carried = session.getDangerReasons() != null ? session.getDangerReasons() : List.of();
        session.setDangerReasons(FieldValues.unionReasons(carried, FieldValues.toStringList(turn.getFields().get(Fields.RAZONES))));
    }
}
