package com.example.healthintake.session;

import com.example.healthintake.kv.KvClient;
import com.example.healthintake.model.SessionRecord;
import com.example.healthintake.model.Turn;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

@Component
public class RedisSessionStore implements SessionStore {

    private static final Logger logger = LoggerFactory.getLogger(RedisSessionStore.class);

    static final String KEY_PREFIX = "session:";

    private final KvClient kvClient;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public RedisSessionStore(KvClient kvClient, ObjectMapper objectMapper, Clock clock) {
        this.kvClient = kvClient;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public Optional<SessionRecord> get(String userId) {
        String key = KEY_PREFIX + userId;
        Optional<String> raw;
        try {
            raw = kvClient.get(key);
        } catch (RuntimeException e) {
            throw new SessionUnavailableException("Session read failed for " + key, e);
        }
        if (raw.isEmpty()) {
            return Optional.empty();
        }

        SessionRecord record;
        try {
            record = objectMapper.readValue(raw.get(), SessionRecord.class);
        } catch (JsonProcessingException e) {
            logger.warn("Discarding malformed session record for user {}: {}", userId, e.getOriginalMessage());
            return Optional.empty();
        }

        if (record == null || record.getTurns() == null
                || record.getTurns().stream().anyMatch(RedisSessionStore::isPartial)) {
            logger.warn("Discarding partial session record for user {}", userId);
            return Optional.empty();
        }
        if (record.getExpiresAt() != null && !record.getExpiresAt().isAfter(clock.instant())) {
            logger.debug("Session for user {} expired at {}", userId, record.getExpiresAt());
            return Optional.empty();
        }
        if (!record.hasTurns()) {
            return Optional.empty();
        }
        return Optional.of(record);
    }

    @Override
    public void put(String userId, SessionRecord session, Duration ttl) {
        String key = KEY_PREFIX + userId;
        if (session == null || !session.hasTurns()) {
            // An empty session is the same as no session; never give it a fresh TTL
            logger.debug("Refusing to persist empty session for user {}", userId);
            return;
        }

        SessionRecord toWrite = stamp(userId, session, ttl);
        String json = serialize(key, toWrite);
        try {
            kvClient.set(key, json, ttl);
            logger.debug("Session {} written with {} turns, expires at {}",
                    key, toWrite.getTurns().size(), toWrite.getExpiresAt());
        } catch (RuntimeException e) {
            throw new SessionUnavailableException("Session write failed for " + key, e);
        }
    }

    @Override
    public boolean create(String userId, SessionRecord session, Duration ttl) {
        String key = KEY_PREFIX + userId;
        if (session == null || !session.hasTurns()) {
            logger.debug("Refusing to persist empty session for user {}", userId);
            return false;
        }

        String json = serialize(key, stamp(userId, session, ttl));
        boolean written;
        try {
            written = kvClient.setIfAbsent(key, json, ttl);
        } catch (RuntimeException e) {
            throw new SessionUnavailableException("Session write failed for " + key, e);
        }
        if (written) {
            logger.debug("Session {} created", key);
            return true;
        }

        // Something is already stored; only an unreadable or expired leftover may be replaced
        if (get(userId).isPresent()) {
            logger.warn("Session {} already exists, keeping it instead of starting a new one", key);
            return false;
        }
        put(userId, session, ttl);
        return true;
    }

    private SessionRecord stamp(String userId, SessionRecord session, Duration ttl) {
        return session.toBuilder()
                .userId(userId)
                .expiresAt(clock.instant().plus(ttl))
                .build();
    }

    private String serialize(String key, SessionRecord session) {
        try {
            return objectMapper.writeValueAsString(session);
        } catch (JsonProcessingException e) {
            throw new SessionUnavailableException("Session serialization failed for " + key, e);
        }
    }

    private static boolean isPartial(Turn turn) {
        return turn == null || turn.getTarget() == null || turn.getFields() == null;
    }
}
