package com.example.healthintake.session;

import com.example.healthintake.model.SessionRecord;

import java.time.Duration;
import java.util.Optional;

/**
 * Durable per-user session persistence with sliding expiry.
 *
 * <p>Absent, expired, empty and unreadable records all come back as {@link Optional#empty()}.
 * Only infrastructure failures surface, as {@link SessionUnavailableException}.
 */
public interface SessionStore {

    Optional<SessionRecord> get(String userId);

    /**
     * Replaces the whole record and restarts its expiry at {@code ttl} from now. Last writer wins.
     */
    void put(String userId, SessionRecord session, Duration ttl);

    /**
     * Writes a new record unless a readable session already exists for the user.
     *
     * @return false when an existing session was left in place
     */
    boolean create(String userId, SessionRecord session, Duration ttl);
}
