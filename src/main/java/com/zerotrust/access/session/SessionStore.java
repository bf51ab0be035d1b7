package com.zerotrust.access.session;

import com.zerotrust.access.domain.MonitoredSession;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Session rows owned by the session-lifecycle collaborator. Saves are idempotent
 * on retry; a saved {@code revoked=true} is never reset.
 */
public interface SessionStore {

    Optional<MonitoredSession> findById(String sessionId);

    MonitoredSession save(MonitoredSession session);

    /** Non-revoked, non-expired sessions with a risk score at or above the threshold. */
    List<String> findActiveSessionIdsAtOrAbove(double threshold, Instant now);

    /** Non-revoked, non-expired sessions whose next reevaluation is due. */
    List<String> findDueSessionIds(Instant now, int limit);
}
