package com.zerotrust.access.risk.history;

import java.time.Instant;
import java.util.Set;

/**
 * Read side of the authentication event log used by the risk factors.
 */
public interface AuthHistory {

    long countFailedAttempts(String userId, Instant since);

    /** Successful and failed authentications since the given instant. */
    long countAuthAttempts(String userId, Instant since);

    /** Distinct location display strings the user's devices were last seen from. */
    Set<String> knownLocations(String userId);
}
