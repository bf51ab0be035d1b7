package com.zerotrust.access.domain;

/**
 * Lifecycle state of a session as seen by the monitor.
 * Everything except {@link #ACTIVE} is terminal for reevaluation.
 */
public enum SessionState {
    ACTIVE,
    REVOKED,
    EXPIRED,
    NOT_FOUND,
    /** The session store could not be read; nothing was changed. */
    UNAVAILABLE;

    public boolean isTerminal() {
        return this != ACTIVE;
    }
}
