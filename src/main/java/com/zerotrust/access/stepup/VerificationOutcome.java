package com.zerotrust.access.stepup;

public enum VerificationOutcome {
    VERIFIED,
    UNKNOWN_TOKEN,
    EXPIRED,
    INVALID_PROOF,
    /** Too many wrong codes; the challenge was discarded. */
    LOCKED,
    STORE_UNAVAILABLE
}
