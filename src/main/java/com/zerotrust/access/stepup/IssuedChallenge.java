package com.zerotrust.access.stepup;

import lombok.ToString;
import lombok.Value;

import java.time.Instant;

/**
 * Handed to the caller, which delivers {@code code} to the user out of band.
 */
@Value
public class IssuedChallenge {
    String token;
    @ToString.Exclude
    String code;
    Instant expiresAt;
}
