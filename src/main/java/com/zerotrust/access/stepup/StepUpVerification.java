package com.zerotrust.access.stepup;

import lombok.Value;

@Value
public class StepUpVerification {

    VerificationOutcome outcome;
    /** The consumed challenge, present only when verified. */
    StepUpChallenge challenge;

    public boolean isVerified() {
        return outcome == VerificationOutcome.VERIFIED;
    }

    public static StepUpVerification failed(VerificationOutcome outcome) {
        return new StepUpVerification(outcome, null);
    }
}
