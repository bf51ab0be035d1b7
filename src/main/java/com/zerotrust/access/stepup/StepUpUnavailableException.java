package com.zerotrust.access.stepup;

public class StepUpUnavailableException extends RuntimeException {

    public StepUpUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
