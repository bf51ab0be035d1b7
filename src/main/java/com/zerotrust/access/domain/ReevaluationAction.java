package com.zerotrust.access.domain;

public enum ReevaluationAction {
    NONE,
    MONITOR,
    STEPUP,
    REVOKE
}
