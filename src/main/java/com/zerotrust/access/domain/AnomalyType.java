package com.zerotrust.access.domain;

public enum AnomalyType {
    IMPOSSIBLE_TRAVEL,
    LOCATION_DRIFT,
    IP_CHANGE,
    DEVICE_CHANGE,
    UNUSUAL_HOUR,
    EXCESSIVE_ACCESS,
    SENSITIVE_ACCESS
}
