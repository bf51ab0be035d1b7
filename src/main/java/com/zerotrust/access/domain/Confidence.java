package com.zerotrust.access.domain;

public enum Confidence {
    LOW,
    MEDIUM,
    HIGH
}
