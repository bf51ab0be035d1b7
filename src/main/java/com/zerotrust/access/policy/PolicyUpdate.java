package com.zerotrust.access.policy;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Partial update; null fields are left unchanged.
 */
@Value
@Builder
public class PolicyUpdate {
    String name;
    String description;
    Integer priority;
    String action;
    Map<String, Object> conditions;
    Boolean enabled;
}
