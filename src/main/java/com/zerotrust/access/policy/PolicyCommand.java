package com.zerotrust.access.policy;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Full description of a policy to create.
 */
@Value
@Builder
public class PolicyCommand {

    @NotBlank
    @Size(max = 100)
    String name;

    @Size(max = 500)
    String description;

    @NotNull
    Integer priority;

    @NotBlank
    @Pattern(regexp = "(?i)allow|stepup|deny", message = "must be one of allow, stepup, deny")
    String action;

    Map<String, Object> conditions;

    @Builder.Default
    boolean enabled = true;
}
