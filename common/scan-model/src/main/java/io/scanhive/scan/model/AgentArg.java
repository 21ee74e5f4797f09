package io.scanhive.scan.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotBlank;

/**
 * A single named argument handed to an agent. The value stays a raw string; the agent interprets it
 * according to {@code type}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AgentArg(@NotBlank String name, String type, String value) {
    public AgentArg {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("arg name must not be blank");
        }
        type = type == null || type.isBlank() ? "string" : type;
        value = value == null ? "" : value;
    }
}
