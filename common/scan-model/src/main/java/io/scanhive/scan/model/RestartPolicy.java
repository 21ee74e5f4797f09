package io.scanhive.scan.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Restart behaviour of an agent service. {@link #NONE} marks a run-once agent that is expected to
 * finish and exit, every other value a long-running one.
 */
public enum RestartPolicy {
    ANY("any"),
    ON_FAILURE("on-failure"),
    NONE("none");

    private final String value;

    RestartPolicy(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public boolean isRunOnce() {
        return this == NONE;
    }

    @JsonCreator
    public static RestartPolicy fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return ANY;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (RestartPolicy policy : values()) {
            if (policy.value.equals(normalized)) {
                return policy;
            }
        }
        // "always" and "unless-stopped" are accepted as aliases of the long-running policy.
        if ("always".equals(normalized) || "unless-stopped".equals(normalized)) {
            return ANY;
        }
        throw new IllegalArgumentException("Unknown restart policy '" + raw + "'");
    }
}
