package io.scanhive.runtime.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Persisted scan record. Rows are never deleted; terminal scans stay as history.
 */
public record Scan(long id, String title, String asset, ScanProgress progress, Instant createdTime) {
    public Scan {
        progress = Objects.requireNonNull(progress, "progress");
    }

    /**
     * Label value tying cluster resources to this scan.
     */
    public String universe() {
        return Long.toString(id);
    }
}
