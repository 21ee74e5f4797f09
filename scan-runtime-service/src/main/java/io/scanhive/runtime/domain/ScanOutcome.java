package io.scanhive.runtime.domain;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of a scan request that did not propagate an exception.
 *
 * @param scanId   id of the persisted scan
 * @param progress progress of the scan once the request returned
 * @param failure  failure that stopped the sequence, {@code null} on success
 */
public record ScanOutcome(long scanId, ScanProgress progress, ScanFailure failure) {
    public ScanOutcome {
        progress = Objects.requireNonNull(progress, "progress");
    }

    public static ScanOutcome started(long scanId) {
        return new ScanOutcome(scanId, ScanProgress.IN_PROGRESS, null);
    }

    public static ScanOutcome failed(long scanId, ScanProgress progress, ScanFailure failure) {
        return new ScanOutcome(scanId, progress, Objects.requireNonNull(failure, "failure"));
    }

    public boolean succeeded() {
        return failure == null;
    }

    public Optional<ScanFailure> failureIfAny() {
        return Optional.ofNullable(failure);
    }
}
