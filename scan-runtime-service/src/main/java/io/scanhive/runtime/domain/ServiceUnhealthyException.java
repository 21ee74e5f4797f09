package io.scanhive.runtime.domain;

import java.util.Objects;

/**
 * Raised when a scan's infrastructure service never becomes healthy. It is not handled by the
 * scan sequence: the record keeps its progress and created resources stay in place.
 */
public class ServiceUnhealthyException extends RuntimeException {

    private final long scanId;
    private final ScanFailure failure;

    public ServiceUnhealthyException(long scanId, ScanFailure failure) {
        super(Objects.requireNonNull(failure, "failure").message());
        this.scanId = scanId;
        this.failure = failure;
    }

    public long scanId() {
        return scanId;
    }

    public ScanFailure failure() {
        return failure;
    }
}
