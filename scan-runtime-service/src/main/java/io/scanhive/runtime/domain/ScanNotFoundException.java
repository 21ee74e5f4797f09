package io.scanhive.runtime.domain;

public class ScanNotFoundException extends RuntimeException {

    private final long scanId;

    public ScanNotFoundException(long scanId) {
        super("Scan " + scanId + " not found");
        this.scanId = scanId;
    }

    public long scanId() {
        return scanId;
    }
}
