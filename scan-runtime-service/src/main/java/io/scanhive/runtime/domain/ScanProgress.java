package io.scanhive.runtime.domain;

/**
 * Lifecycle of a persisted scan. {@link #ERROR} and {@link #STOPPED} are terminal.
 */
public enum ScanProgress {
    CREATED,
    IN_PROGRESS,
    ERROR,
    STOPPED;

    public boolean isTerminal() {
        return this == ERROR || this == STOPPED;
    }

    /**
     * Allowed moves: CREATED to IN_PROGRESS, any live state to ERROR or STOPPED, and a terminal
     * state onto itself.
     */
    public boolean canTransitionTo(ScanProgress next) {
        if (next == null) {
            return false;
        }
        if (isTerminal()) {
            return next == this;
        }
        return switch (next) {
            case CREATED -> this == CREATED;
            case IN_PROGRESS -> this == CREATED || this == IN_PROGRESS;
            case ERROR, STOPPED -> true;
        };
    }
}
