package io.scanhive.runtime.app;

/**
 * Leveled status output shown to whoever drives the runtime.
 */
public interface ScanReporter {

    void info(String message);

    void success(String message);

    void warning(String message);

    void error(String message);
}
