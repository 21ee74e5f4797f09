package io.scanhive.runtime.app;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingScanReporter implements ScanReporter {

    private static final Logger console = LoggerFactory.getLogger("scanhive.console");

    @Override
    public void info(String message) {
        console.info(message);
    }

    @Override
    public void success(String message) {
        console.info("[ok] {}", message);
    }

    @Override
    public void warning(String message) {
        console.warn(message);
    }

    @Override
    public void error(String message) {
        console.error(message);
    }
}
