package io.scanhive.runtime.support;

import io.scanhive.runtime.app.ScanReporter;
import java.util.ArrayList;
import java.util.List;

public class RecordingScanReporter implements ScanReporter {

    private final List<String> lines = new ArrayList<>();

    @Override
    public void info(String message) {
        lines.add("info:" + message);
    }

    @Override
    public void success(String message) {
        lines.add("success:" + message);
    }

    @Override
    public void warning(String message) {
        lines.add("warning:" + message);
    }

    @Override
    public void error(String message) {
        lines.add("error:" + message);
    }

    public List<String> lines() {
        return List.copyOf(lines);
    }

    public List<String> warnings() {
        return lines.stream().filter(line -> line.startsWith("warning:")).map(line -> line.substring(8)).toList();
    }

    public List<String> errors() {
        return lines.stream().filter(line -> line.startsWith("error:")).map(line -> line.substring(6)).toList();
    }
}
