package io.scanhive.docker;

import java.util.Locale;

public record ServiceTask(String id, String serviceId, String state) {
    public ServiceTask {
        state = state == null ? "" : state.toLowerCase(Locale.ROOT);
    }

    public boolean isRunning() {
        return "running".equals(state);
    }
}
