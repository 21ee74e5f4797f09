package io.scanhive.runtime.logs;

import io.scanhive.docker.ClusterResourceManager;
import java.io.Closeable;
import java.io.IOException;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Best-effort relay of service output into the runtime log, one stream per service. Failing to
 * attach is logged and otherwise ignored.
 */
public class LogStreamer implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(LogStreamer.class);
    private static final Logger serviceLog = LoggerFactory.getLogger("scanhive.services");

    private final ClusterResourceManager cluster;
    private final Map<String, Closeable> handles = new ConcurrentHashMap<>();

    public LogStreamer(ClusterResourceManager cluster) {
        this.cluster = Objects.requireNonNull(cluster, "cluster");
    }

    public void stream(String serviceName) {
        Closeable handle;
        try {
            handle = cluster.streamLogs(serviceName, line -> serviceLog.info("[{}] {}", serviceName, line));
        } catch (RuntimeException e) {
            log.warn("unable to follow logs of {}: {}", serviceName, e.getMessage());
            return;
        }
        log.debug("following logs of {}", serviceName);
        Closeable previous = handles.put(serviceName, handle);
        if (previous != null) {
            closeQuietly(serviceName, previous);
        }
    }

    /**
     * Stops following {@code serviceName}; a no-op when its logs are not followed.
     */
    public void stop(String serviceName) {
        Closeable handle = handles.remove(serviceName);
        if (handle != null) {
            log.debug("no longer following logs of {}", serviceName);
            closeQuietly(serviceName, handle);
        }
    }

    boolean isFollowing(String serviceName) {
        return handles.containsKey(serviceName);
    }

    int activeStreams() {
        return handles.size();
    }

    @Override
    public void close() {
        for (String serviceName : handles.keySet()) {
            stop(serviceName);
        }
    }

    private static void closeQuietly(String serviceName, Closeable handle) {
        try {
            handle.close();
        } catch (IOException e) {
            log.warn("unable to close log stream of {}: {}", serviceName, e.getMessage());
        }
    }
}
