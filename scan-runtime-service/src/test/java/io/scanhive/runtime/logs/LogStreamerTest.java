package io.scanhive.runtime.logs;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.scanhive.docker.ClusterResourceManager;
import io.scanhive.docker.ClusterResourceNotFoundException;
import java.io.Closeable;
import java.io.IOException;
import org.junit.jupiter.api.Test;

class LogStreamerTest {

    private final ClusterResourceManager cluster = mock(ClusterResourceManager.class);

    @Test
    void attachFailureIsIgnored() {
        when(cluster.streamLogs(eq("agent_x_1"), any())).thenThrow(new ClusterResourceNotFoundException("gone"));
        LogStreamer streamer = new LogStreamer(cluster);

        streamer.stream("agent_x_1");

        assertThat(streamer.activeStreams()).isZero();
    }

    @Test
    void closeReleasesEveryHandleEvenWhenOneFails() throws IOException {
        Closeable failing = mock(Closeable.class);
        Closeable healthy = mock(Closeable.class);
        doThrow(new IOException("broken")).when(failing).close();
        when(cluster.streamLogs(eq("agent_a_1"), any())).thenReturn(failing);
        when(cluster.streamLogs(eq("agent_b_1"), any())).thenReturn(healthy);
        LogStreamer streamer = new LogStreamer(cluster);
        streamer.stream("agent_a_1");
        streamer.stream("agent_b_1");

        streamer.close();

        verify(failing).close();
        verify(healthy).close();
        assertThat(streamer.activeStreams()).isZero();
    }

    @Test
    void stopClosesOnlyThatServicesStream() throws IOException {
        Closeable first = mock(Closeable.class);
        Closeable second = mock(Closeable.class);
        when(cluster.streamLogs(eq("agent_a_1"), any())).thenReturn(first);
        when(cluster.streamLogs(eq("agent_a_2"), any())).thenReturn(second);
        LogStreamer streamer = new LogStreamer(cluster);
        streamer.stream("agent_a_1");
        streamer.stream("agent_a_2");

        streamer.stop("agent_a_1");
        streamer.stop("agent_a_1");

        verify(first, times(1)).close();
        verify(second, never()).close();
        assertThat(streamer.isFollowing("agent_a_1")).isFalse();
        assertThat(streamer.activeStreams()).isEqualTo(1);
    }

    @Test
    void followingAgainReplacesThePreviousStream() throws IOException {
        Closeable stale = mock(Closeable.class);
        Closeable fresh = mock(Closeable.class);
        when(cluster.streamLogs(eq("mq_1"), any())).thenReturn(stale, fresh);
        LogStreamer streamer = new LogStreamer(cluster);

        streamer.stream("mq_1");
        streamer.stream("mq_1");

        verify(stale).close();
        verify(fresh, never()).close();
        assertThat(streamer.activeStreams()).isEqualTo(1);
    }
}
