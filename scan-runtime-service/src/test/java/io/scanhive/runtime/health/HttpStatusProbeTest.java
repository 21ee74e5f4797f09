package io.scanhive.runtime.health;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.net.ConnectException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class HttpStatusProbeTest {

    private final HttpClient httpClient = mock(HttpClient.class);
    private final HttpStatusProbe probe = new HttpStatusProbe(httpClient, 5000, "/status", Duration.ofSeconds(1));

    @Test
    void upWhenStatusAnswersOk() throws Exception {
        stubResponse(200, "OK");

        assertThat(probe.isUp("10.0.0.2")).isTrue();
    }

    @Test
    void downWhenBodyIsNotExactlyOk() throws Exception {
        stubResponse(200, "OK\n");

        assertThat(probe.isUp("10.0.0.2")).isFalse();
    }

    @Test
    void downWhenStatusIsNot200() throws Exception {
        stubResponse(503, "OK");

        assertThat(probe.isUp("10.0.0.2")).isFalse();
    }

    @Test
    void connectionFailureIsNotHealthy() throws Exception {
        when(httpClient.send(any(HttpRequest.class), any())).thenThrow(new ConnectException("refused"));

        assertThat(probe.isUp("10.0.0.2")).isFalse();
    }

    @Test
    void buildsStatusUriForIpv4AndIpv6() {
        assertThat(probe.statusUri("10.0.0.2").toString()).isEqualTo("http://10.0.0.2:5000/status");
        assertThat(probe.statusUri("fd00::2").toString()).isEqualTo("http://[fd00::2]:5000/status");
    }

    @SuppressWarnings("unchecked")
    private void stubResponse(int status, String body) throws IOException, InterruptedException {
        HttpResponse<Object> response = mock(HttpResponse.class);
        when(response.statusCode()).thenReturn(status);
        when(response.body()).thenReturn(body);
        when(httpClient.send(any(HttpRequest.class), any())).thenReturn(response);
    }
}
