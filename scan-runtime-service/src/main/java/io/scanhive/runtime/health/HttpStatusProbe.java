package io.scanhive.runtime.health;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link StatusProbe} issuing {@code GET http://<address>:<port><path>}; healthy iff status 200
 * and body exactly {@code OK}.
 */
public class HttpStatusProbe implements StatusProbe {

    static final String HEALTHY_BODY = "OK";

    private static final Logger log = LoggerFactory.getLogger(HttpStatusProbe.class);

    private final HttpClient httpClient;
    private final int port;
    private final String path;
    private final Duration timeout;

    public HttpStatusProbe(int port, String path, Duration timeout) {
        this(HttpClient.newBuilder().connectTimeout(timeout).build(), port, path, timeout);
    }

    HttpStatusProbe(HttpClient httpClient, int port, String path, Duration timeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.port = port;
        this.path = path.startsWith("/") ? path : "/" + path;
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    @Override
    public boolean isUp(String address) {
        URI uri = statusUri(address);
        HttpRequest request = HttpRequest.newBuilder(uri).timeout(timeout).GET().build();
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            boolean up = response.statusCode() == 200 && HEALTHY_BODY.equals(response.body());
            if (!up) {
                log.debug("{} answered {} {}", uri, response.statusCode(), response.body());
            }
            return up;
        } catch (IOException e) {
            log.info("unable to connect to {}", uri);
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    URI statusUri(String address) {
        String host = address.contains(":") && !address.startsWith("[") ? "[" + address + "]" : address;
        return URI.create("http://" + host + ":" + port + path);
    }
}
