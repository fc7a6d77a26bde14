package warmpool.cloud.agent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import warmpool.orchestrator.error.PoolException;
import warmpool.orchestrator.provider.HealthProbe;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * GET on the workload health path; any 2xx counts as healthy. Connection
 * errors are thrown so the caller's poller can report the last one.
 */
public class HttpHealthProbe implements HealthProbe {

    private static final Logger log = LoggerFactory.getLogger(HttpHealthProbe.class);

    private final HttpClient http;
    private final int port;
    private final String path;
    private final Duration timeout;

    public HttpHealthProbe(int port, String path, Duration timeout) {
        this.http = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
        this.port = port;
        this.path = path.startsWith("/") ? path : "/" + path;
        this.timeout = timeout;
    }

    @Override
    public boolean isHealthy(String address) {
        URI uri = URI.create("http://" + address + ":" + port + path);
        try {
            HttpResponse<Void> resp = http.send(HttpRequest.newBuilder()
                    .uri(uri)
                    .timeout(timeout)
                    .GET()
                    .build(), HttpResponse.BodyHandlers.discarding());
            log.debug("Health {} -> {}", uri, resp.statusCode());
            return resp.statusCode() >= 200 && resp.statusCode() < 300;
        } catch (IOException e) {
            throw new UncheckedIOException("Health check " + uri + " failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PoolException("Interrupted during health check " + uri, e);
        }
    }
}
