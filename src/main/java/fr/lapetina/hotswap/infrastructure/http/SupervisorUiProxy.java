package fr.lapetina.hotswap.infrastructure.http;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Pass-through proxy to the process supervisor's own web UI.
 */
public final class SupervisorUiProxy {

    private static final Logger log = LoggerFactory.getLogger(SupervisorUiProxy.class);

    private final HttpClient httpClient;
    private final URI uiUrl;
    private final Duration timeout;

    public SupervisorUiProxy(URI uiUrl, Duration timeout) {
        this.uiUrl = uiUrl;
        this.timeout = timeout;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();
    }

    /**
     * Fetches {@code relativePath?query} from the supervisor UI.
     *
     * @throws IOException if the supervisor UI cannot be reached
     */
    public HttpResponse<byte[]> get(String relativePath, String query) throws IOException, InterruptedException {
        String target = WorkerHttpClient.resolve(uiUrl, relativePath.isEmpty() ? "/" : relativePath).toString();
        if (query != null && !query.isEmpty()) {
            target += "?" + query;
        }
        log.debug("Proxying supervisor UI request: target={}", target);
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(target))
                .timeout(timeout)
                .GET()
                .build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
    }
}
