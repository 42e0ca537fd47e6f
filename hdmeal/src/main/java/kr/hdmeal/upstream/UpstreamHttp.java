/*
* Copyright 2025 Taylor Ketterling
* Shared HTTP access for the HDMeal upstream connectors (NEIS, KMA, Seoul open data).
* Utilizes Java HttpClient for requests and Jackson for JSON processing.
*/

package kr.hdmeal.upstream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import kr.hdmeal.metrics.ExternalApiMetrics;
import kr.hdmeal.metrics.ExternalApiMetrics.Outcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.*;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Performs JSON GET requests against upstream providers and classifies
 * failures into transient and permanent {@link UpstreamException}s.
 *
 * <p>
 * Retries are not done here; the sync engine owns the retry policy.
 * </p>
 */
public final class UpstreamHttp {
    private static final Logger log = LoggerFactory.getLogger(UpstreamHttp.class);

    private final HttpClient http;
    private final ObjectMapper om;
    private final Duration timeout;

    /**
     * Creates a client whose requests each time out after {@code timeout}.
     */
    public UpstreamHttp(ObjectMapper om, Duration timeout) {
        this.om = om;
        this.timeout = timeout;
        this.http = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    /**
     * Performs a GET request and parses the body as JSON.
     */
    public JsonNode getJson(String provider, String url) throws UpstreamException {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET()
                .build();

        HttpResponse<String> resp;
        long t0 = System.currentTimeMillis();
        try {
            resp = http.send(req, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpTimeoutException e) {
            ExternalApiMetrics.record(provider, Outcome.TRANSIENT_FAILURE);
            throw new UpstreamException(provider, UpstreamException.Kind.TRANSIENT,
                    "timed out after " + timeout.toMillis() + "ms", e);
        } catch (IOException e) {
            ExternalApiMetrics.record(provider, Outcome.TRANSIENT_FAILURE);
            throw new UpstreamException(provider, UpstreamException.Kind.TRANSIENT, "I/O error: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpstreamException(provider, UpstreamException.Kind.TRANSIENT, "interrupted", e);
        }
        int ms = (int) (System.currentTimeMillis() - t0);

        int code = resp.statusCode();
        if (code < 200 || code >= 300) {
            boolean retryable = code == 429 || code >= 500;
            ExternalApiMetrics.record(provider, retryable ? Outcome.TRANSIENT_FAILURE : Outcome.PERMANENT_FAILURE);
            log.warn("{} request failed: status={} ms={}", provider, code, ms);
            throw new UpstreamException(provider,
                    retryable ? UpstreamException.Kind.TRANSIENT : UpstreamException.Kind.PERMANENT,
                    "HTTP " + code);
        }

        try {
            JsonNode json = om.readTree(resp.body());
            ExternalApiMetrics.record(provider, Outcome.OK);
            log.debug("{} response {} in {}ms", provider, code, ms);
            return json;
        } catch (JsonProcessingException e) {
            ExternalApiMetrics.record(provider, Outcome.PERMANENT_FAILURE);
            throw new UpstreamException(provider, UpstreamException.Kind.PERMANENT, "response is not JSON", e);
        }
    }

    /**
     * Builds a URL-encoded query string from ordered parameters.
     */
    public static String query(Map<String, String> params) {
        StringJoiner sj = new StringJoiner("&");
        for (var e : params.entrySet()) {
            sj.add(enc(e.getKey()) + "=" + enc(e.getValue()));
        }
        return sj.toString();
    }

    /**
     * URL-encodes a string for safe query parameters.
     */
    public static String enc(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }
}
