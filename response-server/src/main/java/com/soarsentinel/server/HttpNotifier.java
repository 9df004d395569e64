package com.soarsentinel.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.soarsentinel.core.model.Action;
import com.soarsentinel.core.model.Alert;
import com.soarsentinel.core.notify.Notifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Fire-and-forget {@link Notifier} that posts JSON to a dashboard gateway.
 *
 * <ul>
 * <li>{@code POST {base}/internal/alert}: one call per created alert, body is the alert.</li>
 * <li>{@code POST {base}/internal/device-status}: one call per executed action, body
 * {@code {"type":"response_action","alert_id","action","timestamp"}}.</li>
 * </ul>
 *
 * <p>
 * Requests are sent asynchronously with a per-request timeout and are never
 * retried. Failures are logged at warn level and never reach the caller.
 * </p>
 *
 * @since 1.0.0
 */
public class HttpNotifier implements Notifier {

    private static final Logger LOG = LoggerFactory.getLogger(HttpNotifier.class);

    static final String ALERT_PATH = "/internal/alert";
    static final String STATUS_PATH = "/internal/device-status";

    private final HttpClient client;
    private final ObjectMapper mapper;
    private final URI alertUri;
    private final URI statusUri;
    private final Duration timeout;
    private final Clock clock;

    public HttpNotifier(String baseUrl, Duration timeout, ObjectMapper mapper, Clock clock) {
        Objects.requireNonNull(baseUrl, "baseUrl must not be null");
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.alertUri = URI.create(base + ALERT_PATH);
        this.statusUri = URI.create(base + STATUS_PATH);
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.client = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
    }

    @Override
    public void alertRaised(Alert alert) {
        post(alertUri, alert, "alert " + alert.getAlertId());
    }

    @Override
    public void actionsExecuted(Alert alert, List<Action> actions) {
        for (Action action : actions) {
            Map<String, Object> event = new LinkedHashMap<>();
            event.put("type", "response_action");
            event.put("alert_id", alert.getAlertId());
            event.put("action", action);
            event.put("timestamp", clock.instant());
            post(statusUri, event, "action " + action.getActionId());
        }
    }

    /**
     * Post one JSON body.
     *
     * @return the pending response; completes normally even when delivery fails
     */
    CompletableFuture<Void> post(URI uri, Object body, String what) {
        byte[] json;
        try {
            json = mapper.writeValueAsBytes(body);
        } catch (JsonProcessingException e) {
            LOG.warn("Could not serialize notification for {}: {}", what, e.getOriginalMessage());
            return CompletableFuture.completedFuture(null);
        }

        HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofByteArray(json))
                .build();

        return client.sendAsync(request, HttpResponse.BodyHandlers.discarding())
                .handle((response, error) -> {
                    if (error != null) {
                        LOG.warn("Notification for {} to {} failed: {}", what, uri, error.toString());
                    } else if (response.statusCode() >= 300) {
                        LOG.warn("Notification for {} to {} returned HTTP {}", what, uri, response.statusCode());
                    } else {
                        LOG.debug("Notification for {} delivered", what);
                    }
                    return null;
                });
    }
}
