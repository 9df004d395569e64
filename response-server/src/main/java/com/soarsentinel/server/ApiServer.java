package com.soarsentinel.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.soarsentinel.core.correlation.AlertCorrelator;
import com.soarsentinel.core.correlation.AlertFilter;
import com.soarsentinel.core.correlation.Correlation;
import com.soarsentinel.core.defense.DefenseSnapshot;
import com.soarsentinel.core.defense.StateCorruptionException;
import com.soarsentinel.core.model.Action;
import com.soarsentinel.core.model.ActionType;
import com.soarsentinel.core.model.Alert;
import com.soarsentinel.core.model.Anomaly;
import com.soarsentinel.core.model.TelemetryEvent;
import com.soarsentinel.core.model.ThreatRule;
import com.soarsentinel.core.model.ValidationException;
import com.soarsentinel.core.pipeline.PipelineResult;
import com.soarsentinel.core.pipeline.SoarPipeline;
import com.soarsentinel.core.response.ResponseOrchestrator;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * JSON-over-HTTP front end of the response server.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>{@code GET /health}, {@code GET /rules}, {@code GET /metrics}</li>
 * <li>{@code POST /analyze}, {@code POST /analyze/batch}</li>
 * <li>{@code POST /create}, {@code GET /alerts}, {@code POST /alerts/{id}/acknowledge},
 * {@code POST /alerts/acknowledge-all}, {@code DELETE /alerts/{id}},
 * {@code DELETE /alerts/acknowledged}</li>
 * <li>{@code POST /execute}, {@code GET /status}, {@code GET /actions}</li>
 * <li>{@code POST|DELETE /block/{ip}}, {@code POST|DELETE /throttle/{ip}},
 * {@code POST|DELETE /isolate/{service}}, {@code DELETE /reset}</li>
 * </ul>
 *
 * <h3>Errors</h3>
 * <p>
 * Malformed input answers 400 with {@code {"error":"validation_failed","field","message"}},
 * unknown alerts and routes 404, unsupported methods 405, state corruption and
 * unexpected failures 500.
 * </p>
 *
 * <p>
 * Uses the JDK built-in {@link HttpServer}.
 * </p>
 *
 * @since 1.0.0
 */
public class ApiServer {

    private static final Logger LOG = LoggerFactory.getLogger(ApiServer.class);

    static final String SERVICE_NAME = "soar-sentinel";
    static final int DEFAULT_ACTIONS_LIMIT = 50;
    private static final int WORKER_THREADS = 8;

    private final SoarPipeline pipeline;
    private final ObjectMapper mapper;
    private final String version;

    private HttpServer server;
    private ExecutorService executor;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public ApiServer(SoarPipeline pipeline, ObjectMapper mapper, String version) {
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        this.version = Objects.requireNonNull(version, "version must not be null");
    }

    /**
     * Start serving on the given port.
     *
     * @param port TCP port to bind to; 0 picks an ephemeral port
     * @throws IllegalArgumentException if port is out of range
     * @throws IllegalStateException    if the port cannot be bound
     */
    public void start(int port) {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException("Port must be in range [0, 65535], got: " + port);
        }
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to bind API server on port " + port + ": " + e.getMessage(), e);
        }
        server.createContext("/", this::handle);

        AtomicInteger threadIds = new AtomicInteger();
        executor = Executors.newFixedThreadPool(WORKER_THREADS, r -> {
            Thread t = new Thread(r, "api-worker-" + threadIds.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);

        server.start();
        running.set(true);
        LOG.info("API server started on port {}", getPort());
    }

    /**
     * Stop the server gracefully.
     */
    public void stop() {
        if (server != null && running.compareAndSet(true, false)) {
            server.stop(0);
            executor.shutdownNow();
            LOG.info("API server stopped");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * @return the bound port, useful when started on port 0
     */
    public int getPort() {
        if (server == null) {
            throw new IllegalStateException("API server is not started");
        }
        return server.getAddress().getPort();
    }

    // ---------------------------------------------------------------
    // Dispatch
    // ---------------------------------------------------------------

    private void handle(HttpExchange exchange) throws IOException {
        String method = exchange.getRequestMethod().toUpperCase();
        String path = exchange.getRequestURI().getPath();
        try {
            Request request = new Request(method, path, parseQuery(exchange.getRequestURI().getRawQuery()),
                    exchange.getRequestBody());
            Object body = route(request);
            send(exchange, 200, body);
        } catch (ApiException e) {
            send(exchange, e.getStatus(), error(e.getError(), null, e.getMessage()));
        } catch (ValidationException e) {
            LOG.debug("Rejected {} {}: {}", method, path, e.getMessage());
            send(exchange, 400, error("validation_failed", e.getField(), e.getMessage()));
        } catch (JsonMappingException e) {
            String field = fieldPath(e);
            LOG.debug("Rejected {} {}: {}", method, path, e.getOriginalMessage());
            send(exchange, 400, error("validation_failed", field, e.getOriginalMessage()));
        } catch (JsonProcessingException e) {
            send(exchange, 400, error("validation_failed", "body", "Malformed JSON: " + e.getOriginalMessage()));
        } catch (StateCorruptionException e) {
            LOG.error("State corruption while handling {} {}", method, path, e);
            send(exchange, 500, error("state_corruption", null, e.getMessage()));
        } catch (RuntimeException e) {
            LOG.error("Unexpected failure while handling {} {}", method, path, e);
            send(exchange, 500, error("internal_error", null, e.getClass().getSimpleName()));
        }
    }

    private Object route(Request req) throws IOException {
        String[] s = req.segments;
        if (s.length == 0) {
            throw ApiException.notFound("No route for " + req.method + " " + req.path);
        }
        switch (s[0]) {
            case "health":
                req.expectSegments(1).allow("GET");
                return health();
            case "rules":
                req.expectSegments(1).allow("GET");
                return rules();
            case "metrics":
                req.expectSegments(1).allow("GET");
                return pipeline.getMetrics().snapshot();
            case "analyze":
                if (s.length == 2 && "batch".equals(s[1])) {
                    req.allow("POST");
                    return analyzeBatch(req);
                }
                req.expectSegments(1).allow("POST");
                return analyze(req);
            case "create":
                req.expectSegments(1).allow("POST");
                return create(req);
            case "alerts":
                return alerts(req);
            case "execute":
                req.expectSegments(1).allow("POST");
                return execute(req);
            case "status":
                req.expectSegments(1).allow("GET");
                return orchestrator().getStore().snapshot();
            case "actions":
                req.expectSegments(1).allow("GET");
                return actions(req);
            case "block":
                req.expectSegments(2).allow("POST", "DELETE");
                return "POST".equals(req.method) ? orchestrator().block(s[1]) : orchestrator().unblock(s[1]);
            case "throttle":
                req.expectSegments(2).allow("POST", "DELETE");
                return "POST".equals(req.method)
                        ? orchestrator().throttle(s[1], req.intParam("limit", orchestrator().getThrottleLimit()))
                        : orchestrator().removeThrottle(s[1]);
            case "isolate":
                req.expectSegments(2).allow("POST", "DELETE");
                return "POST".equals(req.method) ? orchestrator().isolate(s[1]) : orchestrator().restore(s[1]);
            case "reset":
                req.expectSegments(1).allow("DELETE");
                orchestrator().reset();
                return Map.of("status", "reset");
            default:
                throw ApiException.notFound("No route for " + req.method + " " + req.path);
        }
    }

    // ---------------------------------------------------------------
    // Handlers
    // ---------------------------------------------------------------

    private Map<String, Object> health() {
        DefenseSnapshot snapshot = orchestrator().getStore().snapshot();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "healthy");
        body.put("service", SERVICE_NAME);
        body.put("version", version);
        body.put("rules_loaded", pipeline.getEngine().rules().size());
        body.put("blocked_ips", snapshot.getBlockedIps().size());
        body.put("isolated_services", snapshot.getIsolatedServices().size());
        return body;
    }

    private Map<String, Object> rules() {
        List<Map<String, Object>> rules = new ArrayList<>();
        for (ThreatRule rule : pipeline.getEngine().rules()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("id", rule.id());
            entry.put("name", rule.displayName());
            entry.put("type", rule.kind().configName());
            entry.put("playbook", rule.playbook().stream().map(ActionType::id).toList());
            rules.add(entry);
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("rules", rules);
        body.put("count", rules.size());
        return body;
    }

    private PipelineResult analyze(Request req) throws IOException {
        return pipeline.process(req.readBody(mapper, TelemetryEvent.class));
    }

    private Map<String, Object> analyzeBatch(Request req) throws IOException {
        List<TelemetryEvent> events = req.readBody(mapper, new TypeReference<List<TelemetryEvent>>() { });
        for (int i = 0; i < events.size(); i++) {
            TelemetryEvent event = events.get(i);
            if (event == null) {
                throw new ValidationException("[" + i + "]", "event " + i + " is null");
            }
            try {
                event.validate();
            } catch (ValidationException e) {
                throw new ValidationException("[" + i + "]." + e.getField(), e.getMessage(), e);
            }
        }

        List<Anomaly> anomalies = new ArrayList<>();
        for (PipelineResult result : pipeline.processAll(events)) {
            anomalies.addAll(result.getAnomalies());
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("events_analyzed", events.size());
        body.put("anomalies_detected", anomalies.size());
        body.put("anomalies", anomalies);
        return body;
    }

    private Object create(Request req) throws IOException {
        Anomaly anomaly = req.readBody(mapper, Anomaly.class);
        Correlation correlation = pipeline.createAlert(anomaly);
        if (!correlation.isSuppressed()) {
            return correlation.getAlert().orElseThrow();
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("suppressed", true);
        body.put("rule_id", anomaly.getRuleId());
        body.put("source_id", anomaly.effectiveSourceId());
        body.put("retry_after_ms", correlation.getRetryAfter().toMillis());
        return body;
    }

    private Object alerts(Request req) {
        AlertCorrelator correlator = pipeline.getCorrelator();
        String[] s = req.segments;

        if (s.length == 1) {
            req.allow("GET");
            AlertFilter filter = AlertFilter.parse(req.query.get("filter"));
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("alerts", correlator.list(filter));
            body.put("stats", correlator.stats());
            return body;
        }
        if (s.length == 2 && "acknowledge-all".equals(s[1])) {
            req.allow("POST");
            return Map.of("acknowledged", correlator.acknowledgeAll());
        }
        if (s.length == 2 && "acknowledged".equals(s[1])) {
            req.allow("DELETE");
            return Map.of("cleared", correlator.clearAcknowledged());
        }
        if (s.length == 3 && "acknowledge".equals(s[2])) {
            req.allow("POST");
            return correlator.acknowledge(s[1])
                    .orElseThrow(() -> ApiException.notFound("Alert " + s[1] + " not found"));
        }
        if (s.length == 2) {
            req.allow("DELETE");
            if (!correlator.dismiss(s[1])) {
                throw ApiException.notFound("Alert " + s[1] + " not found");
            }
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("status", "dismissed");
            body.put("alert_id", s[1]);
            return body;
        }
        throw ApiException.notFound("No route for " + req.method + " " + req.path);
    }

    private Map<String, Object> execute(Request req) throws IOException {
        Alert alert = req.readBody(mapper, Alert.class);
        List<Action> actions = pipeline.execute(alert);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("alert_id", alert.getAlertId());
        body.put("actions_executed", actions.size());
        body.put("actions", actions);
        return body;
    }

    private Map<String, Object> actions(Request req) {
        int limit = req.intParam("limit", DEFAULT_ACTIONS_LIMIT);
        List<Action> actions = orchestrator().recentActions(limit);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("actions", actions);
        body.put("count", actions.size());
        return body;
    }

    private ResponseOrchestrator orchestrator() {
        return pipeline.getOrchestrator();
    }

    // ---------------------------------------------------------------
    // Plumbing
    // ---------------------------------------------------------------

    private void send(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] bytes;
        try {
            bytes = mapper.writeValueAsBytes(body);
        } catch (JsonProcessingException e) {
            LOG.error("Failed to serialize response: {}", e.getOriginalMessage(), e);
            status = 500;
            bytes = "{\"error\":\"internal_error\"}".getBytes(StandardCharsets.UTF_8);
        }
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private static Map<String, Object> error(String code, String field, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", code);
        if (field != null) {
            body.put("field", field);
        }
        body.put("message", message);
        return body;
    }

    /**
     * Render a Jackson reference chain as {@code a.b[2].c}.
     */
    static String fieldPath(JsonMappingException e) {
        StringBuilder sb = new StringBuilder();
        for (JsonMappingException.Reference ref : e.getPath()) {
            if (ref.getFieldName() != null) {
                if (sb.length() > 0) {
                    sb.append('.');
                }
                sb.append(ref.getFieldName());
            } else if (ref.getIndex() >= 0) {
                sb.append('[').append(ref.getIndex()).append(']');
            }
        }
        return sb.length() > 0 ? sb.toString() : "body";
    }

    private static Map<String, String> parseQuery(String rawQuery) {
        Map<String, String> params = new HashMap<>();
        if (rawQuery == null || rawQuery.isEmpty()) {
            return params;
        }
        for (String pair : rawQuery.split("&")) {
            int eq = pair.indexOf('=');
            String key = eq < 0 ? pair : pair.substring(0, eq);
            String value = eq < 0 ? "" : pair.substring(eq + 1);
            params.put(URLDecoder.decode(key, StandardCharsets.UTF_8), URLDecoder.decode(value, StandardCharsets.UTF_8));
        }
        return params;
    }

    /**
     * One parsed request.
     */
    private static final class Request {
        private final String method;
        private final String path;
        private final String[] segments;
        private final Map<String, String> query;
        private final InputStream body;

        Request(String method, String path, Map<String, String> query, InputStream body) {
            this.method = method;
            this.path = path;
            this.segments = Arrays.stream(path.split("/")).filter(p -> !p.isEmpty()).toArray(String[]::new);
            this.query = query;
            this.body = body;
        }

        Request expectSegments(int count) {
            if (segments.length != count) {
                throw ApiException.notFound("No route for " + method + " " + path);
            }
            return this;
        }

        Request allow(String... methods) {
            for (String m : methods) {
                if (m.equals(method)) {
                    return this;
                }
            }
            throw ApiException.methodNotAllowed(method, path);
        }

        int intParam(String name, int defaultValue) {
            String raw = query.get(name);
            if (raw == null || raw.isBlank()) {
                return defaultValue;
            }
            int value;
            try {
                value = Integer.parseInt(raw.trim());
            } catch (NumberFormatException e) {
                throw new ValidationException(name, name + " must be an integer, got '" + raw + "'", e);
            }
            if (value <= 0) {
                throw new ValidationException(name, name + " must be > 0, got: " + value);
            }
            return value;
        }

        <T> T readBody(ObjectMapper mapper, Class<T> type) throws IOException {
            byte[] bytes = body.readAllBytes();
            if (bytes.length == 0) {
                throw new ValidationException("body", "request body is required");
            }
            T value = mapper.readValue(bytes, type);
            if (value == null) {
                throw new ValidationException("body", "request body is required");
            }
            return value;
        }

        <T> T readBody(ObjectMapper mapper, TypeReference<T> type) throws IOException {
            byte[] bytes = body.readAllBytes();
            if (bytes.length == 0) {
                throw new ValidationException("body", "request body is required");
            }
            T value = mapper.readValue(bytes, type);
            if (value == null) {
                throw new ValidationException("body", "request body is required");
            }
            return value;
        }
    }
}
