package com.driftsentinel.service;

import com.driftsentinel.core.model.Alert;
import com.driftsentinel.core.model.ValidationException;
import com.driftsentinel.core.monitor.SentimentMonitor;
import com.driftsentinel.core.report.ReportFormatter;
import com.driftsentinel.core.report.SummaryReport;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * HTTP front end of the monitor.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>{@code GET /health}, {@code GET /readiness} – {@code {"status":"UP"}}</li>
 * <li>{@code POST /predictions} – log one classifier result; returns the
 * alerts it raised, or {@code 400} for malformed input</li>
 * <li>{@code GET /report} – summary report as JSON, or plain text with
 * {@code ?format=text}</li>
 * <li>{@code GET /retrain} – current retrain decision</li>
 * <li>{@code POST /retrain} – check and retrain; returns the run record</li>
 * </ul>
 *
 * <p>
 * Uses the JDK built-in {@link HttpServer} with a small fixed worker pool.
 * Other methods get {@code 405}, unknown paths {@code 404}.
 * </p>
 *
 * @since 1.0.0
 */
public class MonitorHttpServer {

    private static final Logger LOG = LoggerFactory.getLogger(MonitorHttpServer.class);
    private static final byte[] HEALTH_RESPONSE = "{\"status\":\"UP\"}".getBytes(StandardCharsets.UTF_8);

    private static final String JSON = "application/json";
    private static final String TEXT = "text/plain; charset=utf-8";

    private final SentimentMonitor monitor;
    private final RetrainingManager retrainingManager;
    private final JsonCodec codec;

    private HttpServer server;
    private ExecutorService executor;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public MonitorHttpServer(SentimentMonitor monitor, RetrainingManager retrainingManager, JsonCodec codec) {
        this.monitor = Objects.requireNonNull(monitor, "SentimentMonitor must not be null");
        this.retrainingManager = Objects.requireNonNull(retrainingManager, "RetrainingManager must not be null");
        this.codec = Objects.requireNonNull(codec, "JsonCodec must not be null");
    }

    /**
     * Start serving.
     *
     * @param port    TCP port in [0, 65535]; {@code 0} picks an ephemeral port
     * @param threads worker threads; must be at least 1
     * @throws IllegalArgumentException if port or thread count is out of range
     * @throws IllegalStateException    if the port cannot be bound or the
     *                                  server is already running
     */
    public void start(int port, int threads) {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException("HTTP port must be in range [0, 65535], got: " + port);
        }
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be >= 1, got: " + threads);
        }
        if (running.get()) {
            throw new IllegalStateException("Server already running on port " + getPort());
        }
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to bind HTTP server on port " + port, e);
        }
        server.createContext("/health", route("/health", this::handleHealth));
        server.createContext("/readiness", route("/readiness", this::handleHealth));
        server.createContext("/predictions", route("/predictions", this::handlePredictions));
        server.createContext("/report", route("/report", this::handleReport));
        server.createContext("/retrain", route("/retrain", this::handleRetrain));

        AtomicInteger counter = new AtomicInteger();
        executor = Executors.newFixedThreadPool(threads,
                r -> new Thread(r, "monitor-http-" + counter.incrementAndGet()));
        server.setExecutor(executor);

        server.start();
        running.set(true);
        LOG.info("Monitor HTTP server started on port {} with {} worker(s)", getPort(), threads);
    }

    /**
     * Stop the server gracefully.
     */
    public void stop() {
        if (server != null && running.compareAndSet(true, false)) {
            server.stop(0);
            executor.shutdown();
            LOG.info("Monitor HTTP server stopped");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * @return the bound port, useful when started on port {@code 0}
     * @throws IllegalStateException if the server was never started
     */
    public int getPort() {
        if (server == null) {
            throw new IllegalStateException("Server not started");
        }
        return server.getAddress().getPort();
    }

    // ---------------------------------------------------------------
    // Handlers
    // ---------------------------------------------------------------

    private Response handleHealth(HttpExchange exchange) {
        if (!"GET".equals(exchange.getRequestMethod())) {
            return Response.methodNotAllowed("GET");
        }
        return new Response(200, JSON, HEALTH_RESPONSE);
    }

    private Response handlePredictions(HttpExchange exchange) throws IOException {
        if (!"POST".equals(exchange.getRequestMethod())) {
            return Response.methodNotAllowed("POST");
        }
        PredictionRequest request;
        try (InputStream body = exchange.getRequestBody()) {
            request = codec.readPredictionRequest(body);
        }
        if (request == null) {
            throw new ValidationException("Request body must be a JSON object");
        }
        List<Alert> alerts = monitor.logPrediction(request.getText(), request.getResult());
        return new Response(200, JSON, codec.toJson(alerts));
    }

    private Response handleReport(HttpExchange exchange) {
        if (!"GET".equals(exchange.getRequestMethod())) {
            return Response.methodNotAllowed("GET");
        }
        SummaryReport report = monitor.getSummaryReport();
        if ("text".equals(queryParameter(exchange.getRequestURI().getQuery(), "format"))) {
            return new Response(200, TEXT, ReportFormatter.toText(report).getBytes(StandardCharsets.UTF_8));
        }
        return new Response(200, JSON, codec.toJson(report));
    }

    private Response handleRetrain(HttpExchange exchange) {
        return switch (exchange.getRequestMethod()) {
            case "GET" -> new Response(200, JSON, codec.toJson(retrainingManager.currentDecision()));
            case "POST" -> new Response(200, JSON, codec.toJson(retrainingManager.checkAndRetrain()));
            default -> Response.methodNotAllowed("GET, POST");
        };
    }

    /**
     * @return the first value of {@code name} in a decoded query string, or
     *         {@code null} when absent
     */
    static String queryParameter(String query, String name) {
        if (query == null || query.isEmpty()) {
            return null;
        }
        for (String pair : query.split("&")) {
            int eq = pair.indexOf('=');
            String key = eq >= 0 ? pair.substring(0, eq) : pair;
            if (key.equals(name)) {
                return eq >= 0 ? pair.substring(eq + 1) : "";
            }
        }
        return null;
    }

    // ---------------------------------------------------------------
    // Routing and error mapping
    // ---------------------------------------------------------------

    @FunctionalInterface
    private interface Route {
        Response handle(HttpExchange exchange) throws IOException;
    }

    private HttpHandler route(String path, Route route) {
        return exchange -> {
            Response response;
            try {
                if (!path.equals(exchange.getRequestURI().getPath())) {
                    response = error(404, "Not found: " + exchange.getRequestURI().getPath(), null);
                } else {
                    response = route.handle(exchange);
                }
            } catch (ValidationException e) {
                LOG.warn("Rejected {} {}: {}", exchange.getRequestMethod(), path, e.getMessage());
                response = error(400, e.getMessage(), e.getViolations());
            } catch (JsonProcessingException e) {
                LOG.warn("Malformed JSON on {} {}: {}", exchange.getRequestMethod(), path, e.getOriginalMessage());
                response = error(400, "Malformed JSON: " + e.getOriginalMessage(), null);
            } catch (IllegalStateException e) {
                LOG.warn("Unavailable {} {}: {}", exchange.getRequestMethod(), path, e.getMessage());
                response = error(503, e.getMessage(), null);
            } catch (RuntimeException e) {
                LOG.error("Failed to handle {} {}: {}", exchange.getRequestMethod(), path, e.getMessage(), e);
                response = error(500, "Internal error", null);
            }
            send(exchange, response);
        };
    }

    private Response error(int status, String message, List<String> violations) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message);
        if (violations != null) {
            body.put("violations", violations);
        }
        return new Response(status, JSON, codec.toJson(body));
    }

    private static void send(HttpExchange exchange, Response response) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", response.contentType);
        if (response.allow != null) {
            exchange.getResponseHeaders().set("Allow", response.allow);
        }
        exchange.sendResponseHeaders(response.status, response.body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(response.body);
        }
    }

    private static final class Response {
        private final int status;
        private final String contentType;
        private final byte[] body;
        private final String allow;

        Response(int status, String contentType, byte[] body) {
            this(status, contentType, body, null);
        }

        Response(int status, String contentType, byte[] body, String allow) {
            this.status = status;
            this.contentType = contentType;
            this.body = body;
            this.allow = allow;
        }

        static Response methodNotAllowed(String allow) {
            byte[] body = "{\"error\":\"Method not allowed\"}".getBytes(StandardCharsets.UTF_8);
            return new Response(405, JSON, body, allow);
        }
    }
}
