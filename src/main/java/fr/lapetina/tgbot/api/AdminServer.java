package fr.lapetina.tgbot.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import fr.lapetina.tgbot.dispatch.DispatcherState;
import fr.lapetina.tgbot.dispatch.UpdateDispatcher;
import fr.lapetina.tgbot.domain.command.Command;
import fr.lapetina.tgbot.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Lightweight admin endpoint using JDK's built-in HttpServer.
 *
 * Endpoints:
 * - GET /health - Dispatcher state, 200 when running, 503 otherwise
 * - GET /metrics - Prometheus metrics endpoint
 * - GET /commands - Visible command menu
 */
public final class AdminServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AdminServer.class);

    private final HttpServer server;
    private final ExecutorService executor;
    private final ObjectMapper objectMapper;
    private final UpdateDispatcher dispatcher;
    private final MetricsRegistry metricsRegistry;

    /**
     * @param port            listening port, 0 for an ephemeral one
     * @param metricsRegistry may be null when metrics are disabled
     */
    public AdminServer(
            String host,
            int port,
            int backlog,
            UpdateDispatcher dispatcher,
            MetricsRegistry metricsRegistry
    ) throws IOException {
        this.dispatcher = dispatcher;
        this.metricsRegistry = metricsRegistry;

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        this.server = HttpServer.create(new InetSocketAddress(host, port), backlog);

        AtomicInteger counter = new AtomicInteger(0);
        this.executor = Executors.newFixedThreadPool(2, r -> {
            Thread t = new Thread(r, "admin-http-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);

        server.createContext("/health", new HealthHandler());
        server.createContext("/metrics", new MetricsHandler());
        server.createContext("/commands", new CommandsHandler());

        log.info("Admin server configured on {}:{}", host, port);
    }

    public void start() {
        server.start();
        log.info("Admin server started on port {}", getPort());
    }

    /**
     * Actual listening port, useful when bound to port 0.
     */
    public int getPort() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        server.stop(1);
        executor.shutdownNow();
        log.info("Admin server stopped");
    }

    // ==================== HEALTH HANDLER ====================

    private class HealthHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            DispatcherState state = dispatcher.state();
            Map<String, Object> health = new LinkedHashMap<>();
            health.put("status", state == DispatcherState.RUNNING ? "UP" : "DOWN");
            health.put("state", state.name());
            health.put("timestamp", Instant.now());
            health.put("runningWorkers", dispatcher.runningWorkers());
            health.put("offset", dispatcher.offset());
            health.put("remainingCapacity", dispatcher.remainingCapacity());

            int statusCode = state == DispatcherState.RUNNING ? 200 : 503;
            sendJson(exchange, statusCode, health);
        }
    }

    // ==================== METRICS HANDLER ====================

    private class MetricsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }
            if (metricsRegistry == null) {
                sendError(exchange, 404, "Metrics are disabled");
                return;
            }

            String metrics = metricsRegistry.scrape();
            exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4");
            byte[] bytes = metrics.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        }
    }

    // ==================== COMMANDS HANDLER ====================

    private class CommandsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            List<Map<String, String>> commands = dispatcher.commands().visibleCommands().stream()
                    .map(AdminServer::describe)
                    .toList();
            sendJson(exchange, 200, commands);
        }
    }

    private static Map<String, String> describe(Command command) {
        Map<String, String> info = new LinkedHashMap<>();
        info.put("command", command.name());
        info.put("description", command.description());
        return info;
    }

    // ==================== HELPER METHODS ====================

    private void sendJson(HttpExchange exchange, int statusCode, Object body) throws IOException {
        byte[] bytes = objectMapper.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private void sendError(HttpExchange exchange, int statusCode, String message) throws IOException {
        sendJson(exchange, statusCode, Map.of("error", message));
    }
}
