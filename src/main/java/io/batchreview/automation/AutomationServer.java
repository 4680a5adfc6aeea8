package io.batchreview.automation;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.batchreview.model.ReviewItem;
import io.batchreview.model.ServerState;
import io.batchreview.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Loopback-only HTTP control plane that lets local tooling inspect and stage the Batch.
 *
 * <p>Routes: {@code GET /health}, {@code GET /batch}, {@code POST /batch}, {@code DELETE /batch},
 * {@code GET /incoming}. Anything else is a 404 listing these. The server only holds a
 * {@link BatchAccess}, which has no vote or submit operation.
 */
public final class AutomationServer {
    private static final Logger LOG = LoggerFactory.getLogger(AutomationServer.class);

    public static final List<String> AVAILABLE_ENDPOINTS = List.of(
            "GET /health",
            "GET /batch",
            "POST /batch",
            "DELETE /batch",
            "GET /incoming"
    );

    private final BatchAccess access;
    private final BatchRequestValidator validator;
    private final int port;
    private final long maxRequestBytes;
    private final AtomicReference<ServerState> state;
    private final Object lifecycleLock;
    private volatile HttpServer server;
    private volatile int boundPort;

    /**
     * @param port            port to bind on the loopback interface; 0 picks an ephemeral one
     * @param maxRequestBytes largest accepted request body
     */
    public AutomationServer(BatchAccess access, BatchRequestValidator validator, int port, long maxRequestBytes) {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException("port must be in 0..65535");
        }
        if (maxRequestBytes <= 0) {
            throw new IllegalArgumentException("maxRequestBytes must be > 0");
        }
        this.access = access;
        this.validator = validator;
        this.port = port;
        this.maxRequestBytes = maxRequestBytes;
        this.state = new AtomicReference<>(ServerState.STOPPED);
        this.lifecycleLock = new Object();
    }

    /**
     * Binds and starts the listener. Returns the bound port; when already running, returns it
     * without binding again.
     *
     * @throws ServerLifecycleException when another start is in progress or the bind fails
     */
    public int start() {
        if (!state.compareAndSet(ServerState.STOPPED, ServerState.STARTING)) {
            if (state.get() == ServerState.RUNNING) {
                return boundPort;
            }
            throw new ServerLifecycleException("Automation server is already starting");
        }
        synchronized (lifecycleLock) {
            try {
                HttpServer created = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), port), 0);
                created.createContext("/", this::handle);
                created.setExecutor(null);
                created.start();
                server = created;
                boundPort = created.getAddress().getPort();
                state.set(ServerState.RUNNING);
                LOG.info("Automation server listening on {}:{}", created.getAddress().getHostString(), boundPort);
                return boundPort;
            } catch (IOException | RuntimeException e) {
                server = null;
                boundPort = 0;
                state.set(ServerState.STOPPED);
                LOG.error("Automation server failed to bind port {}: {}", port, e.getMessage());
                throw new ServerLifecycleException("Failed to bind automation server on port " + port, e);
            }
        }
    }

    /**
     * Closes the listener. Does nothing unless the server is running.
     */
    public void stop() {
        synchronized (lifecycleLock) {
            if (state.get() != ServerState.RUNNING) {
                return;
            }
            HttpServer current = server;
            server = null;
            boundPort = 0;
            if (current != null) {
                current.stop(0);
            }
            state.set(ServerState.STOPPED);
            LOG.info("Automation server stopped");
        }
    }

    public ServerState state() {
        return state.get();
    }

    /**
     * Bound port while running, otherwise 0.
     */
    public int port() {
        return state.get() == ServerState.RUNNING ? boundPort : 0;
    }

    private void handle(HttpExchange exchange) throws IOException {
        String method = exchange.getRequestMethod() == null
                ? ""
                : exchange.getRequestMethod().toUpperCase(Locale.ROOT);
        String path = normalizePath(exchange.getRequestURI().getPath());
        try {
            switch (method + " " + path) {
                case "GET /health" -> writeJson(exchange, Map.of("status", "ok"), 200);
                case "GET /batch" -> respond(exchange, access::batchSnapshot, batch -> Map.of("batch", batch));
                case "GET /incoming" -> respond(exchange, access::incomingSnapshot, incoming -> Map.of("incoming", incoming));
                case "POST /batch" -> handleAdd(exchange);
                case "DELETE /batch" -> respond(exchange, access::clearBatch, AutomationServer::successBody);
                default -> {
                    LinkedHashMap<String, Object> body = new LinkedHashMap<>();
                    body.put("error", "not_found");
                    body.put("method", method);
                    body.put("path", path);
                    body.put("availableEndpoints", AVAILABLE_ENDPOINTS);
                    writeJson(exchange, body, 404);
                }
            }
        } catch (RuntimeException e) {
            LOG.error("Automation request {} {} failed", method, path, e);
            writeJson(exchange, Map.of("error", "internal_error"), 500);
        }
    }

    private void handleAdd(HttpExchange exchange) throws IOException {
        byte[] body = readBounded(exchange);
        if (body == null) {
            writeJson(exchange, Map.of("error", "payload_too_large", "limitBytes", maxRequestBytes), 413);
            return;
        }
        BatchAddRequest request;
        try {
            request = validator.parse(body);
        } catch (RequestValidationException e) {
            writeJson(exchange, Map.of("error", e.code(), "detail", e.detail()), 400);
            return;
        }
        respond(exchange, () -> access.addToBatch(request), AutomationServer::successBody);
    }

    /**
     * Reads the request body, or returns null once it is known to exceed the limit. A declared
     * oversized Content-Length is refused before reading anything.
     */
    private byte[] readBounded(HttpExchange exchange) throws IOException {
        String declared = exchange.getRequestHeaders().getFirst("Content-Length");
        if (declared != null) {
            try {
                if (Long.parseLong(declared.trim()) > maxRequestBytes) {
                    return null;
                }
            } catch (NumberFormatException ignored) {
                // fall through to the bounded read
            }
        }
        try (InputStream in = exchange.getRequestBody()) {
            byte[] bytes = in.readNBytes((int) Math.min(Integer.MAX_VALUE - 1L, maxRequestBytes + 1L));
            return bytes.length > maxRequestBytes ? null : bytes;
        }
    }

    private static void respond(
            HttpExchange exchange,
            Supplier<CompletableFuture<List<ReviewItem>>> call,
            Function<List<ReviewItem>, Map<String, Object>> body
    ) {
        CompletableFuture<List<ReviewItem>> future;
        try {
            future = call.get();
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }
        future.whenComplete((items, error) -> {
            try {
                if (error != null) {
                    Throwable cause = error instanceof CompletionException && error.getCause() != null
                            ? error.getCause()
                            : error;
                    LOG.error("Automation request {} {} failed",
                            exchange.getRequestMethod(), exchange.getRequestURI().getPath(), cause);
                    writeJson(exchange, Map.of("error", "internal_error"), 500);
                    return;
                }
                writeJson(exchange, body.apply(items), 200);
            } catch (IOException e) {
                LOG.warn("Could not write automation response: {}", e.getMessage());
                exchange.close();
            }
        });
    }

    private static Map<String, Object> successBody(List<ReviewItem> batch) {
        LinkedHashMap<String, Object> out = new LinkedHashMap<>();
        out.put("success", true);
        out.put("batch", batch);
        return out;
    }

    private static String normalizePath(String raw) {
        if (raw == null || raw.isEmpty()) {
            return "/";
        }
        if (raw.length() > 1 && raw.endsWith("/")) {
            return raw.substring(0, raw.length() - 1);
        }
        return raw;
    }

    private static void writeJson(HttpExchange exchange, Object body, int status) throws IOException {
        byte[] bytes = Jsons.toCompactJson(body).getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
