package io.shardsync.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.shardsync.core.ChangeEvent;
import io.shardsync.server.cluster.ClusterMembership;
import io.shardsync.server.dto.ChangeEventRequest;
import io.shardsync.server.dto.ConfigValueRequest;
import io.shardsync.server.feed.LocalChangeFeed;
import io.shardsync.server.feed.SyncConfigStore;
import io.shardsync.server.sync.SyncEventLoop;
import io.shardsync.server.sync.SyncStatus;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Thin HTTP adapter over the change feed, config store, membership and sync loop.
 *
 * Responsibilities:
 *  - Parse HTTP method + path.
 *  - Decode JSON request bodies into DTOs.
 *  - Convert results back into JSON.
 *  - Map Java exceptions to HTTP status codes.
 *  - Emit per-request logging.
 *
 * Path layout:
 *   - POST /events                         Publish a change notification
 *   - GET  /admin/config/{key}             Read sync_delay / sync_frequency
 *   - PUT  /admin/config/{key}             Set sync_delay / sync_frequency
 *   - PUT  /admin/nodes/{nodeId}/up|down   Mark a peer live / unreachable
 *   - GET  /admin/sync/status              Scheduler status snapshot
 *   - GET  /admin/health                   Basic health check
 */
public final class WebServer {
    private static final int MAX_BODY_BYTES = 1024 * 1024; // 1 MiB
    private static final Duration STATUS_TIMEOUT = Duration.ofSeconds(2);

    private static final String CONFIG_PREFIX = "/admin/config/";
    private static final String NODES_PREFIX = "/admin/nodes/";

    private final Undertow server;
    private final ObjectMapper json = new ObjectMapper();
    private final LocalChangeFeed feed;
    private final SyncConfigStore config;
    private final ClusterMembership membership;
    private final SyncEventLoop loop;

    public WebServer(int port,
                     LocalChangeFeed feed,
                     SyncConfigStore config,
                     ClusterMembership membership,
                     SyncEventLoop loop) {
        this.feed = feed;
        this.config = config;
        this.membership = membership;
        this.loop = loop;

        this.server = Undertow.builder()
                .addHttpListener(port, "0.0.0.0")
                .setHandler(exchange -> {
                    var path = exchange.getRequestPath();
                    var method = exchange.getRequestMethod().toString();
                    exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");

                    if ("/events".equals(path)) {
                        if ("POST".equals(method)) {
                            handlePublish(exchange);
                        } else {
                            send(exchange, 405, Map.of("error", "method not allowed"));
                            RequestLogger.logRequest(method, path, 405, 0, null);
                        }
                    } else if (path.startsWith(CONFIG_PREFIX)) {
                        String key = path.substring(CONFIG_PREFIX.length());
                        if (!SyncConfigStore.isKnownKey(key)) {
                            send(exchange, 404, Map.of("error", "unknown config key"));
                            RequestLogger.logRequest(method, path, 404, 0, null);
                            return;
                        }
                        switch (method) {
                            case "GET" -> handleGetConfig(exchange, key);
                            case "PUT" -> handlePutConfig(exchange, key);
                            default -> {
                                send(exchange, 405, Map.of("error", "method not allowed"));
                                RequestLogger.logRequest(method, path, 405, 0, null);
                            }
                        }
                    } else if (path.startsWith(NODES_PREFIX) && "PUT".equals(method)) {
                        handleNodeLiveness(exchange, path.substring(NODES_PREFIX.length()));
                    } else if ("/admin/sync/status".equals(path) && "GET".equals(method)) {
                        if (exchange.isInIoThread()) {
                            // status waits on the sync loop; keep it off the IO thread
                            exchange.dispatch(() -> handleStatus(exchange));
                        } else {
                            handleStatus(exchange);
                        }
                    } else if ("/admin/health".equals(path)) {
                        send(exchange, 200, Map.of("status", "ok"));
                        RequestLogger.logRequest(method, path, 200, 0, null);
                    } else {
                        send(exchange, 404, Map.of("error", "not found"));
                        RequestLogger.logRequest(method, path, 404, 0, null);
                    }
                }).build();
    }

    public void start() {
        server.start();
    }

    public void stop() {
        server.stop(); // For tests to stop server
    }

    // ---------- handlers ----------

    /** POST /events */
    private void handlePublish(HttpServerExchange ex) {
        ex.getRequestReceiver().receiveFullBytes(
                (exchange, data) -> {
                    long start = System.nanoTime();
                    int status;
                    Throwable error = null;

                    try {
                        if (data.length > MAX_BODY_BYTES) {
                            status = 413;
                            send(exchange, status, Map.of("error", "request body too large"));
                        } else {
                            var req = json.readValue(data, ChangeEventRequest.class);
                            if (req.subject == null || req.subject.isBlank()) {
                                throw new IllegalArgumentException("subject must not be empty");
                            }
                            ChangeEvent event = new ChangeEvent(req.subject, ChangeEvent.Kind.fromWire(req.kind));
                            feed.publish(event);
                            status = 202;
                            send(exchange, status, Map.of("accepted", true));
                        }
                    } catch (IllegalArgumentException bad) {
                        status = 400;
                        error = bad;
                        send(exchange, status, Map.of("error", bad.getMessage()));
                    } catch (JsonProcessingException jsonEx) {
                        status = 400;
                        error = jsonEx;
                        send(exchange, status, Map.of("error", "invalid JSON"));
                    } catch (Exception e) {
                        status = 500;
                        error = e;
                        send(exchange, status, Map.of("error", e.getClass().getSimpleName(), "message", String.valueOf(e.getMessage())));
                    }
                    long totalMs = (System.nanoTime() - start) / 1_000_000L;
                    RequestLogger.logRequest("POST", exchange.getRequestPath(), status, totalMs, error);
                },
                (exchange, ioEx) -> {
                    send(exchange, 400, Map.of("error", "invalid request body"));
                    RequestLogger.logRequest("POST", exchange.getRequestPath(), 400, 0, ioEx);
                }
        );
    }

    /** GET /admin/config/{key} */
    private void handleGetConfig(HttpServerExchange ex, String key) {
        String value = config.get(key).orElse(null);
        if (value == null) {
            send(ex, 404, Map.of("error", "no value for " + key));
            RequestLogger.logRequest("GET", ex.getRequestPath(), 404, 0, null);
            return;
        }
        send(ex, 200, Map.of("key", key, "value", value));
        RequestLogger.logRequest("GET", ex.getRequestPath(), 200, 0, null);
    }

    /**
     * PUT /admin/config/{key}
     * The raw value is stored as-is; an unparseable value is ignored by the
     * sync loop, which keeps its previous setting.
     */
    private void handlePutConfig(HttpServerExchange ex, String key) {
        ex.getRequestReceiver().receiveFullBytes(
                (exchange, data) -> {
                    long start = System.nanoTime();
                    int status;
                    Throwable error = null;

                    try {
                        var req = json.readValue(data, ConfigValueRequest.class);
                        if (req.value == null) {
                            throw new IllegalArgumentException("value must not be null");
                        }
                        config.set(key, req.value);
                        status = 200;
                        send(exchange, status, Map.of("key", key, "value", req.value));
                    } catch (IllegalArgumentException bad) {
                        status = 400;
                        error = bad;
                        send(exchange, status, Map.of("error", bad.getMessage()));
                    } catch (JsonProcessingException jsonEx) {
                        status = 400;
                        error = jsonEx;
                        send(exchange, status, Map.of("error", "invalid JSON"));
                    } catch (Exception e) {
                        status = 500;
                        error = e;
                        send(exchange, status, Map.of("error", e.getClass().getSimpleName(), "message", String.valueOf(e.getMessage())));
                    }
                    long totalMs = (System.nanoTime() - start) / 1_000_000L;
                    RequestLogger.logRequest("PUT", exchange.getRequestPath(), status, totalMs, error);
                },
                (exchange, ioEx) -> {
                    send(exchange, 400, Map.of("error", "invalid request body"));
                    RequestLogger.logRequest("PUT", exchange.getRequestPath(), 400, 0, ioEx);
                }
        );
    }

    /** PUT /admin/nodes/{nodeId}/up and /admin/nodes/{nodeId}/down */
    private void handleNodeLiveness(HttpServerExchange ex, String rest) {
        int status;
        Throwable error = null;
        try {
            int slash = rest.lastIndexOf('/');
            if (slash <= 0) {
                throw new IllegalArgumentException("expected /admin/nodes/{nodeId}/up|down");
            }
            String nodeId = rest.substring(0, slash);
            String action = rest.substring(slash + 1);
            boolean live = switch (action) {
                case "up" -> {
                    membership.markUp(nodeId);
                    yield true;
                }
                case "down" -> {
                    membership.markDown(nodeId);
                    yield false;
                }
                default -> throw new IllegalArgumentException("action must be up or down");
            };
            status = 200;
            send(ex, status, Map.of("nodeId", nodeId, "live", live));
        } catch (IllegalArgumentException bad) {
            status = 400;
            error = bad;
            send(ex, status, Map.of("error", bad.getMessage()));
        }
        RequestLogger.logRequest("PUT", ex.getRequestPath(), status, 0, error);
    }

    /** GET /admin/sync/status */
    private void handleStatus(HttpServerExchange ex) {
        long start = System.nanoTime();
        int status = 200;
        Throwable error = null;
        try {
            SyncStatus snapshot = loop.status(STATUS_TIMEOUT);
            send(ex, status, snapshot);
        } catch (TimeoutException e) {
            status = 503;
            error = e;
            send(ex, status, Map.of("error", "sync loop did not answer in time"));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            status = 503;
            error = e;
            send(ex, status, Map.of("error", "interrupted"));
        } catch (Exception e) {
            status = 500;
            error = e;
            send(ex, status, Map.of("error", e.getClass().getSimpleName(), "message", String.valueOf(e.getMessage())));
        } finally {
            long totalMs = (System.nanoTime() - start) / 1_000_000L;
            RequestLogger.logRequest("GET", ex.getRequestPath(), status, totalMs, error);
        }
    }

    // ---------- helpers ----------

    /** Serialize 'body' as JSON and write it with the given HTTP status code. */
    private void send(HttpServerExchange ex, int code, Object body) {
        try {
            ex.setStatusCode(code);
            byte[] bytes = json.writeValueAsBytes(body);
            ex.getResponseSender().send(new String(bytes, StandardCharsets.UTF_8));
        } catch (Exception e) {
            ex.setStatusCode(500);
            ex.getResponseSender().send("{\"error\":\"serialization\"}");
        }
    }
}
