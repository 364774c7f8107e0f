// file: server/src/main/java/io/rangelite/server/admin/AdminServer.java
package io.rangelite.server.admin;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.rangelite.server.apply.ApplyScheduler;
import io.rangelite.server.checksum.ChecksumResult;
import io.rangelite.server.checksum.ChecksumUnavailableException;
import io.rangelite.server.replica.Replica;
import io.rangelite.server.store.Store;
import io.rangelite.storage.PersistedReplicaState;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Read-only admin HTTP surface of a store.
 * <p>
 * Path layout:
 *   - GET /admin/health                            liveness check
 *   - GET /admin/ranges/{rangeId}                  replica state of a local range
 *   - GET /admin/checksum/{rangeId}/{checksumId}   wait for and return a consistency checksum
 * <p>
 * Status codes: 400 malformed ids, 404 unknown range or path, 405 non-GET,
 * 503 checksum unavailable, 500 anything else.
 */
public final class AdminServer {

    private final Undertow server;
    private final ObjectMapper json = new ObjectMapper();
    private final Store store;
    private final ApplyScheduler scheduler; // may be null

    public AdminServer(int port, Store store, ApplyScheduler scheduler) {
        this.store = store;
        this.scheduler = scheduler;
        this.server = Undertow.builder()
                .addHttpListener(port, "0.0.0.0")
                .setHandler(exchange -> {
                    if (exchange.isInIoThread()) {
                        // The checksum route blocks while the digest is computed.
                        exchange.dispatch(this::route);
                        return;
                    }
                    route(exchange);
                }).build();
    }

    /** Admin server on the configured port, or empty when the config disables it. */
    public static Optional<AdminServer> forStore(Store store, ApplyScheduler scheduler) {
        int port = store.config().adminPort();
        return port == 0 ? Optional.empty() : Optional.of(new AdminServer(port, store, scheduler));
    }

    public void start() {
        server.start();
    }

    public void stop() {
        server.stop();
    }

    /** Port the server is bound to; useful when it was started on port 0. */
    public int port() {
        return ((InetSocketAddress) server.getListenerInfo().get(0).getAddress()).getPort();
    }

    private void route(HttpServerExchange ex) {
        long start = System.nanoTime();
        String path = ex.getRequestPath();
        String method = ex.getRequestMethod().toString();
        ex.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
        int status;
        Throwable error = null;
        try {
            if (!"GET".equals(method)) {
                status = send(ex, 405, Map.of("error", "method not allowed"));
            } else if ("/admin/health".equals(path)) {
                status = send(ex, 200, Map.of("status", "ok"));
            } else if (path.startsWith("/admin/ranges/")) {
                status = handleRange(ex, path.substring("/admin/ranges/".length()));
            } else if (path.startsWith("/admin/checksum/")) {
                status = handleChecksum(ex, path.substring("/admin/checksum/".length()));
            } else {
                status = send(ex, 404, Map.of("error", "not found"));
            }
        } catch (IllegalArgumentException bad) {
            error = bad;
            status = send(ex, 400, Map.of("error", String.valueOf(bad.getMessage())));
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            error = ie;
            status = send(ex, 503, Map.of("error", "interrupted"));
        } catch (Exception e) {
            error = e;
            status = send(ex, 500, Map.of("error", e.getClass().getSimpleName(), "message", String.valueOf(e.getMessage())));
        }
        long totalMs = (System.nanoTime() - start) / 1_000_000L;
        RequestLogger.logRequest(method, path, status, totalMs, error);
    }

    /** GET /admin/ranges/{rangeId} */
    private int handleRange(HttpServerExchange ex, String rest) {
        long rangeId = parseRangeId(rest);
        Replica r = store.replica(rangeId);
        if (r == null) {
            return send(ex, 404, Map.of("error", "range " + rangeId + " not found"));
        }
        PersistedReplicaState s = r.persistedState();
        RangeStateResponse dto = new RangeStateResponse();
        dto.rangeId = rangeId;
        dto.descriptor = s.descriptor();
        dto.lease = s.lease();
        dto.raftAppliedIndex = s.raftAppliedIndex();
        dto.leaseAppliedIndex = s.leaseAppliedIndex();
        dto.stats = s.stats();
        dto.truncatedState = s.truncatedState();
        dto.gcThreshold = s.gcThreshold();
        dto.txnSpanGcThreshold = s.txnSpanGcThreshold();
        dto.frozen = s.frozen();
        dto.raftLogSize = r.raftLogSize();
        dto.halted = scheduler != null && scheduler.isHalted(rangeId);
        return send(ex, 200, dto);
    }

    /** GET /admin/checksum/{rangeId}/{checksumId} */
    private int handleChecksum(HttpServerExchange ex, String rest) throws InterruptedException {
        int slash = rest.indexOf('/');
        if (slash < 0) {
            throw new IllegalArgumentException("expected /admin/checksum/{rangeId}/{checksumId}");
        }
        long rangeId = parseRangeId(rest.substring(0, slash));
        UUID id;
        try {
            id = UUID.fromString(rest.substring(slash + 1));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("checksumId must be a UUID", e);
        }
        Replica r = store.replica(rangeId);
        if (r == null) {
            return send(ex, 404, Map.of("error", "range " + rangeId + " not found"));
        }
        ChecksumResult result;
        try {
            result = r.checksums().collect(id, store.config().checksumCollectTimeout());
        } catch (ChecksumUnavailableException e) {
            return send(ex, 503, Map.of("error", String.valueOf(e.getMessage())));
        }
        ChecksumResponse dto = new ChecksumResponse();
        dto.checksumId = id.toString();
        dto.digestBase64 = Base64.getEncoder().encodeToString(result.digest());
        dto.snapshot = result.snapshot();
        return send(ex, 200, dto);
    }

    private static long parseRangeId(String s) {
        try {
            long id = Long.parseLong(s);
            if (id <= 0) {
                throw new IllegalArgumentException("rangeId must be > 0");
            }
            return id;
        } catch (NumberFormatException nfe) {
            throw new IllegalArgumentException("rangeId must be a number", nfe);
        }
    }

    /** Serialize 'body' as JSON and write it with the given HTTP status code. */
    private int send(HttpServerExchange ex, int code, Object body) {
        try {
            ex.setStatusCode(code);
            byte[] bytes = json.writeValueAsBytes(body);
            ex.getResponseSender().send(new String(bytes, StandardCharsets.UTF_8));
            return code;
        } catch (Exception e) {
            ex.setStatusCode(500);
            ex.getResponseSender().send("{\"error\":\"serialization\"}");
            return 500;
        }
    }
}
