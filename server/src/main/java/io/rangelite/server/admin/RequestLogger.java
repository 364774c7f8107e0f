// file: server/src/main/java/io/rangelite/server/admin/RequestLogger.java
package io.rangelite.server.admin;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Central place to log admin requests: method, path, status and latency.
 */
public final class RequestLogger {
    private static final Logger log = Logger.getLogger(RequestLogger.class.getName());

    private RequestLogger() {
        // utility
    }

    /**
     * @param method      HTTP method
     * @param path        request path
     * @param status      HTTP status code
     * @param totalMillis wall-clock latency for the whole request
     * @param error       optional exception, logged with 5xx responses
     */
    public static void logRequest(String method, String path, int status, long totalMillis, Throwable error) {
        String msg = String.format("HTTP %s %s -> %d (total=%dms)", method, path, status, totalMillis);
        if (error != null && status >= 500) {
            log.log(Level.WARNING, msg, error);
        } else if (status >= 500) {
            log.log(Level.WARNING, msg);
        } else {
            log.log(Level.FINE, msg);
        }
    }
}
