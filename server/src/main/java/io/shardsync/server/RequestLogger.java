package io.shardsync.server;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Central place for request-level logging of the admin / ingest HTTP API.
 */
public final class RequestLogger {
    private static final Logger log = Logger.getLogger(RequestLogger.class.getName());

    private RequestLogger() {
        // utility
    }

    /**
     * Log a completed HTTP request.
     *
     * @param method      HTTP method (GET, PUT, POST, etc.)
     * @param path        request path
     * @param status      HTTP status code
     * @param totalMillis wall-clock latency for the whole request
     * @param error       optional exception, null if none
     */
    public static void logRequest(
            String method,
            String path,
            int status,
            long totalMillis,
            Throwable error
    ) {
        String msg = String.format(
                "HTTP %s %s -> %d (total=%dms)",
                method,
                path,
                status,
                totalMillis
        );

        if (error != null && status >= 500) {
            log.log(Level.WARNING, msg, error);
        } else if (status >= 500) {
            log.log(Level.WARNING, msg);
        } else if (status >= 400) {
            log.log(Level.INFO, msg + (error != null ? " " + error.getMessage() : ""));
        } else {
            log.log(Level.FINE, msg);
        }
    }
}
