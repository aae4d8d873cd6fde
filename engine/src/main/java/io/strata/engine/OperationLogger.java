// file: engine/src/main/java/io/strata/engine/OperationLogger.java
package io.strata.engine;

import io.strata.core.StrataException;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Central place to log table-service operations with their outcome and latency.
 * <p>
 * Expected outcomes (conflicts, denials, unknown tables, bad casts) log at INFO with
 * the exception's simple name; anything unexpected logs at WARNING with its stack.
 */
public final class OperationLogger {
    private static final Logger log = Logger.getLogger(OperationLogger.class.getName());

    private OperationLogger() {
        // utility
    }

    /**
     * Log a completed operation.
     *
     * @param operation   e.g. INSERT, SELECT, CLONE
     * @param target      table name or other object the operation addressed
     * @param role        active role of the session
     * @param totalMillis wall-clock latency of the whole operation
     * @param error       failure, or null when it succeeded
     */
    public static void logOperation(String operation, String target, String role, long totalMillis, Throwable error) {
        String outcome = error == null ? "OK" : "FAILED(" + error.getClass().getSimpleName() + ")";
        String msg = String.format("%s %s as %s -> %s (total=%dms)", operation, target, role, outcome, totalMillis);

        if (error == null) {
            log.log(Level.INFO, msg);
        } else if (error instanceof StrataException || error instanceof IllegalArgumentException) {
            log.log(Level.INFO, msg + ": " + error.getMessage());
        } else {
            log.log(Level.WARNING, msg, error);
        }
    }
}
