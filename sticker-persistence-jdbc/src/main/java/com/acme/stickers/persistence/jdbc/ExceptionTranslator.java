package com.acme.stickers.persistence.jdbc;

import com.acme.stickers.core.PermanentException;
import com.acme.stickers.core.TransientException;
import org.slf4j.Logger;

import java.sql.SQLException;
import java.util.Locale;

/**
 * Utility class for translating SQLException to domain exceptions.
 * Determines whether an exception is permanent (non-retryable) or transient (retryable),
 * and recognises unique-key violations, which the store treats as an idempotent outcome.
 */
public final class ExceptionTranslator {

    /** SQLState for a unique violation, shared by PostgreSQL and H2. */
    static final String UNIQUE_VIOLATION = "23505";
    private static final int H2_DUPLICATE_KEY = 23505;

    private ExceptionTranslator() {
        // Utility class - no instantiation
    }

    /**
     * Translates a SQLException to either PermanentException or TransientException.
     *
     * @param originalException The SQLException that occurred
     * @param operation         Description of the operation that failed
     * @param logger            Logger for error reporting
     * @return PermanentException for non-retryable errors, TransientException for retryable ones
     */
    public static RuntimeException translateException(
            SQLException originalException, String operation, Logger logger) {

        logger.error("Database operation failed: {}", operation, originalException);

        if (isTransientError(originalException)) {
            return new TransientException(
                    String.format("Transient database error during %s: %s", operation,
                            originalException.getMessage()), originalException);
        }

        if (isPermanentError(originalException)) {
            return new PermanentException(
                    String.format("Permanent database error during %s: %s", operation,
                            originalException.getMessage()), originalException);
        }

        // Default to TransientException when in doubt
        return new TransientException(
                String.format("Database error during %s: %s", operation, originalException.getMessage()),
                originalException);
    }

    /**
     * True if the exception, or any exception chained to it, reports a unique constraint violation.
     */
    public static boolean isUniqueViolation(SQLException exception) {
        for (Throwable t = exception; t != null; t = t.getCause()) {
            if (t instanceof SQLException sql) {
                if (UNIQUE_VIOLATION.equals(sql.getSQLState()) || sql.getErrorCode() == H2_DUPLICATE_KEY) {
                    return true;
                }
                SQLException next = sql.getNextException();
                if (next != null && next != t && UNIQUE_VIOLATION.equals(next.getSQLState())) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Transient errors include connection loss, lock and statement timeouts, deadlocks and
     * pool exhaustion.
     */
    private static boolean isTransientError(SQLException exception) {
        String message = lowerMessage(exception);
        if (message.contains("timeout") || message.contains("timed out")
                || message.contains("connection refused") || message.contains("deadlock")
                || message.contains("too many connections") || message.contains("pool exhausted")) {
            return true;
        }

        String sqlState = exception.getSQLState();
        if (sqlState != null) {
            // 08xxx - Connection Exception
            // 40xxx - Transaction Rollback
            // 57P01..57P03 - admin shutdown, crash shutdown, cannot connect now
            if (sqlState.startsWith("08") || sqlState.startsWith("40") || sqlState.startsWith("57P")) {
                return true;
            }
            // HYT00 - H2 lock timeout
            if (sqlState.equals("HYT00")) {
                return true;
            }
        }
        return false;
    }

    /**
     * Permanent errors include constraint violations, syntax errors, missing tables or columns,
     * and data type mismatches.
     */
    private static boolean isPermanentError(SQLException exception) {
        String message = lowerMessage(exception);
        if (message.contains("syntax error") || message.contains("table not found")
                || message.contains("column not found") || message.contains("does not exist")
                || message.contains("constraint violation") || message.contains("unique constraint")
                || message.contains("foreign key") || message.contains("value too long")) {
            return true;
        }

        String sqlState = exception.getSQLState();
        if (sqlState != null) {
            // 22xxx - Data Exception
            // 23xxx - Integrity Constraint Violation
            // 42xxx - Syntax Error / Access Violation
            // 3Dxxx - Invalid Catalog Name
            // 3Fxxx - Invalid Schema Name
            return sqlState.startsWith("22") || sqlState.startsWith("23") || sqlState.startsWith("42")
                    || sqlState.startsWith("3D") || sqlState.startsWith("3F");
        }
        return false;
    }

    private static String lowerMessage(SQLException exception) {
        String message = exception.getMessage();
        return message == null ? "" : message.toLowerCase(Locale.ROOT);
    }
}
