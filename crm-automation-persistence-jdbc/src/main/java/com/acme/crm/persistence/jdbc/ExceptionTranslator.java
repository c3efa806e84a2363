package com.acme.crm.persistence.jdbc;

import com.acme.crm.core.PermanentException;
import com.acme.crm.core.TransientException;
import org.slf4j.Logger;

import java.sql.SQLException;
import java.util.Locale;

/**
 * Maps SQLException onto the retry taxonomy used by the job runner and the engine.
 * Anything not recognised as permanent is treated as transient.
 */
public final class ExceptionTranslator {

    private static final String UNIQUE_VIOLATION = "23505";

    private ExceptionTranslator() {
    }

    public static RuntimeException translateException(
            SQLException exception, String operation, Logger logger) {

        logger.error("Database operation failed: {}", operation, exception);

        String detail = String.format("%s: %s", operation, exception.getMessage());
        if (isTransient(exception)) {
            return new TransientException("Transient database error during " + detail, exception);
        }
        if (isPermanent(exception)) {
            return new PermanentException("Permanent database error during " + detail, exception);
        }
        return new TransientException("Database error during " + detail, exception);
    }

    /** True for a unique constraint violation, reported the same way by H2 and PostgreSQL. */
    public static boolean isUniqueViolation(SQLException exception) {
        return exception != null && UNIQUE_VIOLATION.equals(exception.getSQLState());
    }

    static boolean isTransient(SQLException exception) {
        String message = lowerMessage(exception);
        if (message.contains("timeout") || message.contains("connection refused")
                || message.contains("deadlock") || message.contains("too many connections")
                || message.contains("pool exhausted")) {
            return true;
        }

        String sqlState = exception.getSQLState();
        if (sqlState != null) {
            // 08 connection, 40 transaction rollback, 53 insufficient resources
            if (sqlState.startsWith("08") || sqlState.startsWith("40") || sqlState.startsWith("53")) {
                return true;
            }
            // 57014 statement cancelled by timeout, 57P01..57P03 server shutting down or starting
            if (sqlState.equals("57014") || sqlState.startsWith("57P")) {
                return true;
            }
        }

        // H2: 50200 lock timeout, 90020 database in use, 90008 general timeout
        int code = exception.getErrorCode();
        return code == 50200 || code == 90020 || code == 90008;
    }

    static boolean isPermanent(SQLException exception) {
        String message = lowerMessage(exception);
        if (message.contains("syntax error") || message.contains("not found")
                || message.contains("does not exist") || message.contains("constraint violation")
                || message.contains("unique constraint") || message.contains("foreign key")
                || message.contains("type mismatch")) {
            return true;
        }

        String sqlState = exception.getSQLState();
        if (sqlState != null) {
            // 22 data, 23 integrity, 42 syntax or access, 3D catalog, 3F schema
            if (sqlState.startsWith("22") || sqlState.startsWith("23") || sqlState.startsWith("42")
                    || sqlState.startsWith("3D") || sqlState.startsWith("3F")) {
                return true;
            }
        }

        // H2: 42102 table not found, 42122 column not found, 90007 parameter count
        int code = exception.getErrorCode();
        return code == 42102 || code == 42122 || code == 90007;
    }

    private static String lowerMessage(SQLException exception) {
        String message = exception.getMessage();
        return message == null ? "" : message.toLowerCase(Locale.ROOT);
    }
}
