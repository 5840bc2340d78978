package com.fotoreport.backend.global.error;

import java.sql.SQLException;

/**
 * Kind of storage-level integrity failure, read from the PostgreSQL SQLSTATE of the
 * first {@link SQLException} in a cause chain. Classification never alters the exception.
 */
public enum IntegrityViolation {
    UNIQUE("23505"),
    FOREIGN_KEY("23503"),
    CHECK("23514"),
    NOT_NULL("23502"),
    OTHER(null);

    private final String sqlState;

    IntegrityViolation(String sqlState) {
        this.sqlState = sqlState;
    }

    public static IntegrityViolation classify(Throwable failure) {
        Throwable current = failure;
        while (current != null) {
            if (current instanceof SQLException sqlException && sqlException.getSQLState() != null) {
                return fromSqlState(sqlException.getSQLState());
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return OTHER;
    }

    public static IntegrityViolation fromSqlState(String sqlState) {
        for (IntegrityViolation violation : values()) {
            if (violation.sqlState != null && violation.sqlState.equals(sqlState)) {
                return violation;
            }
        }
        return OTHER;
    }
}
