package com.koni.ems.infrastructure.persistence.timescale;

import com.koni.ems.domain.exception.DatabaseUnavailableException;
import com.koni.ems.domain.exception.NotFoundException;
import com.koni.ems.domain.exception.StorageException;
import com.koni.ems.domain.exception.ValidationException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;

import java.sql.SQLException;
import java.util.Set;

/**
 * Translates JDBC failures into domain exceptions by SQL state.
 */
final class DataAccessErrors {

    static final String NUMERIC_VALUE_OUT_OF_RANGE = "22003";
    static final String UNDEFINED_TABLE = "42P01";
    static final String DUPLICATE_TABLE = "42P07";
    static final String UNIQUE_VIOLATION = "23505";

    private static final Set<String> UNAVAILABLE_STATES = Set.of("53300", "57P01", "57P02", "57P03");

    private DataAccessErrors() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Translates a failure on the data path (insert and queries).
     */
    static RuntimeException translate(DataAccessException e, String message) {
        String state = sqlState(e);
        if (NUMERIC_VALUE_OUT_OF_RANGE.equals(state)) {
            return new ValidationException("Value out of range for its column", e);
        }
        if (UNDEFINED_TABLE.equals(state)) {
            return new NotFoundException("Device storage not found", e);
        }
        return translateDdl(e, message);
    }

    /**
     * Translates a failure of a DDL or maintenance statement. Only connectivity problems
     * are told apart; everything else is a storage failure.
     */
    static RuntimeException translateDdl(DataAccessException e, String message) {
        if (isUnavailable(e)) {
            return new DatabaseUnavailableException("Database unavailable: " + message, e);
        }
        return new StorageException(message, e);
    }

    /**
     * True when a concurrent creator got there first.
     */
    static boolean isAlreadyExists(DataAccessException e) {
        String state = sqlState(e);
        return DUPLICATE_TABLE.equals(state) || UNIQUE_VIOLATION.equals(state);
    }

    static boolean isUnavailable(DataAccessException e) {
        if (e instanceof DataAccessResourceFailureException || e instanceof TransientDataAccessException) {
            return true;
        }
        String state = sqlState(e);
        return state != null && (state.startsWith("08") || UNAVAILABLE_STATES.contains(state));
    }

    static String sqlState(Throwable e) {
        Throwable current = e;
        while (current != null) {
            if (current instanceof SQLException && ((SQLException) current).getSQLState() != null) {
                return ((SQLException) current).getSQLState();
            }
            current = current.getCause();
        }
        return null;
    }
}
