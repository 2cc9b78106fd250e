package com.nana.equip.repository;

/**
 * Unchecked wrapper for {@link java.sql.SQLException} and row-mapping
 * failures. Services catch this type, never {@code SQLException}.
 */
public class RepositoryException extends RuntimeException {

    public RepositoryException(String message, Throwable cause) {
        super(message, cause);
    }

    public RepositoryException(String message) {
        super(message);
    }
}
