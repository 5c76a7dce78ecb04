package com.elclab.components.repository;

/**
 * Unchecked exception for data-access failures.
 *
 * <p>Wraps {@link java.sql.SQLException} so callers above the repository
 * layer never depend on JDBC types. Store errors are infrastructure
 * failures rather than recoverable business conditions, so they are not
 * declared on the repository interfaces.
 */
public class RepositoryException extends RuntimeException {

    public RepositoryException(String message, Throwable cause) {
        super(message, cause);
    }

    public RepositoryException(String message) {
        super(message);
    }
}
