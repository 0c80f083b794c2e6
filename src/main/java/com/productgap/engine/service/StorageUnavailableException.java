package com.productgap.engine.service;

import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessResourceException;
import org.springframework.transaction.CannotCreateTransactionException;

/**
 * The data store cannot be reached. Aborts the running batch; work already committed for earlier posts stands.
 */
public class StorageUnavailableException extends RuntimeException {
    public StorageUnavailableException(String message) {
        super(message);
    }

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * True when {@code error} or one of its causes means the store itself is down, as opposed to a
     * rejected write for a single row.
     */
    public static boolean indicatesOutage(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof StorageUnavailableException
                    || current instanceof DataAccessResourceFailureException
                    || current instanceof TransientDataAccessResourceException
                    || current instanceof CannotCreateTransactionException) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }
}
