package com.aboutblank.exception;

/**
 * Exception thrown when a sync operation cannot reach or update the datastore.
 *
 * Services catch the underlying DataAccessException, log it with its stack
 * trace and rethrow it wrapped in this exception. The message is the generic,
 * client-safe text for the failed operation (e.g. "Failed to save progress");
 * SQL details stay in the cause and the server log.
 *
 * Usage examples:
 * - Connection pool exhausted and the connect timeout elapsed
 * - Foreign key violation on insert
 * - Any of the three Full Sync reads failing
 *
 * GlobalExceptionHandler maps this to HTTP 500 Internal Server Error with RFC 7807 format.
 *
 * @see com.aboutblank.exception.GlobalExceptionHandler
 */
public class SyncOperationException extends RuntimeException {

    private final String operation;

    /**
     * Constructs a new SyncOperationException.
     *
     * @param operation short operation identifier (e.g. "save-progress")
     * @param message client-safe message describing the failed operation
     * @param cause the underlying datastore exception
     */
    public SyncOperationException(String operation, String message, Throwable cause) {
        super(message, cause);
        this.operation = operation;
    }

    /**
     * Get the operation identifier.
     *
     * @return the operation that failed
     */
    public String getOperation() {
        return operation;
    }
}
