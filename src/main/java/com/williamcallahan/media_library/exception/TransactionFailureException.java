package com.williamcallahan.media_library.exception;

/**
 * The backing store was unavailable or could not commit. The surrounding transaction was
 * rolled back, so callers observe the state from before the operation.
 */
public class TransactionFailureException extends MediaLibraryPersistenceException {

    public TransactionFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
