package com.williamcallahan.media_library.exception;

/**
 * Root of the persistence error taxonomy. Unchecked; none of the repositories retry.
 */
public abstract class MediaLibraryPersistenceException extends RuntimeException {

    protected MediaLibraryPersistenceException(String message) {
        super(message);
    }

    protected MediaLibraryPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
