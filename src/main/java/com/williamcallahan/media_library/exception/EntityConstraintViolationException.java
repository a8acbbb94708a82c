package com.williamcallahan.media_library.exception;

/**
 * A write was rejected because it would break an integrity rule: duplicate identifier,
 * or a dependent row pointing at a parent that does not exist.
 * Nothing from the rejected write is persisted.
 */
public class EntityConstraintViolationException extends MediaLibraryPersistenceException {

    public EntityConstraintViolationException(String message) {
        super(message);
    }

    public EntityConstraintViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
