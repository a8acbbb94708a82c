/**
 * Thrown when an operation requires a stored row that does not exist
 *
 * Features:
 * - Raised by update on a missing identifier
 * - Raised by the metadata lookup, where a missing row means broken data
 * - Carries the entity kind and identifier for logging and API mapping
 */

package com.williamcallahan.media_library.exception;

public class EntityNotFoundException extends MediaLibraryPersistenceException {

    private final String entityType;
    private final String id;

    public EntityNotFoundException(String entityType, String id) {
        super(entityType + " not found: " + id);
        this.entityType = entityType;
        this.id = id;
    }

    public String getEntityType() {
        return entityType;
    }

    public String getId() {
        return id;
    }
}
