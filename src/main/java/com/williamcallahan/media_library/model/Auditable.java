package com.williamcallahan.media_library.model;

import java.time.LocalDateTime;

/**
 * Capability contract shared by every entity the generic repository stores:
 * an opaque identifier plus the two audit stamps the repository maintains.
 */
public interface Auditable {

    String getId();

    LocalDateTime getCreatedDate();

    LocalDateTime getLastModifiedDate();
}
