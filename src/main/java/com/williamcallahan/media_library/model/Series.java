package com.williamcallahan.media_library.model;

import com.williamcallahan.media_library.util.AuditTimestamps;
import com.williamcallahan.media_library.util.IdGenerator;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * A series belongs to exactly one {@link Library} and owns zero or more {@link Book}s.
 * {@code libraryId} is fixed at creation; updates never move a series.
 */
@Value
public class Series implements Auditable {

    String id;
    String libraryId;
    String name;
    String url;
    LocalDateTime fileLastModified;
    LocalDateTime createdDate;
    LocalDateTime lastModifiedDate;

    @Builder(toBuilder = true)
    private Series(String id,
                   String libraryId,
                   String name,
                   String url,
                   LocalDateTime fileLastModified,
                   LocalDateTime createdDate,
                   LocalDateTime lastModifiedDate) {
        this.id = id != null ? id : IdGenerator.generate();
        this.libraryId = Objects.requireNonNull(libraryId, "libraryId");
        this.name = Objects.requireNonNull(name, "name");
        this.url = Objects.requireNonNull(url, "url");
        LocalDateTime now = AuditTimestamps.now();
        this.fileLastModified = fileLastModified != null ? fileLastModified : now;
        this.createdDate = createdDate != null ? createdDate : now;
        this.lastModifiedDate = lastModifiedDate != null ? lastModifiedDate : now;
    }
}
