/**
 * Structural record of a catalogued file
 *
 * Features:
 * - Belongs to one series and, through it, one library
 * - Tracks the source locator, size and last-modified time of the underlying file
 * - File timestamps are independent from the record's own audit dates
 * - Descriptive data lives in {@link BookMetadata}, keyed by the book id
 */
package com.williamcallahan.media_library.model;

import com.williamcallahan.media_library.util.AuditTimestamps;
import com.williamcallahan.media_library.util.IdGenerator;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.Objects;

@Value
public class Book implements Auditable {

    String id;
    String seriesId;
    String libraryId;
    String name;
    String url;
    long fileSize;
    LocalDateTime fileLastModified;
    LocalDateTime createdDate;
    LocalDateTime lastModifiedDate;

    @Builder(toBuilder = true)
    private Book(String id,
                 String seriesId,
                 String libraryId,
                 String name,
                 String url,
                 long fileSize,
                 LocalDateTime fileLastModified,
                 LocalDateTime createdDate,
                 LocalDateTime lastModifiedDate) {
        if (fileSize < 0) {
            throw new IllegalArgumentException("fileSize must be >= 0");
        }
        this.id = id != null ? id : IdGenerator.generate();
        this.seriesId = Objects.requireNonNull(seriesId, "seriesId");
        this.libraryId = Objects.requireNonNull(libraryId, "libraryId");
        this.name = Objects.requireNonNull(name, "name");
        this.url = Objects.requireNonNull(url, "url");
        this.fileSize = fileSize;
        LocalDateTime now = AuditTimestamps.now();
        this.fileLastModified = fileLastModified != null ? fileLastModified : now;
        this.createdDate = createdDate != null ? createdDate : now;
        this.lastModifiedDate = lastModifiedDate != null ? lastModifiedDate : now;
    }
}
