package com.williamcallahan.media_library.model;

import com.williamcallahan.media_library.util.AuditTimestamps;
import com.williamcallahan.media_library.util.IdGenerator;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Named root collection. Owns zero or more {@link Series}.
 */
@Value
public class Library implements Auditable {

    String id;
    String name;
    /** Location the library is scanned from (path or URL). */
    String root;
    LocalDateTime createdDate;
    LocalDateTime lastModifiedDate;

    @Builder(toBuilder = true)
    private Library(String id,
                    String name,
                    String root,
                    LocalDateTime createdDate,
                    LocalDateTime lastModifiedDate) {
        this.id = id != null ? id : IdGenerator.generate();
        this.name = Objects.requireNonNull(name, "name");
        this.root = Objects.requireNonNull(root, "root");
        LocalDateTime now = AuditTimestamps.now();
        this.createdDate = createdDate != null ? createdDate : now;
        this.lastModifiedDate = lastModifiedDate != null ? lastModifiedDate : now;
    }
}
