package com.williamcallahan.media_library.model;

import lombok.Builder;
import lombok.Value;

import java.util.Collection;
import java.util.List;

/**
 * Filter for book searches. Every dimension is optional: a {@code null} or empty
 * dimension is not applied. Set dimensions are combined with AND.
 *
 * <p>New dimensions are added as new builder properties so existing callers keep compiling
 * and keep their meaning.</p>
 */
@Value
public class BookSearch {

    Collection<String> libraryIds;
    Collection<String> seriesIds;
    /** Only books whose file is at least this many bytes. */
    Long fileSizeAtLeast;

    @Builder
    private BookSearch(Collection<String> libraryIds, Collection<String> seriesIds, Long fileSizeAtLeast) {
        this.libraryIds = libraryIds != null ? List.copyOf(libraryIds) : List.of();
        this.seriesIds = seriesIds != null ? List.copyOf(seriesIds) : List.of();
        this.fileSizeAtLeast = fileSizeAtLeast;
    }

    public static BookSearch unfiltered() {
        return builder().build();
    }
}
