package com.williamcallahan.media_library.model;

import lombok.Builder;
import lombok.Value;

import java.util.Collection;
import java.util.List;

/**
 * Filter for series searches; an empty dimension is not applied.
 */
@Value
public class SeriesSearch {

    Collection<String> libraryIds;

    @Builder
    private SeriesSearch(Collection<String> libraryIds) {
        this.libraryIds = libraryIds != null ? List.copyOf(libraryIds) : List.of();
    }
}
