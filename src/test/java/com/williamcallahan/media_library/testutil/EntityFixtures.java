package com.williamcallahan.media_library.testutil;

import com.williamcallahan.media_library.model.Book;
import com.williamcallahan.media_library.model.Library;
import com.williamcallahan.media_library.model.Series;

import java.time.LocalDateTime;

/** Factory helpers for entities with sensible defaults. */
public final class EntityFixtures {
    private EntityFixtures() {}

    public static Library makeLibrary() {
        return makeLibrary("Library");
    }

    public static Library makeLibrary(String name) {
        return Library.builder()
                .name(name)
                .root("file:/library/" + name)
                .build();
    }

    public static Series makeSeries(String name, String libraryId) {
        return Series.builder()
                .libraryId(libraryId)
                .name(name)
                .url("file:/library/" + name)
                .fileLastModified(LocalDateTime.now())
                .build();
    }

    public static Book makeBook(String name, String seriesId, String libraryId) {
        return Book.builder()
                .seriesId(seriesId)
                .libraryId(libraryId)
                .name(name)
                .url("file:/library/" + name + ".cbz")
                .fileSize(1024L)
                .fileLastModified(LocalDateTime.now())
                .build();
    }
}
