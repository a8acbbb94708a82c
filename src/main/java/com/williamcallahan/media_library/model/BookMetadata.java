/**
 * Descriptive, refreshable data of a {@link Book}
 *
 * Features:
 * - One-to-one with its book, keyed by {@code bookId}
 * - Every field (or field group) carries its own lock flag, all unlocked by default
 * - A locked field was set by a user and must survive automated refreshes
 * - Authors keep their order; tags are a set
 * - Missing summary is stored as the empty string, missing release date as null
 */
package com.williamcallahan.media_library.model;

import com.williamcallahan.media_library.util.AuditTimestamps;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

@Value
public class BookMetadata {

    String bookId;

    String title;
    String summary;
    String number;
    float numberSort;
    LocalDate releaseDate;
    List<Author> authors;
    Set<String> tags;

    boolean titleLock;
    boolean summaryLock;
    boolean numberLock;
    boolean numberSortLock;
    boolean releaseDateLock;
    boolean authorsLock;
    boolean tagsLock;

    LocalDateTime createdDate;
    LocalDateTime lastModifiedDate;

    @Builder(toBuilder = true)
    private BookMetadata(String bookId,
                         String title,
                         String summary,
                         String number,
                         float numberSort,
                         LocalDate releaseDate,
                         List<Author> authors,
                         Set<String> tags,
                         boolean titleLock,
                         boolean summaryLock,
                         boolean numberLock,
                         boolean numberSortLock,
                         boolean releaseDateLock,
                         boolean authorsLock,
                         boolean tagsLock,
                         LocalDateTime createdDate,
                         LocalDateTime lastModifiedDate) {
        this.bookId = Objects.requireNonNull(bookId, "bookId");
        this.title = Objects.requireNonNull(title, "title");
        this.summary = summary != null ? summary : "";
        this.number = Objects.requireNonNull(number, "number");
        this.numberSort = numberSort;
        this.releaseDate = releaseDate;
        this.authors = authors != null ? List.copyOf(authors) : List.of();
        this.tags = tags != null ? Collections.unmodifiableSet(new LinkedHashSet<>(tags)) : Set.of();
        this.titleLock = titleLock;
        this.summaryLock = summaryLock;
        this.numberLock = numberLock;
        this.numberSortLock = numberSortLock;
        this.releaseDateLock = releaseDateLock;
        this.authorsLock = authorsLock;
        this.tagsLock = tagsLock;
        LocalDateTime now = AuditTimestamps.now();
        this.createdDate = createdDate != null ? createdDate : now;
        this.lastModifiedDate = lastModifiedDate != null ? lastModifiedDate : now;
    }

    /**
     * Applies a refreshed snapshot on top of this one. Locked fields keep their current value,
     * unlocked fields take the value from {@code refreshed}. Lock flags, book id and audit dates
     * always come from this instance.
     *
     * @param refreshed metadata computed by an automated refresh
     * @return merged metadata, ready to be passed to an update
     */
    public BookMetadata mergeUnlocked(BookMetadata refreshed) {
        Objects.requireNonNull(refreshed, "refreshed");
        return toBuilder()
                .title(titleLock ? title : refreshed.title)
                .summary(summaryLock ? summary : refreshed.summary)
                .number(numberLock ? number : refreshed.number)
                .numberSort(numberSortLock ? numberSort : refreshed.numberSort)
                .releaseDate(releaseDateLock ? releaseDate : refreshed.releaseDate)
                .authors(authorsLock ? authors : refreshed.authors)
                .tags(tagsLock ? tags : refreshed.tags)
                .build();
    }
}
