package com.williamcallahan.media_library.model;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BookMetadataTest {

    private static BookMetadata.BookMetadataBuilder base() {
        return BookMetadata.builder().bookId("book").title("Title").number("1").numberSort(1f);
    }

    @Test
    void defaultsForOptionalFields() {
        BookMetadata metadata = base().summary(null).build();

        assertThat(metadata.getSummary()).isEmpty();
        assertThat(metadata.getReleaseDate()).isNull();
        assertThat(metadata.getAuthors()).isEmpty();
        assertThat(metadata.getTags()).isEmpty();
        assertThat(metadata.isTitleLock()).isFalse();
        assertThat(metadata.isTagsLock()).isFalse();
        assertThat(metadata.getCreatedDate()).isEqualTo(metadata.getLastModifiedDate());
    }

    @Test
    void requiredFieldsAreChecked() {
        assertThatThrownBy(() -> BookMetadata.builder().title("t").number("1").build())
                .isInstanceOf(NullPointerException.class)
                .hasMessage("bookId");
        assertThatThrownBy(() -> BookMetadata.builder().bookId("b").number("1").build())
                .isInstanceOf(NullPointerException.class)
                .hasMessage("title");
    }

    @Test
    void collectionsAreCopiedAndImmutable() {
        List<Author> authors = new ArrayList<>(List.of(new Author("A", "writer")));
        BookMetadata metadata = base().authors(authors).build();

        authors.add(new Author("B", "inker"));

        assertThat(metadata.getAuthors()).containsExactly(new Author("A", "writer"));
        assertThatThrownBy(() -> metadata.getAuthors().add(new Author("C", "writer")))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> metadata.getTags().add("tag"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void mergeUnlockedTakesRefreshedValuesForUnlockedFields() {
        LocalDateTime created = LocalDateTime.of(2020, 1, 1, 0, 0);
        BookMetadata current = base().createdDate(created).lastModifiedDate(created).build();
        BookMetadata refreshed = BookMetadata.builder()
                .bookId("other")
                .title("New")
                .summary("Summary")
                .number("2")
                .numberSort(2f)
                .releaseDate(LocalDate.of(2021, 2, 3))
                .authors(List.of(new Author("A", "writer")))
                .tags(Set.of("t"))
                .titleLock(true)
                .build();

        BookMetadata merged = current.mergeUnlocked(refreshed);

        assertThat(merged.getBookId()).isEqualTo("book");
        assertThat(merged.getTitle()).isEqualTo("New");
        assertThat(merged.getSummary()).isEqualTo("Summary");
        assertThat(merged.getNumber()).isEqualTo("2");
        assertThat(merged.getNumberSort()).isEqualTo(2f);
        assertThat(merged.getReleaseDate()).isEqualTo(LocalDate.of(2021, 2, 3));
        assertThat(merged.getAuthors()).containsExactly(new Author("A", "writer"));
        assertThat(merged.getTags()).containsExactly("t");
        assertThat(merged.isTitleLock()).isFalse();
        assertThat(merged.getCreatedDate()).isEqualTo(created);
    }

    @Test
    void mergeUnlockedKeepsEveryLockedField() {
        BookMetadata current = base()
                .summary("Mine")
                .releaseDate(LocalDate.of(1999, 9, 9))
                .authors(List.of(new Author("Me", "writer")))
                .tags(Set.of("mine"))
                .titleLock(true)
                .summaryLock(true)
                .numberLock(true)
                .numberSortLock(true)
                .releaseDateLock(true)
                .authorsLock(true)
                .tagsLock(true)
                .build();
        BookMetadata refreshed = BookMetadata.builder()
                .bookId("book")
                .title("Scanned")
                .summary("Scanned")
                .number("9")
                .numberSort(9f)
                .releaseDate(LocalDate.of(2022, 1, 1))
                .authors(List.of(new Author("Scanner", "writer")))
                .tags(Set.of("scanned"))
                .build();

        assertThat(current.mergeUnlocked(refreshed)).isEqualTo(current);
    }
}
