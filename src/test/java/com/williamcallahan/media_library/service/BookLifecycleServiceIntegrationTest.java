package com.williamcallahan.media_library.service;

import com.williamcallahan.media_library.exception.EntityConstraintViolationException;
import com.williamcallahan.media_library.model.Author;
import com.williamcallahan.media_library.model.Book;
import com.williamcallahan.media_library.model.BookMetadata;
import com.williamcallahan.media_library.model.Library;
import com.williamcallahan.media_library.model.Series;
import com.williamcallahan.media_library.repository.JdbcBookMetadataRepository;
import com.williamcallahan.media_library.repository.JdbcBookRepository;
import com.williamcallahan.media_library.repository.JdbcLibraryRepository;
import com.williamcallahan.media_library.repository.JdbcSeriesRepository;
import com.williamcallahan.media_library.test.annotations.JdbcRepositoryTest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.List;

import static com.williamcallahan.media_library.testutil.EntityFixtures.makeBook;
import static com.williamcallahan.media_library.testutil.EntityFixtures.makeLibrary;
import static com.williamcallahan.media_library.testutil.EntityFixtures.makeSeries;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@JdbcRepositoryTest
class BookLifecycleServiceIntegrationTest {

    @Autowired
    private BookLifecycleService service;

    @Autowired
    private JdbcLibraryRepository libraryRepository;

    @Autowired
    private JdbcSeriesRepository seriesRepository;

    @Autowired
    private JdbcBookRepository bookRepository;

    @Autowired
    private JdbcBookMetadataRepository bookMetadataRepository;

    private Library library;
    private Series series;

    @BeforeEach
    void setUp() {
        library = libraryRepository.insert(makeLibrary());
        series = seriesRepository.insert(makeSeries("Series", library.getId()));
    }

    @AfterEach
    void cleanUp() {
        libraryRepository.deleteAll();
    }

    @Test
    void addBookStoresBookWithNumberedMetadata() {
        service.addBook(makeBook("Issue 01", series.getId(), library.getId()));
        Book second = makeBook("Issue 02", series.getId(), library.getId());

        BookMetadata metadata = service.addBook(second);

        assertThat(bookRepository.count()).isEqualTo(2);
        assertThat(bookMetadataRepository.findById(second.getId())).isEqualTo(metadata);
        assertThat(metadata.getTitle()).isEqualTo("Issue 02");
        assertThat(metadata.getNumber()).isEqualTo("2");
        assertThat(metadata.getNumberSort()).isEqualTo(2f);
    }

    @Test
    void addingBookThatSortsFirstRenumbersTheSeries() {
        Book b = makeBook("b", series.getId(), library.getId());
        Book c = makeBook("c", series.getId(), library.getId());
        Book a = makeBook("a", series.getId(), library.getId());
        service.addBook(b);
        service.addBook(c);

        BookMetadata first = service.addBook(a);

        assertThat(first.getNumber()).isEqualTo("1");
        assertThat(bookMetadataRepository.findById(b.getId()).getNumber()).isEqualTo("2");
        assertThat(bookMetadataRepository.findById(b.getId()).getNumberSort()).isEqualTo(2f);
        assertThat(bookMetadataRepository.findById(c.getId()).getNumber()).isEqualTo("3");
        assertThat(bookMetadataRepository.findById(c.getId()).getNumberSort()).isEqualTo(3f);
    }

    @Test
    void renumberingKeepsLockedNumbers() {
        Book b = makeBook("b", series.getId(), library.getId());
        BookMetadata stored = service.addBook(b);
        bookMetadataRepository.update(stored.toBuilder()
                .number("Annual")
                .numberLock(true)
                .numberSort(99f)
                .numberSortLock(true)
                .build());
        Book c = makeBook("c", series.getId(), library.getId());
        service.addBook(c);

        service.addBook(makeBook("a", series.getId(), library.getId()));

        BookMetadata locked = bookMetadataRepository.findById(b.getId());
        assertThat(locked.getNumber()).isEqualTo("Annual");
        assertThat(locked.getNumberSort()).isEqualTo(99f);
        assertThat(bookMetadataRepository.findById(c.getId()).getNumber()).isEqualTo("3");
    }

    @Test
    void deleteBookRenumbersRemainingBooks() {
        Book a = makeBook("a", series.getId(), library.getId());
        Book b = makeBook("b", series.getId(), library.getId());
        service.addBook(a);
        service.addBook(b);

        service.deleteBook(a.getId());

        assertThat(bookMetadataRepository.findById(b.getId()).getNumber()).isEqualTo("1");
        assertThat(bookMetadataRepository.findById(b.getId()).getNumberSort()).isEqualTo(1f);
    }

    @Test
    void addBookRollsBackWhenBookCannotBeStored() {
        Book stored = makeBook("Issue 01", series.getId(), library.getId());
        service.addBook(stored);

        assertThatThrownBy(() -> service.addBook(stored))
                .isInstanceOf(EntityConstraintViolationException.class);

        assertThat(bookRepository.count()).isEqualTo(1);
        assertThat(bookMetadataRepository.count()).isEqualTo(1);
    }

    @Test
    void refreshMetadataHonorsLocksEndToEnd() {
        Book book = makeBook("Issue 01", series.getId(), library.getId());
        BookMetadata created = service.addBook(book);
        bookMetadataRepository.update(created.toBuilder().title("Custom").titleLock(true).build());

        BookMetadata refreshed = service.refreshMetadata(book.getId(), created.toBuilder()
                .title("Scanned")
                .summary("From the scan")
                .authors(List.of(new Author("Writer", "writer")))
                .build());

        assertThat(refreshed.getTitle()).isEqualTo("Custom");
        assertThat(refreshed.getSummary()).isEqualTo("From the scan");
        assertThat(refreshed.getAuthors()).containsExactly(new Author("Writer", "writer"));
        assertThat(bookMetadataRepository.findById(book.getId())).isEqualTo(refreshed);
    }

    @Test
    void deleteBookRemovesBookAndMetadata() {
        Book book = makeBook("Issue 01", series.getId(), library.getId());
        service.addBook(book);

        service.deleteBook(book.getId());

        assertThat(bookRepository.findByIdOrNull(book.getId())).isNull();
        assertThat(bookMetadataRepository.findByIdOrEmpty(book.getId())).isEmpty();
    }

    @Test
    void deleteSeriesLeavesOtherSeriesIntact() {
        Series other = seriesRepository.insert(makeSeries("Other", library.getId()));
        service.addBook(makeBook("1", series.getId(), library.getId()));
        service.addBook(makeBook("2", series.getId(), library.getId()));
        Book kept = makeBook("kept", other.getId(), library.getId());
        service.addBook(kept);

        service.deleteSeries(series.getId());

        assertThat(seriesRepository.findAll()).extracting(Series::getId).containsExactly(other.getId());
        assertThat(bookRepository.findAll()).extracting(Book::getId).containsExactly(kept.getId());
        assertThat(bookMetadataRepository.count()).isEqualTo(1);
    }

    @Test
    void deleteLibraryRemovesEverything() {
        service.addBook(makeBook("1", series.getId(), library.getId()));
        service.addBook(makeBook("2", series.getId(), library.getId()));

        service.deleteLibrary(library.getId());

        assertThat(libraryRepository.count()).isZero();
        assertThat(seriesRepository.count()).isZero();
        assertThat(bookRepository.count()).isZero();
        assertThat(bookMetadataRepository.count()).isZero();
    }
}
