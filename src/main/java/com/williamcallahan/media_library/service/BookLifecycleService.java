package com.williamcallahan.media_library.service;

import com.williamcallahan.media_library.exception.TransactionFailureException;
import com.williamcallahan.media_library.model.Book;
import com.williamcallahan.media_library.model.BookMetadata;
import com.williamcallahan.media_library.repository.BookMetadataRepository;
import com.williamcallahan.media_library.repository.BookRepository;
import com.williamcallahan.media_library.repository.LibraryRepository;
import com.williamcallahan.media_library.repository.SeriesRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Collection;
import java.util.List;

/**
 * Multi-repository operations used by ingestion, metadata refresh and removal.
 *
 * <p>Each method runs in one transaction so a book never exists without its metadata after
 * {@link #addBook}, and metadata never outlives its book during teardown.</p>
 */
@Service
public class BookLifecycleService {

    private static final Logger log = LoggerFactory.getLogger(BookLifecycleService.class);

    private final LibraryRepository libraryRepository;
    private final SeriesRepository seriesRepository;
    private final BookRepository bookRepository;
    private final BookMetadataRepository bookMetadataRepository;
    private final TransactionTemplate transactionTemplate;

    public BookLifecycleService(LibraryRepository libraryRepository,
                                SeriesRepository seriesRepository,
                                BookRepository bookRepository,
                                BookMetadataRepository bookMetadataRepository,
                                PlatformTransactionManager transactionManager) {
        this.libraryRepository = libraryRepository;
        this.seriesRepository = seriesRepository;
        this.bookRepository = bookRepository;
        this.bookMetadataRepository = bookMetadataRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    /**
     * Stores a newly scanned book together with default metadata: the title is the book name,
     * the number is the book's 1-based position among its series' books sorted by name.
     * The other books of the series are renumbered, since the new book may sort before them.
     *
     * @return the stored metadata
     */
    public BookMetadata addBook(Book book) {
        return inTransaction("addBook", book.getId(), status -> {
            Book stored = bookRepository.insert(book);
            List<Book> siblings = bookRepository.findAllBySeriesId(stored.getSeriesId());
            int position = indexOf(siblings, stored.getId()) + 1;
            BookMetadata created = bookMetadataRepository.insert(BookMetadata.builder()
                    .bookId(stored.getId())
                    .title(stored.getName())
                    .number(String.valueOf(position))
                    .numberSort(position)
                    .build());
            renumber(siblings);
            log.info("Added book {} '{}' to series {} at position {}", stored.getId(), stored.getName(), stored.getSeriesId(), position);
            return created;
        });
    }

    /**
     * Applies an automated refresh. Fields the user locked keep their stored value.
     *
     * @param bookId    book whose metadata is refreshed
     * @param refreshed freshly computed metadata; its lock flags and audit dates are ignored
     * @return the stored metadata after the update
     */
    public BookMetadata refreshMetadata(String bookId, BookMetadata refreshed) {
        return inTransaction("refreshMetadata", bookId, status -> {
            BookMetadata current = bookMetadataRepository.findById(bookId);
            BookMetadata merged = current.mergeUnlocked(refreshed);
            if (merged.equals(current)) {
                log.debug("Metadata of book {} unchanged by refresh", bookId);
                return current;
            }
            return bookMetadataRepository.update(merged);
        });
    }

    /** Removes a book's metadata, then the book, and renumbers the rest of its series. */
    public void deleteBook(String bookId) {
        inTransaction("deleteBook", bookId, status -> {
            Book book = bookRepository.findByIdOrNull(bookId);
            bookMetadataRepository.delete(bookId);
            bookRepository.delete(bookId);
            if (book != null) {
                renumber(bookRepository.findAllBySeriesId(book.getSeriesId()));
            }
            return null;
        });
        log.info("Deleted book {}", bookId);
    }

    /** Removes a series and everything below it. */
    public void deleteSeries(String seriesId) {
        inTransaction("deleteSeries", seriesId, status -> {
            deleteBooks(bookRepository.findAllIdBySeriesId(seriesId));
            seriesRepository.delete(seriesId);
            return null;
        });
        log.info("Deleted series {}", seriesId);
    }

    /** Removes a library and everything below it. */
    public void deleteLibrary(String libraryId) {
        inTransaction("deleteLibrary", libraryId, status -> {
            deleteBooks(bookRepository.findAllIdByLibraryId(libraryId));
            seriesRepository.deleteAllById(seriesRepository.findAllIdByLibraryId(libraryId));
            libraryRepository.delete(libraryId);
            return null;
        });
        log.info("Deleted library {}", libraryId);
    }

    private void deleteBooks(Collection<String> bookIds) {
        if (bookIds.isEmpty()) {
            return;
        }
        bookMetadataRepository.deleteAll(bookIds);
        bookRepository.deleteAllById(bookIds);
        log.debug("Deleted {} book(s) with their metadata", bookIds.size());
    }

    /**
     * Numbers books by their position in {@code booksByName}. A locked number or sort number
     * keeps its stored value; books without metadata yet are skipped.
     */
    private void renumber(List<Book> booksByName) {
        for (int i = 0; i < booksByName.size(); i++) {
            int position = i + 1;
            bookMetadataRepository.findByIdOrEmpty(booksByName.get(i).getId()).ifPresent(current -> {
                BookMetadata renumbered = current.mergeUnlocked(current.toBuilder()
                        .number(String.valueOf(position))
                        .numberSort(position)
                        .build());
                if (!renumbered.equals(current)) {
                    bookMetadataRepository.update(renumbered);
                    log.debug("Renumbered book {} to {}", current.getBookId(), position);
                }
            });
        }
    }

    private static int indexOf(List<Book> books, String bookId) {
        for (int i = 0; i < books.size(); i++) {
            if (books.get(i).getId().equals(bookId)) {
                return i;
            }
        }
        return books.size();
    }

    private <T> T inTransaction(String operation, String key, TransactionCallback<T> work) {
        try {
            return transactionTemplate.execute(work);
        } catch (TransactionException ex) {
            log.warn("{} failed for {}, rolled back: {}", operation, key, ex.getMessage());
            throw new TransactionFailureException(operation + " failed for " + key, ex);
        }
    }
}
