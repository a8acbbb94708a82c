package com.williamcallahan.media_library.repository;

import com.williamcallahan.media_library.model.BookMetadata;

import java.util.Collection;
import java.util.Optional;

/**
 * One-to-one metadata store keyed by book id.
 *
 * <p>Every book created through ingestion gets metadata, so {@link #findById} treats a missing
 * row as an error instead of a normal empty result. {@link #findByIdOrEmpty} exists for teardown
 * paths that run before or after that guarantee holds.</p>
 *
 * <p>Writes are transactional: scalar row, authors and tags are stored together or not at all.
 * Updates replace authors and tags wholesale.</p>
 */
public interface BookMetadataRepository {

    /**
     * @throws com.williamcallahan.media_library.exception.EntityConstraintViolationException
     *         when the book does not exist or already has metadata
     */
    BookMetadata insert(BookMetadata metadata);

    /**
     * @throws com.williamcallahan.media_library.exception.EntityNotFoundException
     *         when the book has no metadata
     */
    BookMetadata update(BookMetadata metadata);

    /**
     * @throws com.williamcallahan.media_library.exception.EntityNotFoundException
     *         when the book has no metadata
     */
    BookMetadata findById(String bookId);

    Optional<BookMetadata> findByIdOrEmpty(String bookId);

    long count();

    /** Succeeds when nothing is stored for {@code bookId}. */
    void delete(String bookId);

    /** One transaction; large collections are deleted in chunks of {@code app.persistence.batch-size}. */
    void deleteAll(Collection<String> bookIds);
}
