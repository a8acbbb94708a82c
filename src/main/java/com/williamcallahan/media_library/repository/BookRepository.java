package com.williamcallahan.media_library.repository;

import com.williamcallahan.media_library.model.Book;
import com.williamcallahan.media_library.model.BookSearch;

import java.util.Collection;
import java.util.List;

/**
 * Book store with hierarchy search. The {@code findAllId*} methods return identifiers only,
 * for callers reconciling against a scan that do not need the rows.
 */
public interface BookRepository extends EntityRepository<Book> {

    Collection<Book> findAll(BookSearch search);

    /** Books of a series ordered by name. */
    List<Book> findAllBySeriesId(String seriesId);

    Collection<String> findAllIdByLibraryId(String libraryId);

    Collection<String> findAllIdBySeriesId(String seriesId);
}
