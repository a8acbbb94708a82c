package com.williamcallahan.media_library.repository;

import com.williamcallahan.media_library.model.Series;
import com.williamcallahan.media_library.model.SeriesSearch;

import java.util.Collection;

/**
 * Series store. {@link #update} never changes a series' library.
 */
public interface SeriesRepository extends EntityRepository<Series> {

    Collection<Series> findAll(SeriesSearch search);

    Collection<String> findAllIdByLibraryId(String libraryId);
}
