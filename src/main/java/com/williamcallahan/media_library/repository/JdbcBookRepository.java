package com.williamcallahan.media_library.repository;

import com.williamcallahan.media_library.config.PersistenceConfigurationProperties;
import com.williamcallahan.media_library.model.Book;
import com.williamcallahan.media_library.model.BookSearch;
import com.williamcallahan.media_library.util.JdbcUtils;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

/**
 * Repository for book rows and the library/series search over them.
 * Books may be moved: an update rewrites {@code series_id} and {@code library_id}.
 * Metadata rows go away with their book through the schema's foreign key.
 */
@Repository
public class JdbcBookRepository extends AbstractJdbcEntityRepository<Book> implements BookRepository {

    private static final String SERIES_ID = "series_id";
    private static final String LIBRARY_ID = "library_id";
    private static final String FILE_SIZE = "file_size";

    private static final List<String> DATA_COLUMNS =
            List.of(SERIES_ID, LIBRARY_ID, "name", "url", FILE_SIZE, "file_last_modified");

    private static final RowMapper<Book> BOOK_ROW_MAPPER = (rs, rowNum) -> Book.builder()
            .id(rs.getString(ID))
            .seriesId(rs.getString(SERIES_ID))
            .libraryId(rs.getString(LIBRARY_ID))
            .name(rs.getString("name"))
            .url(rs.getString("url"))
            .fileSize(rs.getLong(FILE_SIZE))
            .fileLastModified(JdbcUtils.getLocalDateTimeOrNull(rs, "file_last_modified"))
            .createdDate(JdbcUtils.getLocalDateTimeOrNull(rs, CREATED_DATE))
            .lastModifiedDate(JdbcUtils.getLocalDateTimeOrNull(rs, LAST_MODIFIED_DATE))
            .build();

    public JdbcBookRepository(JdbcTemplate jdbcTemplate,
                              PlatformTransactionManager transactionManager,
                              PersistenceConfigurationProperties properties) {
        super(jdbcTemplate, transactionManager, properties,
                "Book", "book",
                DATA_COLUMNS,
                DATA_COLUMNS,
                BOOK_ROW_MAPPER);
    }

    @Override
    public Collection<Book> findAll(BookSearch search) {
        return findAllWhere(toCondition(search), null);
    }

    @Override
    public List<Book> findAllBySeriesId(String seriesId) {
        if (seriesId == null) {
            return List.of();
        }
        return findAllWhere(SqlCondition.equalTo(SERIES_ID, seriesId), "name, " + ID);
    }

    @Override
    public Collection<String> findAllIdByLibraryId(String libraryId) {
        if (libraryId == null) {
            return List.of();
        }
        return findIdsWhere(SqlCondition.equalTo(LIBRARY_ID, libraryId));
    }

    @Override
    public Collection<String> findAllIdBySeriesId(String seriesId) {
        if (seriesId == null) {
            return List.of();
        }
        return findIdsWhere(SqlCondition.equalTo(SERIES_ID, seriesId));
    }

    /**
     * One condition per search dimension; unset dimensions match everything.
     */
    static SqlCondition toCondition(BookSearch search) {
        if (search == null) {
            return SqlCondition.all();
        }
        return SqlCondition.in(LIBRARY_ID, search.getLibraryIds())
                .and(SqlCondition.in(SERIES_ID, search.getSeriesIds()))
                .and(SqlCondition.greaterOrEqual(FILE_SIZE, search.getFileSizeAtLeast()));
    }

    @Override
    protected Object[] insertValues(Book book) {
        return new Object[]{
                book.getSeriesId(),
                book.getLibraryId(),
                book.getName(),
                book.getUrl(),
                book.getFileSize(),
                book.getFileLastModified()
        };
    }

    @Override
    protected Object[] updateValues(Book book) {
        return insertValues(book);
    }

    @Override
    protected Book withAuditDates(Book book, LocalDateTime createdDate, LocalDateTime lastModifiedDate) {
        return book.toBuilder().createdDate(createdDate).lastModifiedDate(lastModifiedDate).build();
    }
}
