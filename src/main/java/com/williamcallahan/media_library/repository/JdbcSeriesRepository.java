package com.williamcallahan.media_library.repository;

import com.williamcallahan.media_library.config.PersistenceConfigurationProperties;
import com.williamcallahan.media_library.model.Series;
import com.williamcallahan.media_library.model.SeriesSearch;
import com.williamcallahan.media_library.util.JdbcUtils;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

/**
 * Series rows. {@code library_id} is written on insert only; deleting a series cascades
 * to its books through the schema's foreign key.
 */
@Repository
public class JdbcSeriesRepository extends AbstractJdbcEntityRepository<Series> implements SeriesRepository {

    private static final String LIBRARY_ID = "library_id";

    private static final RowMapper<Series> SERIES_ROW_MAPPER = (rs, rowNum) -> Series.builder()
            .id(rs.getString(ID))
            .libraryId(rs.getString(LIBRARY_ID))
            .name(rs.getString("name"))
            .url(rs.getString("url"))
            .fileLastModified(JdbcUtils.getLocalDateTimeOrNull(rs, "file_last_modified"))
            .createdDate(JdbcUtils.getLocalDateTimeOrNull(rs, CREATED_DATE))
            .lastModifiedDate(JdbcUtils.getLocalDateTimeOrNull(rs, LAST_MODIFIED_DATE))
            .build();

    public JdbcSeriesRepository(JdbcTemplate jdbcTemplate,
                                PlatformTransactionManager transactionManager,
                                PersistenceConfigurationProperties properties) {
        super(jdbcTemplate, transactionManager, properties,
                "Series", "series",
                List.of(LIBRARY_ID, "name", "url", "file_last_modified"),
                List.of("name", "url", "file_last_modified"),
                SERIES_ROW_MAPPER);
    }

    @Override
    public Collection<Series> findAll(SeriesSearch search) {
        return findAllWhere(toCondition(search), null);
    }

    @Override
    public Collection<String> findAllIdByLibraryId(String libraryId) {
        if (libraryId == null) {
            return List.of();
        }
        return findIdsWhere(SqlCondition.equalTo(LIBRARY_ID, libraryId));
    }

    static SqlCondition toCondition(SeriesSearch search) {
        if (search == null) {
            return SqlCondition.all();
        }
        return SqlCondition.in(LIBRARY_ID, search.getLibraryIds());
    }

    @Override
    protected Object[] insertValues(Series series) {
        return new Object[]{series.getLibraryId(), series.getName(), series.getUrl(), series.getFileLastModified()};
    }

    @Override
    protected Object[] updateValues(Series series) {
        return new Object[]{series.getName(), series.getUrl(), series.getFileLastModified()};
    }

    @Override
    protected Series withAuditDates(Series series, LocalDateTime createdDate, LocalDateTime lastModifiedDate) {
        return series.toBuilder().createdDate(createdDate).lastModifiedDate(lastModifiedDate).build();
    }
}
