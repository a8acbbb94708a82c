package com.williamcallahan.media_library.repository;

import com.williamcallahan.media_library.config.PersistenceConfigurationProperties;
import com.williamcallahan.media_library.model.Library;
import com.williamcallahan.media_library.util.JdbcUtils;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public class JdbcLibraryRepository extends AbstractJdbcEntityRepository<Library> implements LibraryRepository {

    private static final RowMapper<Library> LIBRARY_ROW_MAPPER = (rs, rowNum) -> Library.builder()
            .id(rs.getString(ID))
            .name(rs.getString("name"))
            .root(rs.getString("root"))
            .createdDate(JdbcUtils.getLocalDateTimeOrNull(rs, CREATED_DATE))
            .lastModifiedDate(JdbcUtils.getLocalDateTimeOrNull(rs, LAST_MODIFIED_DATE))
            .build();

    public JdbcLibraryRepository(JdbcTemplate jdbcTemplate,
                                 PlatformTransactionManager transactionManager,
                                 PersistenceConfigurationProperties properties) {
        super(jdbcTemplate, transactionManager, properties,
                "Library", "library",
                List.of("name", "root"),
                List.of("name", "root"),
                LIBRARY_ROW_MAPPER);
    }

    @Override
    protected Object[] insertValues(Library library) {
        return new Object[]{library.getName(), library.getRoot()};
    }

    @Override
    protected Object[] updateValues(Library library) {
        return insertValues(library);
    }

    @Override
    protected Library withAuditDates(Library library, LocalDateTime createdDate, LocalDateTime lastModifiedDate) {
        return library.toBuilder().createdDate(createdDate).lastModifiedDate(lastModifiedDate).build();
    }
}
