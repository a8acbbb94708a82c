package com.williamcallahan.media_library.repository;

import com.williamcallahan.media_library.config.PersistenceConfigurationProperties;
import com.williamcallahan.media_library.exception.EntityConstraintViolationException;
import com.williamcallahan.media_library.exception.EntityNotFoundException;
import com.williamcallahan.media_library.model.Author;
import com.williamcallahan.media_library.model.BookMetadata;
import com.williamcallahan.media_library.util.AuditTimestamps;
import com.williamcallahan.media_library.util.JdbcUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC store for {@link BookMetadata}: one {@code book_metadata} row per book plus the
 * {@code book_metadata_author} (ordered by {@code position}) and {@code book_metadata_tag} rows.
 *
 * <p>Authors and tags are never diffed. An update deletes both collections and writes the
 * caller's snapshot back, all inside the transaction that rewrites the scalar row.</p>
 */
@Repository
public class JdbcBookMetadataRepository extends JdbcRepositorySupport implements BookMetadataRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcBookMetadataRepository.class);

    private static final String ENTITY = "BookMetadata";

    private static final String INSERT_METADATA =
            "INSERT INTO book_metadata (book_id, title, summary, number, number_sort, release_date, " +
            "title_lock, summary_lock, number_lock, number_sort_lock, release_date_lock, authors_lock, tags_lock, " +
            "created_date, last_modified_date) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

    private static final String UPDATE_METADATA =
            "UPDATE book_metadata SET title = ?, summary = ?, number = ?, number_sort = ?, release_date = ?, " +
            "title_lock = ?, summary_lock = ?, number_lock = ?, number_sort_lock = ?, release_date_lock = ?, " +
            "authors_lock = ?, tags_lock = ?, last_modified_date = ? WHERE book_id = ?";

    private static final String INSERT_AUTHOR =
            "INSERT INTO book_metadata_author (book_id, position, name, role) VALUES (?, ?, ?, ?)";

    private static final String INSERT_TAG =
            "INSERT INTO book_metadata_tag (book_id, tag) VALUES (?, ?)";

    private static final RowMapper<BookMetadata> METADATA_ROW_MAPPER = (rs, rowNum) -> BookMetadata.builder()
            .bookId(rs.getString("book_id"))
            .title(rs.getString("title"))
            .summary(rs.getString("summary"))
            .number(rs.getString("number"))
            .numberSort(rs.getFloat("number_sort"))
            .releaseDate(JdbcUtils.getLocalDateOrNull(rs, "release_date"))
            .titleLock(rs.getBoolean("title_lock"))
            .summaryLock(rs.getBoolean("summary_lock"))
            .numberLock(rs.getBoolean("number_lock"))
            .numberSortLock(rs.getBoolean("number_sort_lock"))
            .releaseDateLock(rs.getBoolean("release_date_lock"))
            .authorsLock(rs.getBoolean("authors_lock"))
            .tagsLock(rs.getBoolean("tags_lock"))
            .createdDate(JdbcUtils.getLocalDateTimeOrNull(rs, "created_date"))
            .lastModifiedDate(JdbcUtils.getLocalDateTimeOrNull(rs, "last_modified_date"))
            .build();

    private static final RowMapper<Author> AUTHOR_ROW_MAPPER =
            (rs, rowNum) -> new Author(rs.getString("name"), rs.getString("role"));

    private final PersistenceConfigurationProperties properties;

    public JdbcBookMetadataRepository(JdbcTemplate jdbcTemplate,
                                      PlatformTransactionManager transactionManager,
                                      PersistenceConfigurationProperties properties) {
        super(jdbcTemplate, transactionManager);
        this.properties = Objects.requireNonNull(properties, "properties");
    }

    @Override
    public BookMetadata insert(BookMetadata metadata) {
        Objects.requireNonNull(metadata, "metadata");
        String bookId = metadata.getBookId();
        return inTransaction("insert " + ENTITY, bookId, status -> {
            // Reject before anything is written
            if (!JdbcUtils.exists(jdbcTemplate, "SELECT COUNT(*) FROM book WHERE id = ?", bookId)) {
                throw new EntityConstraintViolationException("Cannot insert metadata, book does not exist: " + bookId);
            }
            if (metadataExists(bookId)) {
                throw new EntityConstraintViolationException("Book already has metadata: " + bookId);
            }

            LocalDateTime now = AuditTimestamps.now();
            BookMetadata stamped = metadata.toBuilder().createdDate(now).lastModifiedDate(now).build();
            jdbcTemplate.update(INSERT_METADATA,
                    bookId,
                    stamped.getTitle(),
                    stamped.getSummary(),
                    stamped.getNumber(),
                    stamped.getNumberSort(),
                    stamped.getReleaseDate(),
                    stamped.isTitleLock(),
                    stamped.isSummaryLock(),
                    stamped.isNumberLock(),
                    stamped.isNumberSortLock(),
                    stamped.isReleaseDateLock(),
                    stamped.isAuthorsLock(),
                    stamped.isTagsLock(),
                    stamped.getCreatedDate(),
                    stamped.getLastModifiedDate());
            insertAuthors(bookId, stamped.getAuthors());
            insertTags(bookId, stamped.getTags());

            log.debug("Inserted metadata for book {} ({} authors, {} tags)",
                    bookId, stamped.getAuthors().size(), stamped.getTags().size());
            return stamped;
        });
    }

    @Override
    public BookMetadata update(BookMetadata metadata) {
        Objects.requireNonNull(metadata, "metadata");
        String bookId = metadata.getBookId();
        return inTransaction("update " + ENTITY, bookId, status -> {
            LocalDateTime previous = JdbcUtils.queryForOptionalObject(
                    jdbcTemplate,
                    "SELECT last_modified_date FROM book_metadata WHERE book_id = ? FOR UPDATE",
                    (rs, rowNum) -> JdbcUtils.getLocalDateTimeOrNull(rs, "last_modified_date"),
                    bookId
            ).orElseThrow(() -> new EntityNotFoundException(ENTITY, bookId));

            jdbcTemplate.update(UPDATE_METADATA,
                    metadata.getTitle(),
                    metadata.getSummary(),
                    metadata.getNumber(),
                    metadata.getNumberSort(),
                    metadata.getReleaseDate(),
                    metadata.isTitleLock(),
                    metadata.isSummaryLock(),
                    metadata.isNumberLock(),
                    metadata.isNumberSortLock(),
                    metadata.isReleaseDateLock(),
                    metadata.isAuthorsLock(),
                    metadata.isTagsLock(),
                    AuditTimestamps.nextModifiedDate(previous),
                    bookId);

            deleteCollections(List.of(bookId));
            insertAuthors(bookId, metadata.getAuthors());
            insertTags(bookId, metadata.getTags());

            log.debug("Updated metadata for book {}", bookId);
            return findById(bookId);
        });
    }

    @Override
    public BookMetadata findById(String bookId) {
        return findByIdOrEmpty(bookId).orElseThrow(() -> new EntityNotFoundException(ENTITY, bookId));
    }

    @Override
    public Optional<BookMetadata> findByIdOrEmpty(String bookId) {
        if (bookId == null) {
            return Optional.empty();
        }
        return JdbcUtils.queryForOptionalObject(jdbcTemplate,
                        "SELECT * FROM book_metadata WHERE book_id = ?", METADATA_ROW_MAPPER, bookId)
                .map(scalars -> scalars.toBuilder()
                        .authors(findAuthors(bookId))
                        .tags(new LinkedHashSet<>(findTags(bookId)))
                        .build());
    }

    @Override
    public long count() {
        return JdbcUtils.queryForCount(jdbcTemplate, "SELECT COUNT(*) FROM book_metadata");
    }

    @Override
    public void delete(String bookId) {
        if (bookId == null) {
            return;
        }
        deleteAll(List.of(bookId));
    }

    @Override
    public void deleteAll(Collection<String> bookIds) {
        if (bookIds == null || bookIds.isEmpty()) {
            return;
        }
        List<String> ids = List.copyOf(new LinkedHashSet<>(bookIds));
        inTransactionWithoutResult("delete " + ENTITY, ids.size() == 1 ? ids.get(0) : ids.size() + " books", () -> {
            int deleted = 0;
            for (List<String> chunk : JdbcUtils.partition(ids, properties.getBatchSize())) {
                deleteCollections(chunk);
                SqlCondition byBook = SqlCondition.in("book_id", chunk);
                deleted += jdbcTemplate.update("DELETE FROM book_metadata" + byBook.toWhereClause(), byBook.argsArray());
            }
            log.debug("Deleted metadata of {} book(s)", deleted);
        });
    }

    private boolean metadataExists(String bookId) {
        return JdbcUtils.exists(jdbcTemplate, "SELECT COUNT(*) FROM book_metadata WHERE book_id = ?", bookId);
    }

    private List<Author> findAuthors(String bookId) {
        return jdbcTemplate.query(
                "SELECT name, role FROM book_metadata_author WHERE book_id = ? ORDER BY position",
                AUTHOR_ROW_MAPPER, bookId);
    }

    private List<String> findTags(String bookId) {
        return jdbcTemplate.queryForList("SELECT tag FROM book_metadata_tag WHERE book_id = ?", String.class, bookId);
    }

    private void deleteCollections(List<String> bookIds) {
        SqlCondition byBook = SqlCondition.in("book_id", bookIds);
        jdbcTemplate.update("DELETE FROM book_metadata_author" + byBook.toWhereClause(), byBook.argsArray());
        jdbcTemplate.update("DELETE FROM book_metadata_tag" + byBook.toWhereClause(), byBook.argsArray());
    }

    private void insertAuthors(String bookId, List<Author> authors) {
        if (authors.isEmpty()) {
            return;
        }
        List<Object[]> rows = new ArrayList<>(authors.size());
        int position = 0;
        for (Author author : authors) {
            rows.add(new Object[]{bookId, position++, author.name(), author.role()});
        }
        jdbcTemplate.batchUpdate(INSERT_AUTHOR, rows);
    }

    private void insertTags(String bookId, Collection<String> tags) {
        if (tags.isEmpty()) {
            return;
        }
        List<Object[]> rows = new ArrayList<>(tags.size());
        for (String tag : tags) {
            rows.add(new Object[]{bookId, tag});
        }
        jdbcTemplate.batchUpdate(INSERT_TAG, rows);
    }
}
