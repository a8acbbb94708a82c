package com.williamcallahan.media_library.repository;

import com.williamcallahan.media_library.config.PersistenceConfigurationProperties;
import com.williamcallahan.media_library.exception.EntityNotFoundException;
import com.williamcallahan.media_library.model.Auditable;
import com.williamcallahan.media_library.util.AuditTimestamps;
import com.williamcallahan.media_library.util.JdbcUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.lang.Nullable;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * Single JDBC implementation of {@link EntityRepository}, instantiated once per entity kind.
 *
 * <p>Subclasses describe their table (name, data columns, which of them an update may rewrite),
 * map rows, and supply column values. Identifier and audit columns are handled here:
 * every table has {@code id}, {@code created_date} and {@code last_modified_date}.</p>
 *
 * @param <E> entity type
 */
public abstract class AbstractJdbcEntityRepository<E extends Auditable>
        extends JdbcRepositorySupport implements EntityRepository<E> {

    protected static final String ID = "id";
    protected static final String CREATED_DATE = "created_date";
    protected static final String LAST_MODIFIED_DATE = "last_modified_date";

    private final Logger log = LoggerFactory.getLogger(getClass());

    private final String entityName;
    private final String table;
    private final RowMapper<E> rowMapper;
    private final PersistenceConfigurationProperties properties;

    private final String insertSql;
    private final String updateSql;
    private final String selectSql;

    /**
     * @param entityName    name used in logs and {@link EntityNotFoundException}
     * @param table         table name
     * @param dataColumns   columns written on insert besides id and audit dates, in the order of
     *                      {@link #insertValues}
     * @param updateColumns columns rewritten by an update, in the order of {@link #updateValues}
     * @param rowMapper     maps a full row of {@code table}
     */
    protected AbstractJdbcEntityRepository(JdbcTemplate jdbcTemplate,
                                           PlatformTransactionManager transactionManager,
                                           PersistenceConfigurationProperties properties,
                                           String entityName,
                                           String table,
                                           List<String> dataColumns,
                                           List<String> updateColumns,
                                           RowMapper<E> rowMapper) {
        super(jdbcTemplate, transactionManager);
        this.properties = Objects.requireNonNull(properties, "properties");
        this.entityName = entityName;
        this.table = table;
        this.rowMapper = rowMapper;

        List<String> insertColumns = new ArrayList<>();
        insertColumns.add(ID);
        insertColumns.addAll(dataColumns);
        insertColumns.add(CREATED_DATE);
        insertColumns.add(LAST_MODIFIED_DATE);
        this.insertSql = "INSERT INTO " + table + " (" + JdbcUtils.columnList(insertColumns) + ") VALUES ("
                + JdbcUtils.placeholders(insertColumns.size()) + ")";

        List<String> assignments = new ArrayList<>(updateColumns);
        assignments.add(LAST_MODIFIED_DATE);
        this.updateSql = "UPDATE " + table + " SET " + JdbcUtils.assignmentList(assignments) + " WHERE " + ID + " = ?";

        this.selectSql = "SELECT * FROM " + table;
    }

    /** Values for the data columns, in constructor order. */
    protected abstract Object[] insertValues(E entity);

    /** Values for the update columns, in constructor order. */
    protected abstract Object[] updateValues(E entity);

    /** Copy of {@code entity} carrying the given audit stamps. */
    protected abstract E withAuditDates(E entity, LocalDateTime createdDate, LocalDateTime lastModifiedDate);

    @Override
    public E insert(E entity) {
        Objects.requireNonNull(entity, "entity");
        LocalDateTime now = AuditTimestamps.now();
        E stamped = withAuditDates(entity, now, now);
        translating("insert " + entityName, entity.getId(), () -> jdbcTemplate.update(insertSql, insertArgs(stamped)));
        log.debug("Inserted {} {}", entityName, stamped.getId());
        return stamped;
    }

    @Override
    public E update(E entity) {
        Objects.requireNonNull(entity, "entity");
        String id = entity.getId();
        return inTransaction("update " + entityName, id, status -> {
            LocalDateTime previous = JdbcUtils.queryForOptionalObject(
                    jdbcTemplate,
                    "SELECT " + LAST_MODIFIED_DATE + " FROM " + table + " WHERE " + ID + " = ? FOR UPDATE",
                    (rs, rowNum) -> JdbcUtils.getLocalDateTimeOrNull(rs, LAST_MODIFIED_DATE),
                    id
            ).orElseThrow(() -> new EntityNotFoundException(entityName, id));

            LocalDateTime modified = AuditTimestamps.nextModifiedDate(previous);
            Object[] values = updateValues(entity);
            Object[] args = new Object[values.length + 2];
            System.arraycopy(values, 0, args, 0, values.length);
            args[values.length] = modified;
            args[values.length + 1] = id;

            if (jdbcTemplate.update(updateSql, args) == 0) {
                throw new EntityNotFoundException(entityName, id);
            }
            log.debug("Updated {} {}", entityName, id);
            return Objects.requireNonNull(findByIdOrNull(id));
        });
    }

    @Override
    @Nullable
    public E findByIdOrNull(String id) {
        if (id == null) {
            return null;
        }
        return JdbcUtils.queryForOptionalObject(jdbcTemplate, selectSql + " WHERE " + ID + " = ?", rowMapper, id)
                .orElse(null);
    }

    @Override
    public Collection<E> findAll() {
        return findAllWhere(SqlCondition.all(), null);
    }

    @Override
    public Collection<E> findAllById(Collection<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        List<E> found = new ArrayList<>(ids.size());
        for (List<String> chunk : JdbcUtils.partition(List.copyOf(ids), properties.getBatchSize())) {
            found.addAll(findAllWhere(SqlCondition.in(ID, chunk), null));
        }
        return found;
    }

    @Override
    public long count() {
        return JdbcUtils.queryForCount(jdbcTemplate, "SELECT COUNT(*) FROM " + table);
    }

    @Override
    public void delete(String id) {
        int deleted = translating("delete " + entityName, id,
                () -> jdbcTemplate.update("DELETE FROM " + table + " WHERE " + ID + " = ?", id));
        log.debug("Deleted {} {} ({} row)", entityName, id, deleted);
    }

    @Override
    public void deleteAllById(Collection<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return;
        }
        List<String> distinctIds = List.copyOf(new LinkedHashSet<>(ids));
        int deleted = inTransaction("deleteAllById " + entityName, distinctIds.size() + " ids", status -> {
            int rows = 0;
            for (List<String> chunk : JdbcUtils.partition(distinctIds, properties.getBatchSize())) {
                SqlCondition byId = SqlCondition.in(ID, chunk);
                rows += jdbcTemplate.update("DELETE FROM " + table + byId.toWhereClause(), byId.argsArray());
            }
            return rows;
        });
        log.debug("Deleted {} {} rows by id", deleted, entityName);
    }

    @Override
    public void deleteAll() {
        int deleted = translating("deleteAll " + entityName, table,
                () -> jdbcTemplate.update("DELETE FROM " + table));
        log.debug("Deleted all {} rows from {}", deleted, table);
    }

    @Override
    public void insertAll(Collection<E> entities) {
        insertAll(entities, properties.getDefaultBatchStrategy());
    }

    @Override
    public void insertAll(Collection<E> entities, BatchInsertStrategy strategy) {
        Objects.requireNonNull(strategy, "strategy");
        if (entities == null || entities.isEmpty()) {
            return;
        }
        long start = System.nanoTime();
        switch (strategy) {
            case SEQUENTIAL -> entities.forEach(this::insert);
            case GROUPED -> insertGrouped(entities);
            case TRANSACTIONAL -> inTransactionWithoutResult("insertAll " + entityName, table,
                    () -> entities.forEach(this::insert));
        }
        log.debug("Inserted {} {} rows with {} in {}",
                entities.size(), entityName, strategy, Duration.ofNanos(System.nanoTime() - start));
    }

    private void insertGrouped(Collection<E> entities) {
        LocalDateTime now = AuditTimestamps.now();
        List<Object[]> rows = new ArrayList<>(entities.size());
        for (E entity : entities) {
            rows.add(insertArgs(withAuditDates(entity, now, now)));
        }
        inTransactionWithoutResult("insertAll " + entityName, table, () -> {
            for (List<Object[]> chunk : JdbcUtils.partition(rows, properties.getBatchSize())) {
                jdbcTemplate.batchUpdate(insertSql, chunk);
            }
        });
    }

    /**
     * Rows matching {@code condition}, optionally ordered by {@code orderBy} (a column list).
     */
    protected List<E> findAllWhere(SqlCondition condition, @Nullable String orderBy) {
        String sql = selectSql + condition.toWhereClause() + (orderBy != null ? " ORDER BY " + orderBy : "");
        return jdbcTemplate.query(sql, rowMapper, condition.argsArray());
    }

    /**
     * Identifiers of the rows matching {@code condition}, without materializing the rows.
     */
    protected List<String> findIdsWhere(SqlCondition condition) {
        String sql = "SELECT " + ID + " FROM " + table + condition.toWhereClause();
        return jdbcTemplate.queryForList(sql, String.class, condition.argsArray());
    }

    private Object[] insertArgs(E stamped) {
        Object[] values = insertValues(stamped);
        Object[] args = new Object[values.length + 3];
        args[0] = stamped.getId();
        System.arraycopy(values, 0, args, 1, values.length);
        args[values.length + 1] = stamped.getCreatedDate();
        args[values.length + 2] = stamped.getLastModifiedDate();
        return args;
    }
}
