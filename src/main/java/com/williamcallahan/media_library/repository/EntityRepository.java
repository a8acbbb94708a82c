package com.williamcallahan.media_library.repository;

import com.williamcallahan.media_library.model.Auditable;
import org.springframework.lang.Nullable;

import java.util.Collection;
import java.util.Optional;

/**
 * Generic store for one entity kind keyed by an opaque string identifier.
 *
 * <p>The repository owns the audit stamps: {@code createdDate} is written once on insert and
 * never touched again, {@code lastModifiedDate} is written on insert and moved forward on every
 * update. Values supplied by callers for either field are ignored.</p>
 *
 * @param <E> entity type
 */
public interface EntityRepository<E extends Auditable> {

    /**
     * Persists a new entity.
     *
     * @return the entity as stored, with both audit stamps set to now
     * @throws com.williamcallahan.media_library.exception.EntityConstraintViolationException
     *         when the identifier is already taken or a parent row is missing
     */
    E insert(E entity);

    /**
     * Replaces every mutable field of an existing entity.
     *
     * @return the entity as stored, with the original {@code createdDate}
     * @throws com.williamcallahan.media_library.exception.EntityNotFoundException
     *         when no entity has that identifier
     */
    E update(E entity);

    /**
     * @return the stored entity, or {@code null} when absent; never throws for a missing id
     */
    @Nullable
    E findByIdOrNull(String id);

    default Optional<E> findById(String id) {
        return Optional.ofNullable(findByIdOrNull(id));
    }

    /** Unordered. */
    Collection<E> findAll();

    /** Unknown identifiers are skipped. Large collections are queried in chunks. */
    Collection<E> findAllById(Collection<String> ids);

    long count();

    /** No-op when the identifier does not exist. */
    void delete(String id);

    /**
     * Removes the entities with the given identifiers in one transaction; unknown identifiers
     * are skipped. Large collections are deleted in chunks of {@code app.persistence.batch-size}.
     */
    void deleteAllById(Collection<String> ids);

    /** Removes every row of this kind; safe on an empty store. */
    void deleteAll();

    /**
     * Inserts many new entities with the given execution plan. The stored result is identical
     * for every strategy.
     */
    void insertAll(Collection<E> entities, BatchInsertStrategy strategy);

    /** {@link #insertAll(Collection, BatchInsertStrategy)} with the configured default strategy. */
    void insertAll(Collection<E> entities);
}
