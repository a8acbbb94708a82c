package com.williamcallahan.media_library.repository;

import com.williamcallahan.media_library.exception.EntityConstraintViolationException;
import com.williamcallahan.media_library.exception.MediaLibraryPersistenceException;
import com.williamcallahan.media_library.exception.TransactionFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Base for the JDBC repositories: owns the {@link JdbcTemplate}, a {@link TransactionTemplate}
 * built from the context's transaction manager, and the mapping of Spring's
 * {@code DataAccessException}s onto the persistence error taxonomy.
 *
 * <p>Only integrity and availability failures are translated. Anything else Spring raises
 * propagates unchanged.</p>
 */
public abstract class JdbcRepositorySupport {

    private final Logger log = LoggerFactory.getLogger(getClass());

    protected final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;

    protected JdbcRepositorySupport(JdbcTemplate jdbcTemplate, PlatformTransactionManager transactionManager) {
        this.jdbcTemplate = Objects.requireNonNull(jdbcTemplate, "jdbcTemplate");
        this.transactionTemplate = new TransactionTemplate(Objects.requireNonNull(transactionManager, "transactionManager"));
    }

    /**
     * Runs {@code work} in one transaction (joining the caller's if one is active).
     * Any exception rolls the transaction back before it is translated and rethrown.
     *
     * @param operation short name used in logs and error messages
     * @param key       identifier the operation targets, for logs
     */
    protected <T> T inTransaction(String operation, Object key, TransactionCallback<T> work) {
        try {
            return transactionTemplate.execute(work);
        } catch (MediaLibraryPersistenceException ex) {
            throw ex;
        } catch (DataIntegrityViolationException ex) {
            throw constraintViolation(operation, key, ex);
        } catch (TransactionException | DataAccessResourceFailureException ex) {
            throw transactionFailure(operation, key, ex);
        }
    }

    protected void inTransactionWithoutResult(String operation, Object key, Runnable work) {
        inTransaction(operation, key, status -> {
            work.run();
            return null;
        });
    }

    /**
     * Translates failures of a single statement executed outside an explicit transaction.
     */
    protected <T> T translating(String operation, Object key, Supplier<T> work) {
        try {
            return work.get();
        } catch (DataIntegrityViolationException ex) {
            throw constraintViolation(operation, key, ex);
        } catch (DataAccessResourceFailureException ex) {
            throw transactionFailure(operation, key, ex);
        }
    }

    private EntityConstraintViolationException constraintViolation(String operation, Object key, DataIntegrityViolationException ex) {
        log.warn("{} rejected for {}: {}", operation, key, ex.getMostSpecificCause().getMessage());
        return new EntityConstraintViolationException(operation + " violates a constraint for " + key, ex);
    }

    private TransactionFailureException transactionFailure(String operation, Object key, RuntimeException ex) {
        log.warn("{} failed for {}, rolled back: {}", operation, key, ex.getMessage());
        return new TransactionFailureException(operation + " failed for " + key, ex);
    }
}
