package com.williamcallahan.media_library.repository;

import com.williamcallahan.media_library.config.PersistenceConfigurationProperties;
import com.williamcallahan.media_library.exception.EntityConstraintViolationException;
import com.williamcallahan.media_library.exception.EntityNotFoundException;
import com.williamcallahan.media_library.exception.TransactionFailureException;
import com.williamcallahan.media_library.model.Library;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;

import java.util.List;

import static com.williamcallahan.media_library.testutil.EntityFixtures.makeLibrary;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JdbcRepositorySupportTest {

    @Mock
    private JdbcTemplate jdbcTemplate;

    @Mock
    private PlatformTransactionManager transactionManager;

    private JdbcLibraryRepository repository;

    @BeforeEach
    void setUp() {
        repository = new JdbcLibraryRepository(jdbcTemplate, transactionManager, new PersistenceConfigurationProperties());
    }

    @Test
    void integrityViolationBecomesConstraintViolation() {
        doThrow(new DuplicateKeyException("duplicate key"))
                .when(jdbcTemplate).update(anyString(), any(Object[].class));

        assertThatThrownBy(() -> repository.insert(makeLibrary()))
                .isInstanceOf(EntityConstraintViolationException.class)
                .hasCauseInstanceOf(DuplicateKeyException.class);
    }

    @Test
    void lostConnectionBecomesTransactionFailure() {
        doThrow(new CannotGetJdbcConnectionException("connection refused"))
                .when(jdbcTemplate).update(anyString(), any(Object[].class));

        assertThatThrownBy(() -> repository.insert(makeLibrary()))
                .isInstanceOf(TransactionFailureException.class)
                .hasCauseInstanceOf(CannotGetJdbcConnectionException.class);
    }

    @Test
    void transactionThatCannotStartBecomesTransactionFailure() {
        when(transactionManager.getTransaction(any(TransactionDefinition.class)))
                .thenThrow(new CannotCreateTransactionException("pool exhausted"));
        Library library = makeLibrary();

        assertThatThrownBy(() -> repository.update(library))
                .isInstanceOf(TransactionFailureException.class)
                .hasMessageContaining(library.getId());
        verify(jdbcTemplate, never()).update(anyString(), any(Object[].class));
    }

    @Test
    void deleteAllByIdBindsAtMostBatchSizeIdentifiersPerStatement() {
        PersistenceConfigurationProperties properties = new PersistenceConfigurationProperties();
        properties.setBatchSize(2);
        JdbcLibraryRepository chunked = new JdbcLibraryRepository(jdbcTemplate, transactionManager, properties);

        chunked.deleteAllById(List.of("a", "b", "c", "d", "e"));

        verify(jdbcTemplate, times(2)).update(eq("DELETE FROM library WHERE id IN (?, ?)"), any(Object[].class));
        verify(jdbcTemplate).update(eq("DELETE FROM library WHERE id IN (?)"), any(Object[].class));
        verify(transactionManager).commit(any());
    }

    @Test
    void domainExceptionsPassThroughUntranslated() {
        Library library = makeLibrary();

        // no stored row: the stamp lookup comes back empty
        assertThatThrownBy(() -> repository.update(library))
                .isInstanceOf(EntityNotFoundException.class);
    }
}
