/**
 * Persistence configuration properties
 * Centralizes all app.persistence.* settings for type safety and IDE support
 *
 * @author William Callahan
 */

package com.williamcallahan.media_library.config;

import com.williamcallahan.media_library.repository.BatchInsertStrategy;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.persistence")
public class PersistenceConfigurationProperties {

    /**
     * Rows per JDBC batch when inserting with {@link BatchInsertStrategy#GROUPED}.
     */
    private int batchSize = 500;

    /**
     * Strategy used by {@code insertAll} when the caller does not pick one.
     */
    private BatchInsertStrategy defaultBatchStrategy = BatchInsertStrategy.TRANSACTIONAL;

    public int getBatchSize() { return batchSize; }
    public void setBatchSize(int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("app.persistence.batch-size must be > 0");
        }
        this.batchSize = batchSize;
    }

    public BatchInsertStrategy getDefaultBatchStrategy() { return defaultBatchStrategy; }
    public void setDefaultBatchStrategy(BatchInsertStrategy defaultBatchStrategy) {
        this.defaultBatchStrategy = defaultBatchStrategy != null ? defaultBatchStrategy : BatchInsertStrategy.TRANSACTIONAL;
    }
}
