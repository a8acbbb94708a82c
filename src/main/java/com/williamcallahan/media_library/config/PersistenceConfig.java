package com.williamcallahan.media_library.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Persistence layer wiring
 *
 * @author William Callahan
 *
 * Features:
 * - Binds app.persistence.* into {@link PersistenceConfigurationProperties}
 * - JdbcTemplate, DataSource and PlatformTransactionManager come from Spring Boot's
 *   JDBC auto-configuration; repositories build their own TransactionTemplate from it
 * - Imported explicitly by the JDBC test slice, picked up by component scanning otherwise
 */
@Configuration
@EnableConfigurationProperties(PersistenceConfigurationProperties.class)
public class PersistenceConfig {
}
