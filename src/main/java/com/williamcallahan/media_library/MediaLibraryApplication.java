/**
 * Main application class for the media library persistence core
 *
 * @author William Callahan
 *
 * Features:
 * - Boots the JDBC stack (DataSource, JdbcTemplate, transaction manager)
 * - Applies schema.sql through Spring's SQL initialization
 * - Exposes the repositories and BookLifecycleService as beans for the
 *   scanner, metadata refresh and API layers that embed this module
 */

package com.williamcallahan.media_library;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MediaLibraryApplication {

    /**
     * Main method that starts the Spring Boot application
     *
     * @param args Command line arguments passed to the application
     */
    public static void main(String[] args) {
        SpringApplication.run(MediaLibraryApplication.class, args);
    }
}
