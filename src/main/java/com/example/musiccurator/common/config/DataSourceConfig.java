package com.example.musiccurator.common.config;

import com.zaxxer.hikari.HikariDataSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.jdbc.DataSourceProperties;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * SQLite creates the database file on first connect but not its parent directory.
 */
@Configuration
public class DataSourceConfig {

    private static final Logger log = LoggerFactory.getLogger(DataSourceConfig.class);

    @Bean
    @ConfigurationProperties("spring.datasource.hikari")
    public HikariDataSource dataSource(DataSourceProperties dataSourceProperties,
                                       AppLibraryProperties appLibraryProperties) {
        Path databaseFile = Paths.get(appLibraryProperties.getDatabasePath()).toAbsolutePath().normalize();
        Path parent = databaseFile.getParent();
        if (parent != null && !Files.isDirectory(parent)) {
            try {
                Files.createDirectories(parent);
                log.info("CATALOG_DIR_CREATED dir={}", parent);
            } catch (IOException e) {
                throw new IllegalStateException("Cannot create catalog directory " + parent, e);
            }
        }
        return dataSourceProperties.initializeDataSourceBuilder().type(HikariDataSource.class).build();
    }
}
