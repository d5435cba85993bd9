package com.osservatorio.app.config;

import com.osservatorio.core.config.StoreProperties;
import com.osservatorio.data.analytics.AnalyticsStoreAdapter;
import jakarta.persistence.EntityManagerFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.jdbc.DataSourceProperties;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;
import org.springframework.orm.jpa.JpaTransactionManager;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Two stores, two data sources. The metadata store is the primary one that JPA
 * and the default transaction manager bind to; the analytics store gets a
 * single DuckDB connection with its own transaction manager.
 */
@Configuration
@Slf4j
public class DatabaseConfig {

    private static final String DUCKDB_PREFIX = "jdbc:duckdb:";

    @Bean
    @Primary
    @ConfigurationProperties("spring.datasource")
    public DataSourceProperties dataSourceProperties() {
        return new DataSourceProperties();
    }

    @Bean
    @Primary
    public DataSource dataSource(DataSourceProperties dataSourceProperties) {
        log.info("[METADATA] Data source configured | url={}", dataSourceProperties.determineUrl());
        return dataSourceProperties.initializeDataSourceBuilder().build();
    }

    @Bean
    @Primary
    public PlatformTransactionManager transactionManager(EntityManagerFactory entityManagerFactory) {
        return new JpaTransactionManager(entityManagerFactory);
    }

    @Bean(destroyMethod = "destroy")
    public SingleConnectionDataSource analyticsDataSource(StoreProperties properties) {
        String url = properties.getAnalyticsUrl();
        createParentDirectory(url);
        // suppressClose: every caller shares the one connection
        SingleConnectionDataSource dataSource = new SingleConnectionDataSource(url, true);
        dataSource.setDriverClassName("org.duckdb.DuckDBDriver");
        dataSource.setAutoCommit(true);
        log.info("[ANALYTICS] Data source configured | url={}", url);
        return dataSource;
    }

    @Bean
    public PlatformTransactionManager analyticsTransactionManager(
            @Qualifier("analyticsDataSource") DataSource analyticsDataSource) {
        return new DataSourceTransactionManager(analyticsDataSource);
    }

    @Bean
    public AnalyticsStoreAdapter analyticsStoreAdapter(@Qualifier("analyticsDataSource") DataSource analyticsDataSource,
                                                       @Qualifier("analyticsTransactionManager") PlatformTransactionManager analyticsTransactionManager,
                                                       StoreProperties properties) {
        AnalyticsStoreAdapter adapter = new AnalyticsStoreAdapter(new JdbcTemplate(analyticsDataSource),
                analyticsTransactionManager, properties.getAnalyticsLoadTimeout(), properties.getAnalyticsBatchSize());
        adapter.initializeSchema();
        return adapter;
    }

    private static void createParentDirectory(String url) {
        if (!url.startsWith(DUCKDB_PREFIX)) {
            return;
        }
        String file = url.substring(DUCKDB_PREFIX.length());
        int options = file.indexOf('?');
        if (options >= 0) {
            file = file.substring(0, options);
        }
        // in-memory database
        if (file.isEmpty() || file.startsWith(":memory:")) {
            return;
        }
        Path parent = Path.of(file).toAbsolutePath().getParent();
        if (parent == null) {
            return;
        }
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create analytics store directory " + parent, e);
        }
    }
}
