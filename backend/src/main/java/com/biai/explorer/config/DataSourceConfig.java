package com.biai.explorer.config;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.jdbc.DataSourceProperties;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;

/**
 * Data sources.
 * The catalog database (spring.datasource.*) backs JPA; the ClickHouse analytics
 * store (biai.analytics.datasource.*) is only reached through
 * {@code clickHouseJdbcTemplate}.
 */
@Configuration
public class DataSourceConfig {

    @Bean
    @Primary
    @ConfigurationProperties("spring.datasource")
    public DataSourceProperties catalogDataSourceProperties() {
        return new DataSourceProperties();
    }

    @Bean
    @Primary
    public DataSource dataSource(@Qualifier("catalogDataSourceProperties") DataSourceProperties properties) {
        return properties.initializeDataSourceBuilder().build();
    }

    @Bean
    @ConfigurationProperties("biai.analytics.datasource")
    public DataSourceProperties analyticsDataSourceProperties() {
        return new DataSourceProperties();
    }

    @Bean
    public DataSource analyticsDataSource(
            @Qualifier("analyticsDataSourceProperties") DataSourceProperties properties) {
        return properties.initializeDataSourceBuilder().build();
    }

    @Bean
    public JdbcTemplate clickHouseJdbcTemplate(@Qualifier("analyticsDataSource") DataSource dataSource,
                                               AggregationProperties aggregationProperties) {
        JdbcTemplate template = new JdbcTemplate(dataSource);
        if (aggregationProperties.getQueryTimeoutSeconds() > 0) {
            template.setQueryTimeout(aggregationProperties.getQueryTimeoutSeconds());
        }
        return template;
    }
}
