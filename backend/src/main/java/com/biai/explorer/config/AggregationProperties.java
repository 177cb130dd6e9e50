package com.biai.explorer.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Tuning of the aggregation engine, bound from {@code biai.aggregation.*}.
 */
@Configuration
@ConfigurationProperties(prefix = "biai.aggregation")
@Getter
@Setter
public class AggregationProperties {

    /**
     * Database used for storage table names without a database prefix.
     */
    private String defaultDatabase = "biai";

    private int categoryLimit = 50;

    /**
     * Geographic columns list every region, so they get a larger bucket limit.
     */
    private int geographicCategoryLimit = 100;

    private int histogramBins = 20;

    /**
     * Threads used to aggregate the columns of a table concurrently.
     */
    private int columnPoolSize = 8;

    private int columnQueueCapacity = 500;

    /**
     * Per-query timeout in seconds; 0 leaves the driver default.
     */
    private int queryTimeoutSeconds = 60;
}
