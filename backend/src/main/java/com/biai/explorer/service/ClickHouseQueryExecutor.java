package com.biai.explorer.service;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Runs generated SELECT statements against ClickHouse over JDBC.
 * Rows are read as column maps and converted with Jackson, so result records
 * bind by column alias.
 */
@Slf4j
@Service
public class ClickHouseQueryExecutor implements AnalyticsQueryExecutor {

    private static final Pattern LEADING_COMMENTS = Pattern.compile("^(\\s|--[^\\n]*\\n|/\\*.*?\\*/)*",
        Pattern.DOTALL);

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public ClickHouseQueryExecutor(@Qualifier("clickHouseJdbcTemplate") JdbcTemplate jdbcTemplate,
                                   ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper.copy()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public <T> List<T> query(String sql, Class<T> rowType) {
        requireReadOnly(sql);
        log.debug("Executing analytics query:\n{}", sql);

        List<Map<String, Object>> rows = jdbcTemplate.queryForList(sql);
        return rows.stream()
            .map(row -> objectMapper.convertValue(row, rowType))
            .collect(Collectors.toList());
    }

    static void requireReadOnly(String sql) {
        if (sql == null) {
            throw new IllegalArgumentException("Only SELECT queries can be executed");
        }
        String statement = LEADING_COMMENTS.matcher(sql).replaceFirst("").toUpperCase(Locale.ROOT);
        if (!statement.startsWith("SELECT") && !statement.startsWith("WITH")) {
            throw new IllegalArgumentException("Only SELECT queries can be executed");
        }
    }
}
