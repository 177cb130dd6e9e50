package com.biai.explorer.controller;

import com.biai.explorer.exception.InvalidQueryException;
import com.biai.explorer.model.query.Filter;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

/**
 * Reads the {@code filters} query parameter (filter tree as JSON).
 */
@Component
public class FilterParameterParser {

    private final ObjectMapper objectMapper;

    public FilterParameterParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @return the filter tree, or {@code null} when the parameter is absent, blank
     *         or an empty list
     */
    public Filter parse(String filters) {
        if (filters == null || filters.isBlank()) {
            return null;
        }
        Filter filter;
        try {
            filter = objectMapper.readValue(filters, Filter.class);
        } catch (JsonProcessingException e) {
            throw new InvalidQueryException("Invalid filters parameter: " + e.getOriginalMessage(), e);
        }
        if (filter instanceof Filter.And and && and.tableName() == null && and.filters().isEmpty()) {
            return null;
        }
        return filter;
    }
}
