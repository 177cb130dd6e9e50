package com.biai.explorer.dto.response;

public record ColumnAggregationResponse(ColumnAggregation aggregation) {}
