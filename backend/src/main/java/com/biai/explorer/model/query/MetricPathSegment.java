package com.biai.explorer.model.query;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MetricPathSegment(
    String fromTable,
    String viaColumn,
    String toTable,
    String referencedColumn
) {}
