package com.biai.explorer.dto.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * One bucket of a categorical distribution. {@code value} is the normalized stored
 * value ({@code ""} for empty/null, {@code N/A}); {@code displayValue} is what the
 * explorer shows and sends back as a filter value ({@code (Empty)}, {@code (N/A)}).
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CategoryCount(
    String value,
    String displayValue,
    long count,
    double percentage
) {}
