package com.biai.explorer.dto.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record HistogramBin(
    double binStart,
    double binEnd,
    long count,
    double percentage
) {}
