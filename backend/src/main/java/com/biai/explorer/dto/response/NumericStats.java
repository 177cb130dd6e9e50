package com.biai.explorer.dto.response;

public record NumericStats(
    Double min,
    Double max,
    Double mean,
    Double median,
    Double stddev,
    Double q25,
    Double q75
) {}
