package com.biai.explorer.dto.request;

import jakarta.validation.constraints.NotBlank;

/**
 * Query parameters of the survival curve endpoint.
 */
public record SurvivalCurveRequest(
    @NotBlank(message = "timeColumn is required")
    String timeColumn,

    @NotBlank(message = "statusColumn is required")
    String statusColumn,

    String filters,

    String countBy
) {}
