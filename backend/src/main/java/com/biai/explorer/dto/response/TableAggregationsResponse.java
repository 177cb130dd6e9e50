package com.biai.explorer.dto.response;

import java.util.List;

public record TableAggregationsResponse(List<ColumnAggregation> aggregations) {}
