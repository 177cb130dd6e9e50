package com.biai.explorer.dto.response;

import java.util.List;

public record SurvivalCurveResponse(List<SurvivalCurvePoint> curve) {}
