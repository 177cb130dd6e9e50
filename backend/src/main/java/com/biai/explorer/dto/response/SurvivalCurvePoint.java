package com.biai.explorer.dto.response;

/**
 * One step of a Kaplan-Meier curve.
 *
 * @param time distinct event/censoring time
 * @param atRisk subjects at risk just before {@code time}
 * @param events events observed at {@code time}
 * @param censored subjects censored at {@code time}
 * @param survival cumulative survival probability after {@code time}
 */
public record SurvivalCurvePoint(
    double time,
    long atRisk,
    long events,
    long censored,
    double survival
) {}
