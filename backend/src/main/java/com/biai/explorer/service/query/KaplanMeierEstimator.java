package com.biai.explorer.service.query;

import com.biai.explorer.dto.response.SurvivalCurvePoint;

import java.util.ArrayList;
import java.util.List;

/**
 * Kaplan-Meier product-limit estimate over per-time event/censor counts.
 */
public final class KaplanMeierEstimator {

    private KaplanMeierEstimator() {
    }

    /**
     * Events and censorings observed at one distinct time.
     */
    public record TimeGroup(double time, long events, long censored) {}

    /**
     * @param groups one entry per distinct time, in ascending time order
     * @return one curve point per group; the risk set starts at the total of all
     *         events and censorings
     */
    public static List<SurvivalCurvePoint> estimate(List<TimeGroup> groups) {
        long atRisk = 0;
        for (TimeGroup group : groups) {
            atRisk += Math.max(group.events(), 0) + Math.max(group.censored(), 0);
        }

        double survival = 1.0;
        List<SurvivalCurvePoint> curve = new ArrayList<>(groups.size());

        for (TimeGroup group : groups) {
            long atRiskBefore = atRisk;
            long events = Math.max(group.events(), 0);
            long censored = Math.max(group.censored(), 0);

            if (atRiskBefore > 0 && events > 0) {
                survival *= 1.0 - (double) events / atRiskBefore;
            }

            curve.add(new SurvivalCurvePoint(group.time(), atRiskBefore, events, censored, survival));

            atRisk = Math.max(atRiskBefore - events - censored, 0);
        }
        return curve;
    }
}
