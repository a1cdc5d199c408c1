package com.pstrata.server.ai.posterior;

import com.pstrata.server.ai.inference.MathUtil;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Per-cell point and interval summaries across the iteration axis. Rows follow the
 * declaration order of strata, treatments and time points.
 */
public final class OutcomeSummarizer {

    private OutcomeSummarizer() {
    }

    public static List<SummaryRow> summarize(PosteriorOutcomeArray array) {
        List<SummaryRow> rows = new ArrayList<>();
        double[] times = array.getTimePoints();
        int tc = array.isSurvival() ? array.getTimeCount() : 1;
        for (int s = 0; s < array.getStratumCount(); s++) {
            for (int z = 0; z < array.getTreatmentCount(); z++) {
                for (int t = 0; t < tc; t++) {
                    double[] draws = array.slice(s, z, t);
                    rows.add(row(array.getStrataNames().get(s), array.getTreatmentNames().get(z),
                            times == null ? null : times[t], draws));
                }
            }
        }
        return rows;
    }

    static SummaryRow row(String stratum, String treatment, Double time, double[] draws) {
        double[] sorted = draws.clone();
        Arrays.sort(sorted);
        return new SummaryRow(stratum, treatment, time,
                MathUtil.mean(draws),
                MathUtil.sd(draws),
                MathUtil.quantileSorted(sorted, 0.025),
                MathUtil.quantileSorted(sorted, 0.25),
                MathUtil.quantileSorted(sorted, 0.5),
                MathUtil.quantileSorted(sorted, 0.75),
                MathUtil.quantileSorted(sorted, 0.975));
    }
}
