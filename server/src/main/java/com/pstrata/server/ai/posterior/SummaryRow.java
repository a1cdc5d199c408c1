package com.pstrata.server.ai.posterior;

/**
 * One row of the tidy summary table. {@code time} is null for outcomes without a time axis.
 */
public class SummaryRow {

    private final String stratum;
    private final String treatment;
    private final Double time;
    private final double mean;
    private final double sd;
    private final double q2_5;
    private final double q25;
    private final double median;
    private final double q75;
    private final double q97_5;

    public SummaryRow(String stratum, String treatment, Double time, double mean, double sd,
            double q2_5, double q25, double median, double q75, double q97_5) {
        this.stratum = stratum;
        this.treatment = treatment;
        this.time = time;
        this.mean = mean;
        this.sd = sd;
        this.q2_5 = q2_5;
        this.q25 = q25;
        this.median = median;
        this.q75 = q75;
        this.q97_5 = q97_5;
    }

    public String getStratum() {
        return stratum;
    }

    public String getTreatment() {
        return treatment;
    }

    public Double getTime() {
        return time;
    }

    public double getMean() {
        return mean;
    }

    public double getSd() {
        return sd;
    }

    public double getQ2_5() {
        return q2_5;
    }

    public double getQ25() {
        return q25;
    }

    public double getMedian() {
        return median;
    }

    public double getQ75() {
        return q75;
    }

    public double getQ97_5() {
        return q97_5;
    }

    @Override
    public String toString() {
        return "SummaryRow{" + stratum + ", " + treatment + (time == null ? "" : ", t=" + time)
                + ", mean=" + mean + ", sd=" + sd + ", median=" + median + "}";
    }
}
