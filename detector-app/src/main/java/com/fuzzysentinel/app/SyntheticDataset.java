package com.fuzzysentinel.app;

import java.util.Objects;

/**
 * A baseline regime with one normal and one anomalous window, all of the
 * same number of series.
 */
public final class SyntheticDataset {

    private final double[][] baseline;
    private final double[][] normalWindow;
    private final double[][] anomalousWindow;

    SyntheticDataset(double[][] baseline, double[][] normalWindow, double[][] anomalousWindow) {
        this.baseline = Objects.requireNonNull(baseline, "baseline must not be null");
        this.normalWindow = Objects.requireNonNull(normalWindow, "normalWindow must not be null");
        this.anomalousWindow = Objects.requireNonNull(anomalousWindow, "anomalousWindow must not be null");
    }

    public double[][] getBaseline() {
        return baseline;
    }

    public double[][] getNormalWindow() {
        return normalWindow;
    }

    public double[][] getAnomalousWindow() {
        return anomalousWindow;
    }
}
