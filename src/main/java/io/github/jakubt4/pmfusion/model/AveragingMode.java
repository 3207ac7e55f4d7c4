package io.github.jakubt4.pmfusion.model;

/**
 * Which per-star statistic drives alignment, membership and convergence:
 * the inverse-variance weighted mean or the plain mean across frames.
 */
public enum AveragingMode {
    WEIGHTED(MeasurementKind.RELATIVE_WEIGHTED, MeasurementKind.ABSOLUTE_WEIGHTED),
    MEAN(MeasurementKind.RELATIVE_MEAN, MeasurementKind.ABSOLUTE_MEAN);

    private final MeasurementKind relativeKind;
    private final MeasurementKind absoluteKind;

    AveragingMode(final MeasurementKind relativeKind, final MeasurementKind absoluteKind) {
        this.relativeKind = relativeKind;
        this.absoluteKind = absoluteKind;
    }

    public MeasurementKind relativeKind() {
        return relativeKind;
    }

    public MeasurementKind absoluteKind() {
        return absoluteKind;
    }
}
