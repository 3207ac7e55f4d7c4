package io.github.jakubt4.pmfusion.model;

/**
 * Combination of repeated measurements of one scalar.
 *
 * @param weightedMean  inverse-variance weighted mean
 * @param weightedError propagated error of the weighted mean
 * @param mean          plain mean
 * @param meanError     standard error of the plain mean, NaN for a single value
 * @param std           bias-corrected sample standard deviation, NaN for a single value
 * @param count         number of combined values
 */
public record AggregatedMeasurement(double weightedMean,
                                    double weightedError,
                                    double mean,
                                    double meanError,
                                    double std,
                                    int count) {

    public double value(final AveragingMode mode) {
        return mode == AveragingMode.WEIGHTED ? weightedMean : mean;
    }

    public double error(final AveragingMode mode) {
        return mode == AveragingMode.WEIGHTED ? weightedError : meanError;
    }
}
