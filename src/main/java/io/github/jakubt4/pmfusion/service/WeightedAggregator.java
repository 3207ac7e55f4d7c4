package io.github.jakubt4.pmfusion.service;

import io.github.jakubt4.pmfusion.model.AggregatedMeasurement;
import io.github.jakubt4.pmfusion.model.FrameMeasurement;
import io.github.jakubt4.pmfusion.model.StarAggregate;
import lombok.extern.slf4j.Slf4j;
import org.hipparchus.stat.descriptive.moment.Mean;
import org.hipparchus.stat.descriptive.moment.StandardDeviation;
import org.hipparchus.util.FastMath;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Combines repeated measurements into inverse-variance weighted and plain statistics.
 *
 * <p>Values without a usable error (missing, non-finite or non-positive) are weighted with the
 * population standard deviation of the values instead, so aggregation never fails on missing
 * errors. If even that is zero, the weighted statistics fall back to the plain ones.
 */
@Slf4j
@Component
public class WeightedAggregator {

    /**
     * Aggregates one scalar.
     *
     * @param values measurements, at least one
     * @param errors matching 1-sigma errors; {@code null} when none are known
     * @throws IllegalArgumentException on an empty sample or mismatched lengths
     */
    public AggregatedMeasurement aggregate(final double[] values, final double[] errors) {
        final var n = values.length;
        if (n == 0) {
            throw new IllegalArgumentException("Nothing to aggregate");
        }
        if (errors != null && errors.length != n) {
            throw new IllegalArgumentException("Got " + errors.length + " errors for " + n + " values");
        }

        final var mean = new Mean().evaluate(values);
        final var std = n > 1 ? new StandardDeviation(true).evaluate(values) : Double.NaN;
        final var meanError = std / FastMath.sqrt(n);

        final var substitute = new StandardDeviation(false).evaluate(values);
        var sumWeights = 0.0;
        var sumWeighted = 0.0;
        var degenerate = false;
        for (var i = 0; i < n; i++) {
            final var sigma = errors != null && isUsable(errors[i]) ? errors[i] : substitute;
            if (!isUsable(sigma)) {
                degenerate = true;
                break;
            }
            final var weight = 1.0 / (sigma * sigma);
            sumWeights += weight;
            sumWeighted += values[i] * weight;
        }

        if (degenerate) {
            return new AggregatedMeasurement(mean, meanError, mean, meanError, std, n);
        }
        return new AggregatedMeasurement(sumWeighted / sumWeights, FastMath.sqrt(1.0 / sumWeights),
                mean, meanError, std, n);
    }

    /**
     * Groups frame measurements by star and aggregates both proper-motion components. Stars are
     * returned in ascending id order; a second measurement of the same star from the same frame
     * is dropped.
     */
    public Map<Long, StarAggregate> aggregateStars(final Collection<FrameMeasurement> measurements) {
        final var byStar = new TreeMap<Long, List<FrameMeasurement>>();
        final var seen = new HashSet<String>();
        for (final var measurement : measurements) {
            if (!seen.add(measurement.frameId() + '#' + measurement.sourceId())) {
                log.warn("Duplicate measurement of star {} in frame {} ignored",
                        measurement.sourceId(), measurement.frameId());
                continue;
            }
            byStar.computeIfAbsent(measurement.sourceId(), id -> new ArrayList<>()).add(measurement);
        }

        final var aggregates = new TreeMap<Long, StarAggregate>();
        byStar.forEach((sourceId, starMeasurements) -> {
            final var size = starMeasurements.size();
            final var pmRa = new double[size];
            final var pmDec = new double[size];
            final var errors = new double[size];
            final var raUncertainty = new double[size];
            final var decUncertainty = new double[size];
            for (var i = 0; i < size; i++) {
                final var m = starMeasurements.get(i);
                pmRa[i] = m.pmRa();
                pmDec[i] = m.pmDec();
                errors[i] = m.error();
                raUncertainty[i] = m.referenceRaUncertainty();
                decUncertainty[i] = m.referenceDecUncertainty();
            }
            aggregates.put(sourceId, new StarAggregate(sourceId,
                    aggregate(pmRa, errors),
                    aggregate(pmDec, errors),
                    finiteMean(raUncertainty),
                    finiteMean(decUncertainty)));
        });
        return aggregates;
    }

    private static boolean isUsable(final double sigma) {
        return Double.isFinite(sigma) && sigma > 0.0;
    }

    private static double finiteMean(final double[] values) {
        final var finite = Arrays.stream(values).filter(Double::isFinite).toArray();
        return finite.length == 0 ? 0.0 : new Mean().evaluate(finite);
    }
}
