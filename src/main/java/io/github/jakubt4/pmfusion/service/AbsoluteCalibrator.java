package io.github.jakubt4.pmfusion.service;

import io.github.jakubt4.pmfusion.model.AveragingMode;
import io.github.jakubt4.pmfusion.model.EnsembleOffset;
import io.github.jakubt4.pmfusion.model.MeasurementKind;
import io.github.jakubt4.pmfusion.model.ProperMotion;
import io.github.jakubt4.pmfusion.model.Star;
import io.github.jakubt4.pmfusion.model.StarAggregate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.hipparchus.util.FastMath;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Anchors frame-relative proper motions to the absolute frame of the reference catalog.
 *
 * <p>The ensemble offset is the aggregated {@code reference - relative} motion of the alignment
 * stars. Every aggregated star then gets {@code absolute = relative + offset}, with the offset
 * error added in quadrature. Both the weighted and the plain statistic are calibrated.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AbsoluteCalibrator {

    private final WeightedAggregator weightedAggregator;

    /**
     * @param measurements relative and absolute motions per star id
     * @param offsets      ensemble offset per averaging mode
     */
    public record Calibration(Map<Long, Map<MeasurementKind, ProperMotion>> measurements,
                              Map<AveragingMode, EnsembleOffset> offsets) {
    }

    /**
     * @throws AlignmentException if no star has an aggregate to anchor the offset on
     */
    public Calibration calibrate(final List<Star> stars, final Map<Long, StarAggregate> aggregates) {
        var anchors = stars.stream()
                .filter(Star::useForAlignment)
                .filter(star -> aggregates.containsKey(star.sourceId()))
                .toList();
        if (anchors.isEmpty()) {
            anchors = stars.stream()
                    .filter(star -> aggregates.containsKey(star.sourceId()))
                    .toList();
            if (anchors.isEmpty()) {
                throw new AlignmentException("No measured star available to anchor the absolute frame");
            }
            log.warn("No alignment star was measured, anchoring the absolute frame on all {} measured stars",
                    anchors.size());
        }

        final var offsets = new EnumMap<AveragingMode, EnsembleOffset>(AveragingMode.class);
        for (final var mode : AveragingMode.values()) {
            offsets.put(mode, ensembleOffset(anchors, aggregates, mode));
        }

        final var measurements = new TreeMap<Long, Map<MeasurementKind, ProperMotion>>();
        aggregates.forEach((sourceId, aggregate) -> {
            final var derived = new EnumMap<MeasurementKind, ProperMotion>(MeasurementKind.class);
            for (final var mode : AveragingMode.values()) {
                final var relative = aggregate.relative(mode);
                final var offset = offsets.get(mode);
                derived.put(mode.relativeKind(), relative);
                derived.put(mode.absoluteKind(), new ProperMotion(
                        relative.pmRa() + offset.pmRa().value(mode),
                        FastMath.hypot(relative.pmRaError(), offset.pmRa().error(mode)),
                        relative.pmDec() + offset.pmDec().value(mode),
                        FastMath.hypot(relative.pmDecError(), offset.pmDec().error(mode))));
            }
            measurements.put(sourceId, derived);
        });
        return new Calibration(measurements, offsets);
    }

    private EnsembleOffset ensembleOffset(final List<Star> anchors,
                                          final Map<Long, StarAggregate> aggregates,
                                          final AveragingMode mode) {
        final var size = anchors.size();
        final var deltaRa = new double[size];
        final var deltaRaError = new double[size];
        final var deltaDec = new double[size];
        final var deltaDecError = new double[size];
        for (var i = 0; i < size; i++) {
            final var star = anchors.get(i);
            final var relative = aggregates.get(star.sourceId()).relative(mode);
            deltaRa[i] = star.pmRa() - relative.pmRa();
            deltaRaError[i] = FastMath.hypot(star.pmRaError(), relative.pmRaError());
            deltaDec[i] = star.pmDec() - relative.pmDec();
            deltaDecError[i] = FastMath.hypot(star.pmDecError(), relative.pmDecError());
        }
        return new EnsembleOffset(
                weightedAggregator.aggregate(deltaRa, deltaRaError),
                weightedAggregator.aggregate(deltaDec, deltaDecError),
                size);
    }
}
