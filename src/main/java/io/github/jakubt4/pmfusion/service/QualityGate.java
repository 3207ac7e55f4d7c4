package io.github.jakubt4.pmfusion.service;

import io.github.jakubt4.pmfusion.config.AlignmentProperties;
import io.github.jakubt4.pmfusion.model.FrameTransformation;
import io.github.jakubt4.pmfusion.model.Residual;
import io.github.jakubt4.pmfusion.service.stats.CovarianceType;
import io.github.jakubt4.pmfusion.service.stats.GaussianMixtureFitter;
import io.github.jakubt4.pmfusion.service.stats.MixtureFitException;
import io.github.jakubt4.pmfusion.service.stats.ShapiroWilkTest;
import lombok.extern.slf4j.Slf4j;
import org.hipparchus.exception.MathRuntimeException;
import org.hipparchus.stat.descriptive.moment.StandardDeviation;
import org.hipparchus.stat.descriptive.rank.Median;
import org.hipparchus.util.FastMath;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Set;

/**
 * Validates a frame transformation from the distribution of its fit residuals.
 *
 * <p>When trimming is enabled, a single spherical Gaussian is fitted to the residuals and those
 * with a log-density below {@code median - k * std} are dropped before testing; the dropped stars
 * are reported so the next fit of the same frame can leave them out.
 */
@Slf4j
@Component
public class QualityGate {

    private static final int MIN_TESTABLE = 3;

    private final AlignmentProperties properties;
    private final GaussianMixtureFitter fitter = new GaussianMixtureFitter();
    private final ShapiroWilkTest shapiroWilk = new ShapiroWilkTest();

    public QualityGate(final AlignmentProperties properties) {
        this.properties = properties;
    }

    public QualityVerdict assess(final FrameTransformation transformation) {
        var trimmed = transformation;
        Set<Long> rejected = Set.of();
        if (properties.isFixTransformations() && transformation.sampleSize() >= MIN_TESTABLE) {
            try {
                rejected = outliers(transformation);
                if (!rejected.isEmpty()) {
                    final var excluded = rejected;
                    trimmed = transformation.withResiduals(transformation.residuals().stream()
                            .filter(residual -> !excluded.contains(residual.sourceId()))
                            .toList());
                    log.debug("[{}] trimmed {} of {} residuals", transformation.frameId(),
                            rejected.size(), transformation.sampleSize());
                }
            } catch (final MathRuntimeException | MixtureFitException e) {
                log.warn("[{}] residual trimming skipped: {}", transformation.frameId(), e.getMessage());
            }
        }

        var pValue = Double.NaN;
        if (trimmed.sampleSize() >= MIN_TESTABLE) {
            pValue = shapiroWilk.test(flatten(trimmed)).pValue();
        }
        final var gaussian = pValue > properties.getAlpha();
        final var tolerance = properties.getCenterTolerance();
        final var centered = FastMath.abs(trimmed.centroidX()) < tolerance
                && FastMath.abs(trimmed.centroidY()) < tolerance;
        final var enoughStars = trimmed.sampleSize() > properties.getMinStarsAlignment();

        return new QualityVerdict(gaussian, centered, enoughStars, pValue, trimmed, rejected);
    }

    private Set<Long> outliers(final FrameTransformation transformation) {
        final var residuals = transformation.residuals();
        final var points = residuals.stream()
                .map(residual -> new double[] {residual.dx(), residual.dy()})
                .toArray(double[][]::new);
        final var model = fitter.fit(points, 1, CovarianceType.SPHERICAL);

        final var logDensities = new double[points.length];
        for (var i = 0; i < points.length; i++) {
            logDensities[i] = model.logDensity(points[i]);
        }
        final var threshold = new Median().evaluate(logDensities)
                - properties.getTrimClipping() * new StandardDeviation(false).evaluate(logDensities);

        final var rejected = new HashSet<Long>();
        for (var i = 0; i < points.length; i++) {
            if (logDensities[i] < threshold) {
                rejected.add(residuals.get(i).sourceId());
            }
        }
        return rejected;
    }

    private static double[] flatten(final FrameTransformation transformation) {
        final var values = new ArrayList<Double>(2 * transformation.sampleSize());
        for (final Residual residual : transformation.residuals()) {
            values.add(residual.dx());
            values.add(residual.dy());
        }
        return values.stream().mapToDouble(Double::doubleValue).toArray();
    }
}
