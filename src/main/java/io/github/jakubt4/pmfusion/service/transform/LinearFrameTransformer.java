package io.github.jakubt4.pmfusion.service.transform;

import io.github.jakubt4.pmfusion.config.AlignmentProperties;
import io.github.jakubt4.pmfusion.model.DetectedSource;
import io.github.jakubt4.pmfusion.model.FrameMeasurement;
import io.github.jakubt4.pmfusion.model.FrameTransformation;
import io.github.jakubt4.pmfusion.model.LinearTransform;
import io.github.jakubt4.pmfusion.model.Residual;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.hipparchus.exception.MathRuntimeException;
import org.hipparchus.linear.ArrayRealVector;
import org.hipparchus.linear.MatrixUtils;
import org.hipparchus.linear.QRDecomposition;
import org.hipparchus.util.FastMath;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

/**
 * In-process frame alignment: projects the catalog on the frame's tangent plane, matches
 * detections by proximity and fits a six-parameter linear transformation by least squares.
 *
 * <p>Relative proper motions follow from the displacement between a star's reference-epoch
 * projection and its transformed detection, divided by the time baseline:
 * <pre>
 *   pm = (reference - T(detection)) * pixelScale / (referenceEpoch - frameEpoch)
 * </pre>
 * Positional errors scale with the PSF fit quality of the detection.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LinearFrameTransformer implements FrameTransformer {

    private static final int MIN_FIT_STARS = 3;
    private static final int MATCH_PASSES = 2;
    private static final double QFIT_TO_PIXELS = 0.85;
    private static final double SINGULARITY_THRESHOLD = 1e-10;

    private final AlignmentProperties properties;

    @Override
    public TransformResult transform(final TransformRequest request) {
        final var frame = request.frame();
        final var frameId = frame.frameId();
        if (frame.sources().isEmpty()) {
            return new TransformResult.Failed(frameId, "no detected sources");
        }
        if (!(frame.pixelScale() > 0.0)) {
            return new TransformResult.Failed(frameId, "invalid pixel scale " + frame.pixelScale());
        }
        final var baseline = request.referenceEpoch() - frame.epoch();
        if (FastMath.abs(baseline) < 1e-6) {
            return new TransformResult.Failed(frameId, "no time baseline between frame and catalog");
        }

        final var plane = new TangentPlane(frame.centerRa(), frame.centerDec());
        final var stars = request.stars();
        final var reference = new double[stars.size()][];
        final var predicted = new double[stars.size()][];
        for (var i = 0; i < stars.size(); i++) {
            final var star = stars.get(i);
            reference[i] = toPixels(plane.project(star.ra(), star.dec()), frame.pixelScale());
            if (request.rewind()) {
                final var moved = TangentPlane.propagate(star.ra(), star.dec(), star.pmRa(), star.pmDec(), -baseline);
                predicted[i] = toPixels(plane.project(moved[0], moved[1]), frame.pixelScale());
            } else {
                predicted[i] = reference[i];
            }
        }

        final var sources = frame.sources();
        var transform = LinearTransform.centeredOn(frame.referenceX(), frame.referenceY());
        int[] matches = new int[0];
        List<Integer> fitStars = List.of();
        var selection = request.fitSelection();
        for (var pass = 0; pass < MATCH_PASSES; pass++) {
            matches = match(predicted, sources, transform);
            if (selection == FitSelection.FIELD_FALLBACK) {
                final var covered = fitCandidates(stars, matches, request.excludedFromFit(), false).size();
                if (covered < properties.getMinStarsAlignment()) {
                    log.info("[{}] only {} alignment stars in the field, aligning on every matched star",
                            frameId, covered);
                    selection = FitSelection.ALL_STARS;
                } else {
                    selection = FitSelection.ALIGNMENT_STARS;
                }
            }
            fitStars = fitCandidates(stars, matches, request.excludedFromFit(), selection == FitSelection.ALL_STARS);
            if (fitStars.size() < MIN_FIT_STARS) {
                return new TransformResult.Failed(frameId,
                        "only " + fitStars.size() + " alignment stars matched");
            }
            try {
                transform = fit(fitStars, matches, predicted, sources);
            } catch (final MathRuntimeException e) {
                return new TransformResult.Failed(frameId, "transformation fit failed: " + e.getMessage());
            }
        }

        final var residuals = new ArrayList<Residual>(fitStars.size());
        for (final var i : fitStars) {
            final var source = sources.get(matches[i]);
            residuals.add(new Residual(stars.get(i).sourceId(),
                    transform.xi(source.x(), source.y()) - predicted[i][0],
                    transform.eta(source.x(), source.y()) - predicted[i][1]));
        }

        final var scaleMas = frame.pixelScale() * 1e3;
        final var span = FastMath.abs(baseline);
        final var fallbackQfit = sources.stream()
                .mapToDouble(DetectedSource::qfit)
                .filter(q -> Double.isFinite(q) && q > 0.0)
                .max()
                .orElse(Double.NaN);
        final var measurements = new ArrayList<FrameMeasurement>();
        for (var i = 0; i < stars.size(); i++) {
            if (matches[i] < 0) {
                continue;
            }
            final var star = stars.get(i);
            final var source = sources.get(matches[i]);
            final var qfit = Double.isFinite(source.qfit()) && source.qfit() > 0.0 ? source.qfit() : fallbackQfit;
            measurements.add(new FrameMeasurement(star.sourceId(), frameId,
                    (reference[i][0] - transform.xi(source.x(), source.y())) * scaleMas / baseline,
                    (reference[i][1] - transform.eta(source.x(), source.y())) * scaleMas / baseline,
                    qfit * scaleMas * QFIT_TO_PIXELS / span,
                    star.raError() / span,
                    star.decError() / span,
                    source.magnitude()));
        }

        log.debug("[{}] matched {} stars, {} in the fit", frameId, measurements.size(), residuals.size());
        return new TransformResult.Matched(new FrameTransformation(frameId, transform, residuals), measurements,
                selection == FitSelection.ALL_STARS);
    }

    /**
     * Nearest detection within the match radius for every star, one-to-one; -1 when unmatched.
     */
    private int[] match(final double[][] predicted, final List<DetectedSource> sources, final LinearTransform transform) {
        final var radiusSquared = properties.getMaxSeparation() * properties.getMaxSeparation();
        final var projected = new double[sources.size()][];
        for (var k = 0; k < sources.size(); k++) {
            final var source = sources.get(k);
            projected[k] = new double[] {transform.xi(source.x(), source.y()), transform.eta(source.x(), source.y())};
        }

        final var matches = new int[predicted.length];
        final var distances = new double[predicted.length];
        Arrays.fill(matches, -1);
        for (var i = 0; i < predicted.length; i++) {
            var best = radiusSquared;
            for (var k = 0; k < projected.length; k++) {
                final var dx = projected[k][0] - predicted[i][0];
                final var dy = projected[k][1] - predicted[i][1];
                final var distance = dx * dx + dy * dy;
                if (distance <= best) {
                    best = distance;
                    matches[i] = k;
                }
            }
            distances[i] = best;
        }

        // a detection claimed by several stars goes to the closest one
        final var owner = new int[sources.size()];
        Arrays.fill(owner, -1);
        for (var i = 0; i < matches.length; i++) {
            final var k = matches[i];
            if (k < 0) {
                continue;
            }
            final var current = owner[k];
            if (current < 0 || distances[i] < distances[current]) {
                if (current >= 0) {
                    matches[current] = -1;
                }
                owner[k] = i;
            } else {
                matches[i] = -1;
            }
        }
        return matches;
    }

    private static List<Integer> fitCandidates(final List<AlignmentStar> stars, final int[] matches,
                                               final Set<Long> excluded, final boolean allStars) {
        final var result = new ArrayList<Integer>();
        for (var i = 0; i < stars.size(); i++) {
            final var star = stars.get(i);
            if (matches[i] >= 0 && (allStars || star.useForAlignment()) && !excluded.contains(star.sourceId())) {
                result.add(i);
            }
        }
        return result;
    }

    private static LinearTransform fit(final List<Integer> fitStars, final int[] matches,
                                       final double[][] predicted, final List<DetectedSource> sources) {
        final var design = MatrixUtils.createRealMatrix(fitStars.size(), 3);
        final var targetXi = new ArrayRealVector(fitStars.size());
        final var targetEta = new ArrayRealVector(fitStars.size());
        for (var row = 0; row < fitStars.size(); row++) {
            final var i = fitStars.get(row);
            final var source = sources.get(matches[i]);
            design.setRow(row, new double[] {source.x(), source.y(), 1.0});
            targetXi.setEntry(row, predicted[i][0]);
            targetEta.setEntry(row, predicted[i][1]);
        }
        final var solver = new QRDecomposition(design, SINGULARITY_THRESHOLD).getSolver();
        final var xi = solver.solve(targetXi);
        final var eta = solver.solve(targetEta);
        return new LinearTransform(
                xi.getEntry(0), xi.getEntry(1), xi.getEntry(2),
                eta.getEntry(0), eta.getEntry(1), eta.getEntry(2));
    }

    private static double[] toPixels(final double[] arcsec, final double pixelScale) {
        return new double[] {arcsec[0] / pixelScale, arcsec[1] / pixelScale};
    }
}
