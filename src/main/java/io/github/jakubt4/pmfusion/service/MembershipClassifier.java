package io.github.jakubt4.pmfusion.service;

import io.github.jakubt4.pmfusion.config.AlignmentProperties;
import io.github.jakubt4.pmfusion.service.stats.GaussianMixtureFitter;
import io.github.jakubt4.pmfusion.service.stats.MixtureFitException;
import lombok.extern.slf4j.Slf4j;
import org.hipparchus.exception.MathRuntimeException;
import org.hipparchus.stat.descriptive.moment.StandardDeviation;
import org.hipparchus.stat.descriptive.rank.Median;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Separates population members from field stars by recursive Gaussian-mixture clipping.
 *
 * <p>Each round fits the mixture to the current candidates only (centred and scaled on them),
 * scores every point, and keeps those whose log-probability is at least
 * {@code median - clipping * std} of the candidates' scores. Candidates shrink to the kept
 * ones and the recursion stops at a fixed point of the kept labels or at the round cap.
 */
@Slf4j
@Component
public class MembershipClassifier {

    // rounds after which the fixed anchor gives way to the candidate median
    private static final int ANCHORED_ROUNDS = 4;

    private final GaussianMixtureFitter fitter;
    private final AlignmentProperties properties;

    public MembershipClassifier(final AlignmentProperties properties) {
        this.fitter = new GaussianMixtureFitter();
        this.properties = properties;
    }

    /**
     * @param points     per star, coordinates to cluster on, or {@code null} when unmeasured
     * @param candidates per star, seed membership
     * @param anchor     fixed centre for the first rounds, or {@code null} to use the candidate median
     */
    public MembershipOutcome classify(final List<double[]> points,
                                      final List<Boolean> candidates,
                                      final double[] anchor) {
        if (points.size() != candidates.size()) {
            throw new IllegalArgumentException(
                    "Got " + candidates.size() + " candidate flags for " + points.size() + " points");
        }
        final var size = points.size();
        final var current = new boolean[size];
        for (var i = 0; i < size; i++) {
            current[i] = candidates.get(i) && points.get(i) != null;
        }

        boolean[] previous = null;
        double[] scores = null;
        var round = 0;
        while (round < properties.getClassifierMaxRounds()) {
            final var center = round < ANCHORED_ROUNDS ? anchor : null;
            final double[] roundScores;
            try {
                roundScores = score(points, current, center);
            } catch (final MathRuntimeException | MixtureFitException e) {
                log.warn("Membership round {} failed, keeping previous membership: {}", round, e.getMessage());
                return new MembershipOutcome.NoUpdate(e.getMessage());
            }
            if (roundScores == null) {
                return new MembershipOutcome.NoUpdate("fewer than 2 candidates left in round " + round);
            }

            final var threshold = threshold(roundScores, current);
            final var labels = new boolean[size];
            for (var i = 0; i < size; i++) {
                labels[i] = points.get(i) != null && roundScores[i] >= threshold;
                current[i] = current[i] && labels[i];
            }
            scores = roundScores;
            round++;

            if (previous != null && Arrays.equals(previous, labels)) {
                log.debug("Membership converged after {} rounds", round);
                return updated(points, labels, scores, round, true);
            }
            previous = labels;
        }
        log.warn("Membership recursion hit the cap of {} rounds", properties.getClassifierMaxRounds());
        return previous == null
                ? new MembershipOutcome.NoUpdate("no membership round was run")
                : updated(points, previous, scores, round, false);
    }

    /**
     * Fits on the flagged candidates and returns the log-probability of every point,
     * or {@code null} if fewer than two candidates remain.
     */
    private double[] score(final List<double[]> points, final boolean[] candidates, final double[] anchor) {
        final var candidateRows = new ArrayList<double[]>();
        for (var i = 0; i < points.size(); i++) {
            if (candidates[i]) {
                candidateRows.add(points.get(i));
            }
        }
        if (candidateRows.size() < 2) {
            return null;
        }

        final var dimension = candidateRows.get(0).length;
        final var center = new double[dimension];
        final var scale = new double[dimension];
        for (var d = 0; d < dimension; d++) {
            final var column = column(candidateRows, d);
            center[d] = anchor != null ? anchor[d] : new Median().evaluate(column);
            scale[d] = new StandardDeviation(true).evaluate(column);
            if (!(scale[d] > 0.0) || !Double.isFinite(scale[d])) {
                throw new MixtureFitException("candidate spread along axis " + d + " is " + scale[d]);
            }
        }

        final var training = candidateRows.stream()
                .map(row -> standardize(row, center, scale))
                .toArray(double[][]::new);
        final var model = fitter.fit(training, properties.getMixtureComponents(), properties.getCovarianceType());

        final var scores = new double[points.size()];
        for (var i = 0; i < points.size(); i++) {
            final var point = points.get(i);
            scores[i] = point == null ? Double.NaN : model.logDensity(standardize(point, center, scale));
        }
        return scores;
    }

    private double threshold(final double[] scores, final boolean[] candidates) {
        final var candidateScores = new ArrayList<Double>();
        for (var i = 0; i < scores.length; i++) {
            if (candidates[i]) {
                candidateScores.add(scores[i]);
            }
        }
        final var values = candidateScores.stream().mapToDouble(Double::doubleValue).toArray();
        return new Median().evaluate(values)
                - properties.getClippingProb() * new StandardDeviation(false).evaluate(values);
    }

    private static MembershipOutcome.Updated updated(final List<double[]> points, final boolean[] labels,
                                                     final double[] scores, final int rounds,
                                                     final boolean converged) {
        final var members = new ArrayList<Boolean>(labels.length);
        final var logProbabilities = new ArrayList<Double>(labels.length);
        for (var i = 0; i < labels.length; i++) {
            members.add(labels[i]);
            logProbabilities.add(points.get(i) == null ? null : scores[i]);
        }
        return new MembershipOutcome.Updated(members, logProbabilities, rounds, converged);
    }

    private static double[] column(final List<double[]> rows, final int d) {
        return rows.stream().mapToDouble(row -> row[d]).toArray();
    }

    private static double[] standardize(final double[] point, final double[] center, final double[] scale) {
        final var result = new double[point.length];
        for (var i = 0; i < point.length; i++) {
            result[i] = (point[i] - center[i]) / scale[i];
        }
        return result;
    }
}
