package io.github.jakubt4.pmfusion.service.stats;

import org.hipparchus.distribution.multivariate.MixtureMultivariateNormalDistribution;
import org.hipparchus.stat.correlation.Covariance;
import org.hipparchus.stat.fitting.MultivariateNormalMixtureExpectationMaximization;
import org.hipparchus.util.FastMath;

import java.util.Arrays;
import java.util.Comparator;
import java.util.stream.IntStream;

/**
 * Expectation-maximization fits of Gaussian mixtures. Full covariances are delegated to
 * Hipparchus; spherical components use a dedicated EM loop. Both start from the same
 * deterministic split of the sample sorted on its first coordinate, so repeated fits of
 * the same data give identical models.
 */
public class GaussianMixtureFitter {

    private static final int MAX_ITERATIONS = 1000;
    private static final double THRESHOLD = 1e-5;
    private static final double SPHERICAL_REGULARIZATION = 1e-6;

    /**
     * @throws MixtureFitException if the sample is too small for the requested components or a
     *                             component degenerates
     * @throws org.hipparchus.exception.MathRuntimeException on singular covariances or
     *                             non-convergence of the full-covariance fit
     */
    public MixtureModel fit(final double[][] data, final int components, final CovarianceType type) {
        if (components < 1) {
            throw new IllegalArgumentException("At least one mixture component is required");
        }
        if (data.length < FastMath.max(2, components)) {
            throw new MixtureFitException(
                    "Cannot fit " + components + " component(s) to " + data.length + " point(s)");
        }
        return type == CovarianceType.FULL
                ? fitFull(data, components)
                : fitSpherical(data, components);
    }

    private MixtureModel fitFull(final double[][] data, final int components) {
        final MixtureMultivariateNormalDistribution initial;
        if (components == 1) {
            final var covariance = new Covariance(data).getCovarianceMatrix().getData();
            initial = new MixtureMultivariateNormalDistribution(
                    new double[] {1.0}, new double[][] {columnMeans(data)}, new double[][][] {covariance});
        } else {
            initial = MultivariateNormalMixtureExpectationMaximization.estimate(data, components);
        }
        final var em = new MultivariateNormalMixtureExpectationMaximization(data);
        em.fit(initial, MAX_ITERATIONS, THRESHOLD);
        if (!Double.isFinite(em.getLogLikelihood())) {
            throw new MixtureFitException("Mixture log-likelihood is not finite");
        }
        return MixtureModel.of(em.getFittedModel());
    }

    private MixtureModel fitSpherical(final double[][] data, final int components) {
        final var n = data.length;
        final var dimension = data[0].length;
        final var weights = new double[components];
        final var means = new double[components][];
        final var variances = new double[components];

        final var order = IntStream.range(0, n).boxed()
                .sorted(Comparator.comparingDouble(i -> data[i][0]))
                .mapToInt(Integer::intValue)
                .toArray();
        final var binSize = n / components;
        for (var j = 0; j < components; j++) {
            final var from = j * binSize;
            final var to = j == components - 1 ? n : from + binSize;
            final var bin = Arrays.stream(order, from, to).mapToObj(i -> data[i]).toArray(double[][]::new);
            weights[j] = (double) bin.length / n;
            means[j] = columnMeans(bin);
            variances[j] = sphericalVariance(bin, means[j], null) + SPHERICAL_REGULARIZATION;
        }

        final var responsibilities = new double[n][components];
        var previous = Double.NEGATIVE_INFINITY;
        for (var iteration = 0; iteration < MAX_ITERATIONS; iteration++) {
            var logLikelihood = 0.0;
            for (var i = 0; i < n; i++) {
                logLikelihood += expectation(data[i], weights, means, variances, responsibilities[i]);
            }
            logLikelihood /= n;
            if (!Double.isFinite(logLikelihood)) {
                throw new MixtureFitException("Mixture log-likelihood is not finite");
            }

            for (var j = 0; j < components; j++) {
                var mass = 0.0;
                final var mean = new double[dimension];
                for (var i = 0; i < n; i++) {
                    mass += responsibilities[i][j];
                    for (var d = 0; d < dimension; d++) {
                        mean[d] += responsibilities[i][j] * data[i][d];
                    }
                }
                if (mass < 1e-12) {
                    throw new MixtureFitException("Mixture component " + j + " collapsed");
                }
                for (var d = 0; d < dimension; d++) {
                    mean[d] /= mass;
                }
                final var column = j;
                final var weighted = sphericalVariance(data, mean,
                        IntStream.range(0, n).mapToDouble(i -> responsibilities[i][column]).toArray());
                weights[j] = mass / n;
                means[j] = mean;
                variances[j] = weighted / mass * n + SPHERICAL_REGULARIZATION;
            }

            if (FastMath.abs(logLikelihood - previous) < THRESHOLD) {
                break;
            }
            previous = logLikelihood;
        }
        return MixtureModel.spherical(weights, means, variances);
    }

    /**
     * Fills {@code responsibilities} for one point and returns its log-density.
     */
    private static double expectation(final double[] point, final double[] weights, final double[][] means,
                                      final double[] variances, final double[] responsibilities) {
        final var dimension = point.length;
        var max = Double.NEGATIVE_INFINITY;
        for (var j = 0; j < weights.length; j++) {
            var squared = 0.0;
            for (var d = 0; d < dimension; d++) {
                final var delta = point[d] - means[j][d];
                squared += delta * delta;
            }
            responsibilities[j] = FastMath.log(weights[j])
                    - 0.5 * dimension * FastMath.log(2.0 * FastMath.PI * variances[j])
                    - 0.5 * squared / variances[j];
            max = FastMath.max(max, responsibilities[j]);
        }
        var sum = 0.0;
        for (var j = 0; j < weights.length; j++) {
            sum += FastMath.exp(responsibilities[j] - max);
        }
        final var logDensity = max + FastMath.log(sum);
        for (var j = 0; j < weights.length; j++) {
            responsibilities[j] = FastMath.exp(responsibilities[j] - logDensity);
        }
        return logDensity;
    }

    /**
     * Mean squared deviation per dimension, optionally weighted; weights are normalised by
     * the sample size so an unweighted call returns the population variance.
     */
    private static double sphericalVariance(final double[][] data, final double[] mean, final double[] weights) {
        var sum = 0.0;
        for (var i = 0; i < data.length; i++) {
            var squared = 0.0;
            for (var d = 0; d < mean.length; d++) {
                final var delta = data[i][d] - mean[d];
                squared += delta * delta;
            }
            sum += (weights == null ? 1.0 : weights[i]) * squared;
        }
        return sum / (data.length * mean.length);
    }

    private static double[] columnMeans(final double[][] data) {
        final var means = new double[data[0].length];
        for (final var row : data) {
            for (var d = 0; d < means.length; d++) {
                means[d] += row[d];
            }
        }
        for (var d = 0; d < means.length; d++) {
            means[d] /= data.length;
        }
        return means;
    }
}
