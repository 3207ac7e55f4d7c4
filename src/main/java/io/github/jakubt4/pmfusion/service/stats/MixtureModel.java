package io.github.jakubt4.pmfusion.service.stats;

import org.hipparchus.distribution.multivariate.MixtureMultivariateNormalDistribution;
import org.hipparchus.linear.LUDecomposition;
import org.hipparchus.linear.MatrixUtils;
import org.hipparchus.linear.RealMatrix;
import org.hipparchus.util.FastMath;

/**
 * Fitted Gaussian mixture evaluated in log space, so that far outliers score a finite
 * (very negative) log-density instead of underflowing to zero.
 */
public final class MixtureModel {

    private static final double LOG_TWO_PI = FastMath.log(2.0 * FastMath.PI);

    private final double[] logWeights;
    private final double[][] means;
    private final RealMatrix[] precisions;
    private final double[] logNormalizers;

    private MixtureModel(final double[] weights, final double[][] means, final RealMatrix[] covariances) {
        final var k = weights.length;
        this.logWeights = new double[k];
        this.means = new double[k][];
        this.precisions = new RealMatrix[k];
        this.logNormalizers = new double[k];
        for (var j = 0; j < k; j++) {
            final var dimension = means[j].length;
            final var lu = new LUDecomposition(covariances[j]);
            final var determinant = lu.getDeterminant();
            if (!(determinant > 0.0) || !Double.isFinite(determinant)) {
                throw new MixtureFitException("Covariance of component " + j + " is not positive definite");
            }
            this.logWeights[j] = FastMath.log(weights[j]);
            this.means[j] = means[j].clone();
            this.precisions[j] = lu.getSolver().getInverse();
            this.logNormalizers[j] = -0.5 * (dimension * LOG_TWO_PI + FastMath.log(determinant));
        }
    }

    public static MixtureModel of(final MixtureMultivariateNormalDistribution distribution) {
        final var components = distribution.getComponents();
        final var k = components.size();
        final var weights = new double[k];
        final var means = new double[k][];
        final var covariances = new RealMatrix[k];
        for (var j = 0; j < k; j++) {
            final var component = components.get(j);
            weights[j] = component.getFirst();
            means[j] = component.getSecond().getMeans();
            covariances[j] = component.getSecond().getCovariances();
        }
        return new MixtureModel(weights, means, covariances);
    }

    /**
     * Mixture whose components have isotropic covariance {@code variances[j] * I}.
     */
    public static MixtureModel spherical(final double[] weights, final double[][] means, final double[] variances) {
        final var covariances = new RealMatrix[weights.length];
        for (var j = 0; j < weights.length; j++) {
            covariances[j] = MatrixUtils.createRealIdentityMatrix(means[j].length).scalarMultiply(variances[j]);
        }
        return new MixtureModel(weights, means, covariances);
    }

    public int components() {
        return logWeights.length;
    }

    public double logDensity(final double[] point) {
        final var terms = new double[logWeights.length];
        var max = Double.NEGATIVE_INFINITY;
        for (var j = 0; j < terms.length; j++) {
            final var delta = new double[point.length];
            for (var i = 0; i < point.length; i++) {
                delta[i] = point[i] - means[j][i];
            }
            final var projected = precisions[j].operate(delta);
            var mahalanobis = 0.0;
            for (var i = 0; i < point.length; i++) {
                mahalanobis += delta[i] * projected[i];
            }
            terms[j] = logWeights[j] + logNormalizers[j] - 0.5 * mahalanobis;
            max = FastMath.max(max, terms[j]);
        }
        if (max == Double.NEGATIVE_INFINITY) {
            return max;
        }
        var sum = 0.0;
        for (final var term : terms) {
            sum += FastMath.exp(term - max);
        }
        return max + FastMath.log(sum);
    }
}
