package io.github.jakubt4.pmfusion.config;

import io.github.jakubt4.pmfusion.model.AveragingMode;
import io.github.jakubt4.pmfusion.service.ConvergencePolicy;
import io.github.jakubt4.pmfusion.service.stats.CovarianceType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tuning knobs of the alignment and refinement engine, bound from {@code pmfusion.alignment.*}.
 */
@Data
@ConfigurationProperties(prefix = "pmfusion.alignment")
public class AlignmentProperties {

    /** Shapiro-Wilk significance below which a frame's residuals are rejected as non-Gaussian. */
    private double alpha = 1e-6;

    /** Maximum |centroid| of the residuals on each axis, pixels. */
    private double centerTolerance = 1e-2;

    /** A frame needs strictly more fit stars than this. */
    private int minStarsAlignment = 10;

    /** Trim residual outliers and exclude them from the next fit of the same frame. */
    private boolean fixTransformations = true;

    /** Clipping factor of the residual trimming, in std of the log-density. */
    private double trimClipping = 3.0;

    private int mixtureComponents = 1;

    private CovarianceType covarianceType = CovarianceType.SPHERICAL;

    /** Clipping factor of the membership classifier, in std of the log-probability. */
    private double clippingProb = 3.0;

    private int classifierMaxRounds = 1000;

    private boolean membershipRefinement = true;

    /** Rewind stars to the frame epoch with the current absolute motions from the second iteration on. */
    private boolean rewindStars = true;

    private AveragingMode averaging = AveragingMode.WEIGHTED;

    private ConvergencePolicy policy = ConvergencePolicy.DRIFT;

    private int membershipMaxIterations = 5;

    private int driftMaxIterations = 20;

    private double driftThresholdFactor = 0.1;

    /** Match radius between predicted and detected positions, pixels. */
    private double maxSeparation = 5.0;

    /** Size of the per-frame worker pool; zero or less means one per available processor. */
    private int workerThreads = 0;

    private String referenceEpoch = "J2016.0";
}
