package io.github.jakubt4.pmfusion.service;

import io.github.jakubt4.pmfusion.model.FrameTransformation;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Outcome of the quality gate for one frame transformation.
 *
 * @param gaussian    residuals pass the normality test
 * @param centered    residual centroid is within tolerance on both axes
 * @param enoughStars fit sample is larger than the configured minimum
 * @param pValue      Shapiro-Wilk p-value, NaN if the sample was too small to test
 * @param trimmed     transformation after outlier trimming (the input when trimming is off)
 * @param rejected    star ids trimmed out of the residuals
 */
public record QualityVerdict(boolean gaussian,
                             boolean centered,
                             boolean enoughStars,
                             double pValue,
                             FrameTransformation trimmed,
                             Set<Long> rejected) {

    public QualityVerdict {
        rejected = Set.copyOf(rejected);
    }

    public boolean usable() {
        return gaussian && centered && enoughStars;
    }

    /**
     * Human-readable reasons the frame was rejected, empty when usable.
     */
    public List<String> failures() {
        final var failures = new ArrayList<String>();
        if (!gaussian) {
            failures.add("non-Gaussian residuals (p=" + pValue + ")");
        }
        if (!centered) {
            failures.add(String.format("residual centroid (%.4f, %.4f) off origin",
                    trimmed.centroidX(), trimmed.centroidY()));
        }
        if (!enoughStars) {
            failures.add("only " + trimmed.sampleSize() + " stars in the fit");
        }
        return failures;
    }
}
