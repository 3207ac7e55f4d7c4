package io.github.jakubt4.pmfusion.model;

import java.util.List;

/**
 * Result of fitting one frame onto the reference catalog in one iteration.
 *
 * @param frameId   frame identifier
 * @param transform fitted linear mapping
 * @param residuals residuals of the stars used in the fit
 */
public record FrameTransformation(String frameId, LinearTransform transform, List<Residual> residuals) {

    public FrameTransformation {
        residuals = List.copyOf(residuals);
    }

    public int sampleSize() {
        return residuals.size();
    }

    public double centroidX() {
        return residuals.stream().mapToDouble(Residual::dx).average().orElse(Double.NaN);
    }

    public double centroidY() {
        return residuals.stream().mapToDouble(Residual::dy).average().orElse(Double.NaN);
    }

    public FrameTransformation withResiduals(final List<Residual> kept) {
        return new FrameTransformation(frameId, transform, kept);
    }
}
