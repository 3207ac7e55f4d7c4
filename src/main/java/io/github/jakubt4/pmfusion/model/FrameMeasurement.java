package io.github.jakubt4.pmfusion.model;

/**
 * Relative proper motion of one star derived from one frame.
 *
 * @param sourceId                star identifier
 * @param frameId                 frame identifier
 * @param pmRa                    relative motion along RA, mas/yr
 * @param pmDec                   relative motion along Dec, mas/yr
 * @param error                   per-axis error from the frame fit quality, mas/yr; NaN when unknown
 * @param referenceRaUncertainty  catalog RA position error over the baseline, mas/yr
 * @param referenceDecUncertainty catalog Dec position error over the baseline, mas/yr
 * @param magnitude               instrumental magnitude in the frame filter
 */
public record FrameMeasurement(long sourceId,
                               String frameId,
                               double pmRa,
                               double pmDec,
                               double error,
                               double referenceRaUncertainty,
                               double referenceDecUncertainty,
                               double magnitude) {
}
