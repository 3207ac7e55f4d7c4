package io.github.jakubt4.pmfusion.service.transform;

/**
 * Which matched stars may anchor a frame's transformation fit.
 */
public enum FitSelection {
    /** Stars flagged for alignment. */
    ALIGNMENT_STARS,
    /** Stars flagged for alignment, or every matched star when the frame covers too few of them. */
    FIELD_FALLBACK,
    /** Every matched star. */
    ALL_STARS
}
