package io.github.jakubt4.pmfusion.model;

public enum TerminationReason {
    CONVERGED,
    ITERATION_CAP,
    SINGLE_PASS,
    /** A later iteration had no usable frame; the previous iteration's estimate is kept. */
    NO_USABLE_FRAMES
}
