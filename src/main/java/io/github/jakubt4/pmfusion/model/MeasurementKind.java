package io.github.jakubt4.pmfusion.model;

/**
 * Derived proper-motion quantities attached to a {@link Star} each iteration.
 */
public enum MeasurementKind {
    RELATIVE_WEIGHTED,
    RELATIVE_MEAN,
    ABSOLUTE_WEIGHTED,
    ABSOLUTE_MEAN
}
