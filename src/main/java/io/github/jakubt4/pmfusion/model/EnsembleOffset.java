package io.github.jakubt4.pmfusion.model;

/**
 * Shift between the relative frame and the reference catalog's absolute frame.
 *
 * @param pmRa        aggregated (reference - relative) along RA
 * @param pmDec       aggregated (reference - relative) along Dec
 * @param anchorCount number of stars the offset was measured on
 */
public record EnsembleOffset(AggregatedMeasurement pmRa, AggregatedMeasurement pmDec, int anchorCount) {
}
