package io.github.jakubt4.pmfusion.model;

/**
 * Scalars emitted after each refinement iteration.
 *
 * @param iteration       zero-based iteration index
 * @param framesUsed      frames that passed the quality gate
 * @param alignmentStars  stars flagged for alignment after the iteration
 * @param measuredStars   stars with an absolute proper motion
 * @param driftRa         mean |change| of absolute pmRa since the previous iteration; {@code null} on the first
 * @param driftDec        mean |change| of absolute pmDec since the previous iteration; {@code null} on the first
 * @param driftThreshold  threshold the drift is compared with; {@code null} on the first
 * @param rmsRa           spread of (absolute - reference) pmRa
 * @param rmsDec          spread of (absolute - reference) pmDec
 * @param offsetRa        ensemble offset along RA
 * @param offsetDec       ensemble offset along Dec
 */
public record IterationDiagnostics(int iteration,
                                   int framesUsed,
                                   int alignmentStars,
                                   int measuredStars,
                                   Double driftRa,
                                   Double driftDec,
                                   Double driftThreshold,
                                   double rmsRa,
                                   double rmsDec,
                                   double offsetRa,
                                   double offsetDec) {
}
