package io.github.jakubt4.pmfusion.model;

import java.util.List;

/**
 * Final output of a refinement run.
 *
 * @param stars           stars with an absolute proper motion
 * @param history         per-iteration diagnostics
 * @param iterations      number of iterations executed
 * @param termination     why the loop stopped
 * @param alignmentMotion average absolute motion of the measured alignment stars, with its error;
 *                        {@code null} when no alignment star was measured
 */
public record RefinementResult(List<Star> stars,
                               List<IterationDiagnostics> history,
                               int iterations,
                               TerminationReason termination,
                               ProperMotion alignmentMotion) {

    public RefinementResult {
        stars = List.copyOf(stars);
        history = List.copyOf(history);
    }
}
