package io.github.jakubt4.pmfusion.dto;

import io.github.jakubt4.pmfusion.model.IterationDiagnostics;
import io.github.jakubt4.pmfusion.model.ProperMotion;

import java.util.List;

/**
 * Outcome of a refinement job.
 *
 * @param status          {@code "CONVERGED"}, {@code "MAX_ITERATIONS"}, {@code "NO_USABLE_FRAMES"} or
 *                        {@code "REJECTED"}
 * @param message         human-readable detail about the result
 * @param iterations      iterations run, {@code 0} on rejection
 * @param alignmentMotion average absolute motion of the stars used for alignment, {@code null} when
 *                        unknown or on rejection
 * @param stars           refined stars, empty on rejection
 * @param diagnostics     per-iteration convergence series
 */
public record RefinementResponse(String status,
                                 String message,
                                 int iterations,
                                 ProperMotion alignmentMotion,
                                 List<StarResultRow> stars,
                                 List<IterationDiagnostics> diagnostics) {

    public static RefinementResponse rejected(final String message) {
        return new RefinementResponse("REJECTED", message, 0, null, List.of(), List.of());
    }
}
