package io.github.jakubt4.pmfusion.model;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable snapshot of the refinement loop between two iterations.
 *
 * @param iteration          index of the next iteration to run, or of the last one once terminated
 * @param stars              star table
 * @param excludedFromFit    per frame, stars trimmed out of the transformation fit so far
 * @param fieldAlignedFrames frames that covered too few alignment stars in the first iteration and
 *                           are fitted on every matched star since
 * @param history            diagnostics of the completed iterations
 * @param termination        why the loop stopped; {@code null} while it is still running
 */
public record IterationState(int iteration,
                             List<Star> stars,
                             Map<String, Set<Long>> excludedFromFit,
                             Set<String> fieldAlignedFrames,
                             List<IterationDiagnostics> history,
                             TerminationReason termination) {

    public IterationState {
        stars = List.copyOf(stars);
        excludedFromFit = excludedFromFit.entrySet().stream()
                .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, e -> Set.copyOf(e.getValue())));
        fieldAlignedFrames = Set.copyOf(fieldAlignedFrames);
        history = List.copyOf(history);
    }

    public static IterationState initial(final List<Star> stars) {
        return new IterationState(0, stars, Map.of(), Set.of(), List.of(), null);
    }

    public boolean isDone() {
        return termination != null;
    }

    public Set<Long> alignmentIds() {
        return stars.stream()
                .filter(Star::useForAlignment)
                .map(Star::sourceId)
                .collect(Collectors.toUnmodifiableSet());
    }

    public Set<Long> excludedFromFit(final String frameId) {
        return excludedFromFit.getOrDefault(frameId, Set.of());
    }
}
