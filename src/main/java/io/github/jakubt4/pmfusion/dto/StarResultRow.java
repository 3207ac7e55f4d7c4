package io.github.jakubt4.pmfusion.dto;

import io.github.jakubt4.pmfusion.model.AveragingMode;
import io.github.jakubt4.pmfusion.model.ProperMotion;
import io.github.jakubt4.pmfusion.model.Star;

/**
 * Refined star as returned to the client; motions in mas/yr.
 */
public record StarResultRow(long sourceId,
                            double ra,
                            double dec,
                            double magnitude,
                            double pmRa, double pmRaError,
                            double pmDec, double pmDecError,
                            Double relativePmRa, Double relativePmRaError,
                            Double relativePmDec, Double relativePmDecError,
                            boolean member,
                            boolean usedForAlignment,
                            Double logProbability) {

    public static StarResultRow of(final Star star, final AveragingMode mode) {
        final var absolute = star.measurement(mode.absoluteKind())
                .orElseThrow(() -> new IllegalArgumentException("Star " + star.sourceId() + " has no absolute motion"));
        final var relative = star.measurement(mode.relativeKind());
        return new StarResultRow(star.sourceId(), star.ra(), star.dec(), star.magnitude(),
                absolute.pmRa(), absolute.pmRaError(), absolute.pmDec(), absolute.pmDecError(),
                relative.map(ProperMotion::pmRa).orElse(null),
                relative.map(ProperMotion::pmRaError).orElse(null),
                relative.map(ProperMotion::pmDec).orElse(null),
                relative.map(ProperMotion::pmDecError).orElse(null),
                star.candidateMember(), star.useForAlignment(), star.logProbability());
    }
}
