package io.github.jakubt4.pmfusion.dto;

import io.github.jakubt4.pmfusion.model.Star;

/**
 * Reference star supplied inline with a refinement request.
 *
 * @param member membership seed; {@code null} counts as a candidate
 */
public record StarRow(long sourceId,
                      double ra, double raError,
                      double dec, double decError,
                      double pmRa, double pmRaError,
                      double pmDec, double pmDecError,
                      double magnitude,
                      Boolean member) {

    public Star toStar() {
        return Star.reference(sourceId, ra, raError, dec, decError, pmRa, pmRaError, pmDec, pmDecError,
                magnitude, member == null || member);
    }
}
