package io.github.jakubt4.pmfusion.model;

/**
 * Two-component proper motion in mas/yr.
 *
 * @param pmRa       motion along right ascension, already multiplied by cos(dec)
 * @param pmRaError  1-sigma error of {@code pmRa}
 * @param pmDec      motion along declination
 * @param pmDecError 1-sigma error of {@code pmDec}
 */
public record ProperMotion(double pmRa, double pmRaError, double pmDec, double pmDecError) {

    public boolean isFinite() {
        return Double.isFinite(pmRa) && Double.isFinite(pmDec);
    }
}
