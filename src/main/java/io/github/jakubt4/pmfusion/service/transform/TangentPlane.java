package io.github.jakubt4.pmfusion.service.transform;

import org.hipparchus.util.FastMath;

/**
 * Gnomonic projection about a fixed tangent point, returning standard coordinates in arcsec.
 */
final class TangentPlane {

    private static final double ARCSEC_PER_RADIAN = FastMath.toDegrees(1.0) * 3600.0;

    private final double ra0;
    private final double sinDec0;
    private final double cosDec0;

    TangentPlane(final double centerRaDeg, final double centerDecDeg) {
        this.ra0 = FastMath.toRadians(centerRaDeg);
        final var dec0 = FastMath.toRadians(centerDecDeg);
        this.sinDec0 = FastMath.sin(dec0);
        this.cosDec0 = FastMath.cos(dec0);
    }

    /**
     * @return {xi, eta} in arcsec, xi along increasing RA
     */
    double[] project(final double raDeg, final double decDeg) {
        final var ra = FastMath.toRadians(raDeg);
        final var dec = FastMath.toRadians(decDeg);
        final var sinDec = FastMath.sin(dec);
        final var cosDec = FastMath.cos(dec);
        final var cosDeltaRa = FastMath.cos(ra - ra0);
        final var denominator = sinDec0 * sinDec + cosDec0 * cosDec * cosDeltaRa;
        final var xi = cosDec * FastMath.sin(ra - ra0) / denominator;
        final var eta = (cosDec0 * sinDec - sinDec0 * cosDec * cosDeltaRa) / denominator;
        return new double[] {xi * ARCSEC_PER_RADIAN, eta * ARCSEC_PER_RADIAN};
    }

    /**
     * Position after {@code years} of motion at (pmRa, pmDec) mas/yr, pmRa including cos(dec).
     *
     * @return {ra, dec} in degrees
     */
    static double[] propagate(final double raDeg, final double decDeg,
                              final double pmRa, final double pmDec, final double years) {
        final var masPerDegree = 3.6e6;
        final var cosDec = FastMath.cos(FastMath.toRadians(decDeg));
        return new double[] {
                raDeg + pmRa * years / (masPerDegree * cosDec),
                decDeg + pmDec * years / masPerDegree
        };
    }
}
