package io.github.jakubt4.pmfusion.model;

import org.hipparchus.util.FastMath;

/**
 * Relative proper motion of one star combined over all usable frames.
 *
 * @param sourceId                star identifier
 * @param pmRa                    aggregated relative motion along RA
 * @param pmDec                   aggregated relative motion along Dec
 * @param referenceRaUncertainty  mean catalog RA uncertainty over the baseline
 * @param referenceDecUncertainty mean catalog Dec uncertainty over the baseline
 */
public record StarAggregate(long sourceId,
                            AggregatedMeasurement pmRa,
                            AggregatedMeasurement pmDec,
                            double referenceRaUncertainty,
                            double referenceDecUncertainty) {

    public int frameCount() {
        return pmRa.count();
    }

    /**
     * Relative proper motion for the given statistic, with the catalog uncertainty
     * added in quadrature to the frame error.
     */
    public ProperMotion relative(final AveragingMode mode) {
        return new ProperMotion(
                pmRa.value(mode), FastMath.hypot(pmRa.error(mode), referenceRaUncertainty),
                pmDec.value(mode), FastMath.hypot(pmDec.error(mode), referenceDecUncertainty));
    }
}
