package io.github.jakubt4.pmfusion.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * One catalog star as seen by a single refinement iteration. Instances are immutable;
 * every iteration produces new copies through the {@code with*} methods.
 *
 * @param sourceId         catalog identifier
 * @param ra               right ascension at the reference epoch, degrees
 * @param raError          error of {@code ra}, mas
 * @param dec              declination at the reference epoch, degrees
 * @param decError         error of {@code dec}, mas
 * @param pmRa             reference-epoch proper motion along RA (cos dec applied), mas/yr
 * @param pmRaError        error of {@code pmRa}
 * @param pmDec            reference-epoch proper motion along Dec, mas/yr
 * @param pmDecError       error of {@code pmDec}
 * @param magnitude        reference magnitude
 * @param candidateMember  seed membership, fixed for the whole run
 * @param useForAlignment  whether the star anchors the frame transformations
 * @param measurements     derived proper motions of the current iteration
 * @param logProbability   mixture log-probability of the last membership update, may be {@code null}
 */
public record Star(long sourceId,
                   double ra, double raError,
                   double dec, double decError,
                   double pmRa, double pmRaError,
                   double pmDec, double pmDecError,
                   double magnitude,
                   boolean candidateMember,
                   boolean useForAlignment,
                   Map<MeasurementKind, ProperMotion> measurements,
                   Double logProbability) {

    public Star {
        if (useForAlignment && !candidateMember) {
            throw new IllegalArgumentException(
                    "Star " + sourceId + " cannot be used for alignment without being a candidate member");
        }
        final var copy = new EnumMap<MeasurementKind, ProperMotion>(MeasurementKind.class);
        if (measurements != null) {
            copy.putAll(measurements);
        }
        measurements = Collections.unmodifiableMap(copy);
    }

    /**
     * Creates a star straight from the reference catalog, with no derived measurements.
     */
    public static Star reference(final long sourceId,
                                 final double ra, final double raError,
                                 final double dec, final double decError,
                                 final double pmRa, final double pmRaError,
                                 final double pmDec, final double pmDecError,
                                 final double magnitude,
                                 final boolean candidateMember) {
        return new Star(sourceId, ra, raError, dec, decError, pmRa, pmRaError, pmDec, pmDecError,
                magnitude, candidateMember, candidateMember, Map.of(), null);
    }

    public ProperMotion referenceMotion() {
        return new ProperMotion(pmRa, pmRaError, pmDec, pmDecError);
    }

    public Optional<ProperMotion> measurement(final MeasurementKind kind) {
        return Optional.ofNullable(measurements.get(kind));
    }

    public Star withUseForAlignment(final boolean use) {
        return new Star(sourceId, ra, raError, dec, decError, pmRa, pmRaError, pmDec, pmDecError,
                magnitude, candidateMember, use, measurements, logProbability);
    }

    public Star withCandidateMember(final boolean candidate) {
        return new Star(sourceId, ra, raError, dec, decError, pmRa, pmRaError, pmDec, pmDecError,
                magnitude, candidate, useForAlignment && candidate, measurements, logProbability);
    }

    public Star withMeasurements(final Map<MeasurementKind, ProperMotion> derived) {
        return new Star(sourceId, ra, raError, dec, decError, pmRa, pmRaError, pmDec, pmDecError,
                magnitude, candidateMember, useForAlignment, derived, logProbability);
    }

    public Star withLogProbability(final Double value) {
        return new Star(sourceId, ra, raError, dec, decError, pmRa, pmRaError, pmDec, pmDecError,
                magnitude, candidateMember, useForAlignment, measurements, value);
    }
}
