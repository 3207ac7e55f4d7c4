package io.github.jakubt4.pmfusion.service.transform;

import io.github.jakubt4.pmfusion.model.DetectedSource;
import io.github.jakubt4.pmfusion.model.FrameDescriptor;
import io.github.jakubt4.pmfusion.model.Star;
import org.hipparchus.random.Well19937c;

import java.util.ArrayList;
import java.util.List;

/**
 * Simulated cluster field: a reference catalog on a jittered grid and first-epoch frames
 * observing it with the same gnomonic geometry the transformer uses.
 */
public final class SyntheticSky {

    public static final double CENTER_RA = 150.0;
    public static final double CENTER_DEC = 20.0;
    public static final double PIXEL_SCALE = 0.05;
    public static final double REFERENCE_PIXEL = 2048.0;
    public static final double REFERENCE_EPOCH = 2016.0;
    public static final double QFIT = 0.02;

    public static final double MEMBER_PM_RA = 1.5;
    public static final double MEMBER_PM_DEC = -2.5;

    private static final int GRID = 15;
    private static final double GRID_SPACING_PX = 80.0;

    private SyntheticSky() {
    }

    /**
     * Members move together with a small dispersion, field stars scatter around another motion.
     * Only members are seeded as candidates.
     */
    public static List<Star> catalog(final int members, final int field, final long seed) {
        if (members + field > GRID * GRID) {
            throw new IllegalArgumentException("At most " + GRID * GRID + " stars fit the grid");
        }
        final var random = new Well19937c(seed);
        final var cosDec = Math.cos(Math.toRadians(CENTER_DEC));
        final var stars = new ArrayList<Star>();
        for (var i = 0; i < members + field; i++) {
            final var member = i < members;
            final var xPx = (i % GRID - GRID / 2) * GRID_SPACING_PX + 40.0 * (random.nextDouble() - 0.5);
            final var yPx = (i / GRID - GRID / 2) * GRID_SPACING_PX + 40.0 * (random.nextDouble() - 0.5);
            final var ra = CENTER_RA + xPx * PIXEL_SCALE / 3600.0 / cosDec;
            final var dec = CENTER_DEC + yPx * PIXEL_SCALE / 3600.0;
            final var pmRa = member ? MEMBER_PM_RA + 0.05 * random.nextGaussian() : -4.0 + 1.5 * random.nextGaussian();
            final var pmDec = member ? MEMBER_PM_DEC + 0.05 * random.nextGaussian() : 5.0 + 1.5 * random.nextGaussian();
            stars.add(Star.reference(1000L + i, ra, 0.05, dec, 0.05, pmRa, 0.03, pmDec, 0.03,
                    15.0 + 3.0 * random.nextDouble(), member));
        }
        return stars;
    }

    /**
     * Detections of every star at {@code epoch}, moved with its catalog motion, shifted by
     * {@code offsetPx} and blurred by Gaussian noise of {@code noisePx}.
     */
    public static FrameDescriptor frame(final String frameId, final List<Star> stars, final double epoch,
                                        final double offsetPx, final double noisePx, final long seed) {
        final var random = new Well19937c(seed);
        final var plane = new TangentPlane(CENTER_RA, CENTER_DEC);
        final var sources = new ArrayList<DetectedSource>();
        for (final var star : stars) {
            final var moved = TangentPlane.propagate(star.ra(), star.dec(), star.pmRa(), star.pmDec(),
                    epoch - REFERENCE_EPOCH);
            final var standard = plane.project(moved[0], moved[1]);
            sources.add(new DetectedSource(
                    standard[0] / PIXEL_SCALE + REFERENCE_PIXEL + offsetPx + noisePx * random.nextGaussian(),
                    standard[1] / PIXEL_SCALE + REFERENCE_PIXEL - offsetPx + noisePx * random.nextGaussian(),
                    star.magnitude() + 0.3,
                    QFIT));
        }
        return new FrameDescriptor(frameId, "F606W", epoch, PIXEL_SCALE, CENTER_RA, CENTER_DEC,
                REFERENCE_PIXEL, REFERENCE_PIXEL, sources);
    }

    public static List<AlignmentStar> alignmentStars(final List<Star> stars) {
        return stars.stream()
                .map(star -> new AlignmentStar(star.sourceId(), star.ra(), star.dec(), star.raError(),
                        star.decError(), star.pmRa(), star.pmDec(), star.useForAlignment()))
                .toList();
    }
}
