package io.github.jakubt4.pmfusion.model;

import java.util.List;

/**
 * Read-only description of one first-epoch frame. Detector axes are assumed to run
 * roughly along increasing RA and Dec around {@code (referenceX, referenceY)}; the
 * linear fit absorbs small rotations and scale differences.
 *
 * @param frameId     unique frame identifier
 * @param filter      photometric filter name
 * @param epoch       observation epoch, decimal Julian year
 * @param pixelScale  arcsec per pixel
 * @param centerRa    tangent point right ascension, degrees
 * @param centerDec   tangent point declination, degrees
 * @param referenceX  detector x of the tangent point
 * @param referenceY  detector y of the tangent point
 * @param sources     detected sources
 */
public record FrameDescriptor(String frameId,
                              String filter,
                              double epoch,
                              double pixelScale,
                              double centerRa,
                              double centerDec,
                              double referenceX,
                              double referenceY,
                              List<DetectedSource> sources) {

    public FrameDescriptor {
        sources = sources == null ? List.of() : List.copyOf(sources);
    }
}
