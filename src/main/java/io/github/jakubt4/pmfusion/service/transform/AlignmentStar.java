package io.github.jakubt4.pmfusion.service.transform;

/**
 * Immutable view of a star handed to a frame transformer.
 *
 * @param sourceId        catalog identifier
 * @param ra              reference-epoch right ascension, degrees
 * @param dec             reference-epoch declination, degrees
 * @param raError         RA position error, mas
 * @param decError        Dec position error, mas
 * @param pmRa            motion used to rewind the star, mas/yr
 * @param pmDec           motion used to rewind the star, mas/yr
 * @param useForAlignment whether the star may constrain the fit
 */
public record AlignmentStar(long sourceId,
                            double ra,
                            double dec,
                            double raError,
                            double decError,
                            double pmRa,
                            double pmDec,
                            boolean useForAlignment) {
}
