package io.github.jakubt4.pmfusion.dto;

/**
 * ICRS box queried from the catalog archive.
 *
 * @param ra     box centre right ascension, degrees
 * @param dec    box centre declination, degrees
 * @param width  extent along RA, degrees
 * @param height extent along Dec, degrees
 */
public record SkyRegion(double ra, double dec, double width, double height) {
}
