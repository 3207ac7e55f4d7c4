package io.github.jakubt4.pmfusion.model;

/**
 * A source extracted from a first-epoch frame.
 *
 * @param x         detector x, pixels
 * @param y         detector y, pixels
 * @param magnitude instrumental magnitude
 * @param qfit      PSF fit quality; positional error is proportional to it
 */
public record DetectedSource(double x, double y, double magnitude, double qfit) {
}
