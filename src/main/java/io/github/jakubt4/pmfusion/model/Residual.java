package io.github.jakubt4.pmfusion.model;

/**
 * Offset between a transformed detection and its predicted catalog position, pixels.
 */
public record Residual(long sourceId, double dx, double dy) {
}
