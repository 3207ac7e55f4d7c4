package io.github.jakubt4.pmfusion.dto;

import java.util.List;

/**
 * Inbound refinement job. The reference stars are given inline or, when {@code stars} is empty,
 * fetched from the archive for {@code region}.
 */
public record RefinementRequest(List<StarRow> stars, SkyRegion region, List<FrameRow> frames) {
}
