package io.github.jakubt4.pmfusion.dto;

import io.github.jakubt4.pmfusion.model.DetectedSource;
import io.github.jakubt4.pmfusion.model.FrameDescriptor;
import io.github.jakubt4.pmfusion.service.EpochConverter;

import java.util.List;

/**
 * First-epoch frame reduced to its detected sources.
 *
 * @param epoch observation epoch, e.g. {@code MJD53800.25} or {@code J2006.15}
 */
public record FrameRow(String frameId,
                       String filter,
                       String epoch,
                       double pixelScale,
                       double centerRa,
                       double centerDec,
                       double referenceX,
                       double referenceY,
                       List<DetectedSource> sources) {

    /**
     * @throws IllegalArgumentException if the frame id or the epoch is missing or malformed
     */
    public FrameDescriptor toDescriptor(final EpochConverter epochConverter) {
        if (frameId == null || frameId.isBlank()) {
            throw new IllegalArgumentException("Frame id is required");
        }
        return new FrameDescriptor(frameId, filter, epochConverter.toJulianYear(epoch), pixelScale,
                centerRa, centerDec, referenceX, referenceY, sources == null ? List.of() : sources);
    }
}
