package io.github.jakubt4.pmfusion.service.transform;

import io.github.jakubt4.pmfusion.model.FrameDescriptor;

import java.util.List;
import java.util.Set;

/**
 * Everything one worker needs to align one frame.
 *
 * @param frame           frame to align
 * @param stars           star snapshot of the current iteration
 * @param excludedFromFit stars trimmed from this frame's previous fits
 * @param referenceEpoch  catalog epoch, decimal Julian year
 * @param rewind          move stars to the frame epoch with their motion before matching and fitting
 * @param fitSelection    which matched stars may enter the fit
 */
public record TransformRequest(FrameDescriptor frame,
                               List<AlignmentStar> stars,
                               Set<Long> excludedFromFit,
                               double referenceEpoch,
                               boolean rewind,
                               FitSelection fitSelection) {

    public TransformRequest {
        stars = List.copyOf(stars);
        excludedFromFit = Set.copyOf(excludedFromFit);
    }
}
