package io.github.jakubt4.pmfusion.service.transform;

import io.github.jakubt4.pmfusion.model.FrameMeasurement;
import io.github.jakubt4.pmfusion.model.FrameTransformation;

import java.util.List;

/**
 * Outcome of aligning one frame.
 */
public sealed interface TransformResult permits TransformResult.Matched, TransformResult.Failed {

    String frameId();

    /**
     * @param fieldAligned the fit used every matched star rather than the alignment stars only
     */
    record Matched(FrameTransformation transformation, List<FrameMeasurement> measurements, boolean fieldAligned)
            implements TransformResult {

        public Matched {
            measurements = List.copyOf(measurements);
        }

        @Override
        public String frameId() {
            return transformation.frameId();
        }
    }

    record Failed(String frameId, String reason) implements TransformResult {
    }
}
