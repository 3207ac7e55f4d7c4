package io.github.jakubt4.pmfusion.service.transform;

/**
 * Aligns one frame onto the reference catalog. Implementations must be safe to call
 * concurrently for different frames and report failures as {@link TransformResult.Failed}.
 */
@FunctionalInterface
public interface FrameTransformer {

    TransformResult transform(TransformRequest request);
}
