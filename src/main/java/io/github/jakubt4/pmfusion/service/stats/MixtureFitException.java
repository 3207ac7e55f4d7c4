package io.github.jakubt4.pmfusion.service.stats;

/**
 * Raised when a mixture model cannot be fitted or evaluated on the given sample.
 */
public class MixtureFitException extends IllegalStateException {

    public MixtureFitException(final String message) {
        super(message);
    }
}
