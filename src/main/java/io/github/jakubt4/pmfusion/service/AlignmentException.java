package io.github.jakubt4.pmfusion.service;

/**
 * Fatal refinement failure: no frame could be aligned, so no proper motion can be derived.
 */
public class AlignmentException extends RuntimeException {

    public AlignmentException(final String message) {
        super(message);
    }

    public AlignmentException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
