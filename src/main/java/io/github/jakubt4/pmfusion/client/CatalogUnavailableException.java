package io.github.jakubt4.pmfusion.client;

/**
 * The catalog archive could not be reached after retries.
 */
public class CatalogUnavailableException extends RuntimeException {

    public CatalogUnavailableException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
