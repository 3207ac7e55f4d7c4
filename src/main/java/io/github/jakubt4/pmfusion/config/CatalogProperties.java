package io.github.jakubt4.pmfusion.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Reference-catalog preparation settings, bound from {@code pmfusion.catalog.*}.
 */
@Data
@ConfigurationProperties(prefix = "pmfusion.catalog")
public class CatalogProperties {

    /** Apply the astrometric and photometric quality cuts before seeding membership. */
    private boolean cleanData = true;

    /** Keep only five-parameter astrometric solutions. */
    private boolean only5p = false;

    /** Inclusive magnitude window; {@code null} bounds are open. */
    private Double minMagnitude;

    private Double maxMagnitude;

    private double maxRuwe = 1.4;

    private double maxIpdGofHarmonicAmplitude = 0.2;

    private int minVisibilityPeriodsUsed = 9;

    private double maxExcessNoiseSignificance = 2.0;

    /** Half-width of the accepted corrected BP/RP flux excess band, in its magnitude-dependent sigma. */
    private double sigmaFluxExcessFactor = 3.0;

    /** Error inflation of five-parameter solutions. */
    private double inflation5p = 1.05;

    /** Error inflation of six-parameter solutions. */
    private double inflation6p = 1.22;
}
