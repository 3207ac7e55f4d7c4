package io.github.jakubt4.pmfusion;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.retry.annotation.EnableRetry;

/**
 * PM Fusion: cross-epoch astrometric alignment service.
 *
 * <p>Aligns first-epoch frames onto a reference-epoch catalog, derives relative proper motions
 * per frame, fuses them per star and calibrates them to the absolute reference frame, refining
 * the set of alignment stars until the solution settles.
 *
 * @see io.github.jakubt4.pmfusion.service.ConvergenceController
 */
@SpringBootApplication
@EnableRetry
@ConfigurationPropertiesScan
public class PmFusionApplication {

    public static void main(String[] args) {
        SpringApplication.run(PmFusionApplication.class, args);
    }
}
