package io.github.jakubt4.pmfusion.service;

import io.github.jakubt4.pmfusion.config.AlignmentProperties;
import io.github.jakubt4.pmfusion.model.FrameTransformation;
import io.github.jakubt4.pmfusion.model.LinearTransform;
import io.github.jakubt4.pmfusion.model.Residual;
import org.hipparchus.random.Well19937c;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class QualityGateTest {

    private AlignmentProperties properties;
    private QualityGate gate;

    @BeforeEach
    void setUp() {
        properties = new AlignmentProperties();
        gate = new QualityGate(properties);
    }

    @Test
    void acceptsGaussianResiduals() {
        properties.setFixTransformations(false);

        final var verdict = gate.assess(transformation(gaussian(200, 0.0, 1L)));

        assertThat(verdict.usable()).isTrue();
        assertThat(verdict.failures()).isEmpty();
        assertThat(verdict.rejected()).isEmpty();
    }

    @Test
    void trimsOutliersAndReportsThem() {
        final var residuals = gaussian(200, 0.0, 2L);
        residuals.add(new Residual(9001L, 0.2, 0.2));
        residuals.add(new Residual(9002L, -0.25, 0.1));
        residuals.add(new Residual(9003L, 0.05, -0.3));

        final var verdict = gate.assess(transformation(residuals));

        assertThat(verdict.rejected()).containsExactlyInAnyOrder(9001L, 9002L, 9003L);
        assertThat(verdict.trimmed().sampleSize()).isEqualTo(200);
        assertThat(verdict.usable()).isTrue();
    }

    @Test
    void rejectsUniformResiduals() {
        properties.setFixTransformations(false);
        final var random = new Well19937c(3L);
        final var residuals = new ArrayList<Residual>();
        for (var i = 0; i < 500; i++) {
            residuals.add(new Residual(i, 0.02 * random.nextDouble() - 0.01, 0.02 * random.nextDouble() - 0.01));
        }

        final var verdict = gate.assess(transformation(residuals));

        assertThat(verdict.gaussian()).isFalse();
        assertThat(verdict.usable()).isFalse();
    }

    @Test
    void rejectsOffCentreResiduals() {
        properties.setFixTransformations(false);

        final var verdict = gate.assess(transformation(gaussian(200, 0.05, 4L)));

        assertThat(verdict.centered()).isFalse();
        assertThat(verdict.gaussian()).isTrue();
        assertThat(verdict.failures()).singleElement().asString().contains("centroid");
    }

    @Test
    void rejectsFitsWithTooFewStars() {
        properties.setFixTransformations(false);

        final var verdict = gate.assess(transformation(gaussian(10, 0.0, 5L)));

        assertThat(verdict.enoughStars()).isFalse();
        assertThat(verdict.usable()).isFalse();
    }

    private static List<Residual> gaussian(final int size, final double shift, final long seed) {
        final var random = new Well19937c(seed);
        final var residuals = new ArrayList<Residual>();
        for (var i = 0; i < size; i++) {
            residuals.add(new Residual(i, shift + 0.01 * random.nextGaussian(), shift + 0.01 * random.nextGaussian()));
        }
        return residuals;
    }

    private static FrameTransformation transformation(final List<Residual> residuals) {
        return new FrameTransformation("j9xy01", LinearTransform.centeredOn(0.0, 0.0), residuals);
    }
}
