package io.github.jakubt4.pmfusion.service.transform;

import io.github.jakubt4.pmfusion.config.AlignmentProperties;
import io.github.jakubt4.pmfusion.model.FrameDescriptor;
import io.github.jakubt4.pmfusion.model.FrameMeasurement;
import io.github.jakubt4.pmfusion.model.Residual;
import io.github.jakubt4.pmfusion.model.Star;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

import static io.github.jakubt4.pmfusion.service.transform.SyntheticSky.REFERENCE_EPOCH;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class LinearFrameTransformerTest {

    private static final double FRAME_EPOCH = 2006.0;

    private LinearFrameTransformer transformer;
    private List<Star> stars;

    @BeforeEach
    void setUp() {
        transformer = new LinearFrameTransformer(new AlignmentProperties());
        stars = SyntheticSky.catalog(60, 20, 42L);
    }

    @Test
    void relativeMotionsOfMembersVanishWithoutRewinding() {
        final var frame = SyntheticSky.frame("j8c0d1", stars, FRAME_EPOCH, 1.0, 0.0, 1L);

        final var result = matched(transformer.transform(request(frame, Set.of(), false)));
        final var byStar = bySource(result.measurements());

        assertThat(result.measurements()).hasSize(stars.size());
        for (final var star : stars) {
            final var measurement = byStar.get(star.sourceId());
            // the fit absorbs the bulk motion, leaving the motion relative to the members
            final var tolerance = star.candidateMember() ? 0.05 : 0.2;
            assertThat(measurement.pmRa()).isCloseTo(star.pmRa() - SyntheticSky.MEMBER_PM_RA, within(tolerance));
            assertThat(measurement.pmDec()).isCloseTo(star.pmDec() - SyntheticSky.MEMBER_PM_DEC, within(tolerance));
        }
    }

    @Test
    void rewoundStarsRecoverTheirSuppliedMotion() {
        final var frame = SyntheticSky.frame("j8c0d1", stars, FRAME_EPOCH, 1.0, 0.0, 1L);

        final var result = matched(transformer.transform(request(frame, Set.of(), true)));
        final var byStar = bySource(result.measurements());

        for (final var star : stars) {
            assertThat(byStar.get(star.sourceId()).pmRa()).isCloseTo(star.pmRa(), within(1e-3));
            assertThat(byStar.get(star.sourceId()).pmDec()).isCloseTo(star.pmDec(), within(1e-3));
        }
        assertThat(result.transformation().residuals())
                .allSatisfy(residual -> {
                    assertThat(residual.dx()).isCloseTo(0.0, within(1e-3));
                    assertThat(residual.dy()).isCloseTo(0.0, within(1e-3));
                });
    }

    @Test
    void onlyAlignmentStarsEnterTheFit() {
        final var frame = SyntheticSky.frame("j8c0d1", stars, FRAME_EPOCH, 1.0, 0.01, 1L);
        final var excluded = Set.of(1000L, 1001L);

        final var result = matched(transformer.transform(request(frame, excluded, false)));
        final var fitIds = result.transformation().residuals().stream()
                .map(Residual::sourceId)
                .collect(Collectors.toSet());

        assertThat(fitIds).hasSize(58).doesNotContainAnyElementsOf(excluded);
        assertThat(fitIds).allSatisfy(id -> assertThat(id).isLessThan(1060L));
        assertThat(bySource(result.measurements())).containsKeys(1000L, 1001L, 1079L);
    }

    @Test
    void errorsScaleWithFitQualityAndBaseline() {
        final var frame = SyntheticSky.frame("j8c0d1", stars, FRAME_EPOCH, 0.0, 0.0, 1L);

        final var measurement = matched(transformer.transform(request(frame, Set.of(), false)))
                .measurements().get(0);

        // qfit * 50 mas/px * 0.85 / 10 yr
        assertThat(measurement.error()).isCloseTo(0.085, within(1e-9));
        assertThat(measurement.referenceRaUncertainty()).isCloseTo(0.005, within(1e-9));
        assertThat(measurement.frameId()).isEqualTo("j8c0d1");
    }

    @Test
    void failsOnFrameWithoutSources() {
        final var frame = new FrameDescriptor("empty", "F814W", FRAME_EPOCH, SyntheticSky.PIXEL_SCALE,
                SyntheticSky.CENTER_RA, SyntheticSky.CENTER_DEC, 2048.0, 2048.0, List.of());

        final var result = transformer.transform(request(frame, Set.of(), false));

        assertThat(result).isInstanceOf(TransformResult.Failed.class);
        assertThat(((TransformResult.Failed) result).reason()).contains("no detected sources");
    }

    @Test
    void failsWithoutTimeBaseline() {
        final var frame = SyntheticSky.frame("same-epoch", stars, REFERENCE_EPOCH, 0.0, 0.0, 1L);

        final var result = transformer.transform(request(frame, Set.of(), false));

        assertThat(result).isInstanceOf(TransformResult.Failed.class);
    }

    @Test
    void failsWhenTooFewAlignmentStarsMatch() {
        final var sparse = stars.stream()
                .map(star -> star.sourceId() < 1002L ? star : star.withUseForAlignment(false))
                .toList();
        final var frame = SyntheticSky.frame("sparse", sparse, FRAME_EPOCH, 0.0, 0.0, 1L);

        final var result = transformer.transform(new TransformRequest(frame, SyntheticSky.alignmentStars(sparse),
                Set.of(), REFERENCE_EPOCH, false, FitSelection.ALIGNMENT_STARS));

        assertThat(result).isInstanceOf(TransformResult.Failed.class);
        assertThat(((TransformResult.Failed) result).reason()).contains("only 2 alignment stars");
    }

    @Test
    void sparseFieldIsAlignedOnEveryMatchedStar() {
        final var sparse = stars.stream()
                .map(star -> star.sourceId() < 1005L ? star : star.withUseForAlignment(false))
                .toList();
        final var frame = SyntheticSky.frame("sparse", sparse, FRAME_EPOCH, 0.5, 0.01, 1L);

        final var result = matched(transformer.transform(new TransformRequest(frame,
                SyntheticSky.alignmentStars(sparse), Set.of(1079L), REFERENCE_EPOCH, false,
                FitSelection.FIELD_FALLBACK)));
        final var fitIds = result.transformation().residuals().stream()
                .map(Residual::sourceId)
                .collect(Collectors.toSet());

        assertThat(result.fieldAligned()).isTrue();
        assertThat(fitIds).hasSize(79).doesNotContain(1079L).contains(1060L, 1078L);
    }

    @Test
    void fieldWithEnoughAlignmentStarsKeepsTheirFit() {
        final var frame = SyntheticSky.frame("j8c0d1", stars, FRAME_EPOCH, 0.5, 0.01, 1L);

        final var result = matched(transformer.transform(new TransformRequest(frame,
                SyntheticSky.alignmentStars(stars), Set.of(), REFERENCE_EPOCH, false, FitSelection.FIELD_FALLBACK)));

        assertThat(result.fieldAligned()).isFalse();
        assertThat(result.transformation().residuals()).hasSize(60);
    }

    @Test
    void allStarsSelectionIgnoresAlignmentFlags() {
        final var frame = SyntheticSky.frame("j8c0d1", stars, FRAME_EPOCH, 0.5, 0.01, 1L);

        final var result = matched(transformer.transform(new TransformRequest(frame,
                SyntheticSky.alignmentStars(stars), Set.of(), REFERENCE_EPOCH, false, FitSelection.ALL_STARS)));

        assertThat(result.fieldAligned()).isTrue();
        assertThat(result.transformation().residuals()).hasSize(stars.size());
    }

    private TransformRequest request(final FrameDescriptor frame, final Set<Long> excluded, final boolean rewind) {
        return new TransformRequest(frame, SyntheticSky.alignmentStars(stars), excluded, REFERENCE_EPOCH, rewind,
                FitSelection.ALIGNMENT_STARS);
    }

    private static TransformResult.Matched matched(final TransformResult result) {
        assertThat(result).isInstanceOf(TransformResult.Matched.class);
        return (TransformResult.Matched) result;
    }

    private static Map<Long, FrameMeasurement> bySource(final List<FrameMeasurement> measurements) {
        return measurements.stream().collect(Collectors.toMap(FrameMeasurement::sourceId, Function.identity()));
    }
}
