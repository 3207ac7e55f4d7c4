package io.github.jakubt4.pmfusion.service;

import io.github.jakubt4.pmfusion.client.ArchiveCatalogClient;
import io.github.jakubt4.pmfusion.config.CatalogProperties;
import io.github.jakubt4.pmfusion.dto.CatalogRow;
import io.github.jakubt4.pmfusion.dto.SkyRegion;
import io.github.jakubt4.pmfusion.model.Star;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class CatalogPreparationServiceTest {

    private ArchiveCatalogClient client;
    private CatalogProperties properties;
    private CatalogPreparationService service;

    @BeforeEach
    void setUp() {
        client = mock(ArchiveCatalogClient.class);
        properties = new CatalogProperties();
        service = new CatalogPreparationService(client, properties);
    }

    @Test
    void inflatesErrorsByAstrometricSolution() {
        final var stars = service.prepare(List.of(row(1L, 31, 1.0, 15.0), row(2L, 95, 1.0, 15.0)));

        assertThat(stars.get(0).pmRaError()).isCloseTo(0.1 * 1.05, within(1e-12));
        assertThat(stars.get(1).pmDecError()).isCloseTo(0.2 * 1.22, within(1e-12));
        assertThat(stars.get(0).raError()).isEqualTo(0.3);
    }

    @Test
    void onlyCleanStarsAreSeededAsMembers() {
        final var stars = service.prepare(List.of(row(1L, 31, 1.0, 15.0), row(2L, 31, 2.5, 15.0)));

        assertThat(stars).extracting(Star::candidateMember).containsExactly(true, false);
        assertThat(stars).extracting(Star::useForAlignment).containsExactly(true, false);
    }

    @Test
    void qualityCutsCanBeDisabled() {
        properties.setCleanData(false);

        final var stars = service.prepare(List.of(row(2L, 31, 2.5, 15.0)));

        assertThat(stars.get(0).candidateMember()).isTrue();
    }

    @Test
    void sixParameterSolutionsCanBeExcluded() {
        properties.setOnly5p(true);

        final var stars = service.prepare(List.of(row(1L, 31, 1.0, 15.0), row(2L, 95, 1.0, 15.0)));

        assertThat(stars).extracting(Star::candidateMember).containsExactly(true, false);
    }

    @Test
    void magnitudeWindowLimitsCandidates() {
        properties.setMinMagnitude(14.0);
        properties.setMaxMagnitude(18.0);

        final var stars = service.prepare(List.of(row(1L, 31, 1.0, 13.0), row(2L, 31, 1.0, 16.0), row(3L, 31, 1.0, 19.0)));

        assertThat(stars).extracting(Star::candidateMember).containsExactly(false, true, false);
    }

    @Test
    void rowsWithoutProperMotionAreSkipped() {
        final var twoParameter = new CatalogRow(3L, 150.0, 0.3, 20.0, 0.3, null, null, null, null,
                19.0, 1.0, 0.05, 12, 0.5, 3, null, null);

        final var stars = service.prepare(List.of(twoParameter, row(1L, 31, 1.0, 15.0)));

        assertThat(stars).extracting(Star::sourceId).containsExactly(1L);
    }

    @Test
    void photometricCutFollowsTheCorrectedExcessFactorBand() {
        // C(0.8) = 1.19969, band at G = 15 is 3 * 0.01403
        final var stars = service.prepare(List.of(
                photometricRow(1L, 1.0, 15.0, 0.8, 1.21),
                photometricRow(2L, 1.0, 15.0, 0.8, 1.26),
                photometricRow(3L, 1.0, 15.0, 0.8, 1.15),
                photometricRow(4L, 1.0, 15.0, null, 1.21),
                photometricRow(5L, 1.0, 15.0, 0.8, null),
                photometricRow(6L, 1.0, 20.0, 0.8, 1.26)));

        assertThat(stars).extracting(Star::candidateMember)
                .containsExactly(true, false, false, false, false, true);
    }

    @Test
    void correctedExcessFactorRemovesTheColourTerm() {
        assertThat(CatalogPreparationService.correctedExcessFactor(0.2, 1.2))
                .isCloseTo(1.2 - (1.154360 + 0.033772 * 0.2 + 0.032277 * 0.04), within(1e-12));
        assertThat(CatalogPreparationService.correctedExcessFactor(0.8, 1.2))
                .isCloseTo(0.000311, within(1e-6));
        assertThat(CatalogPreparationService.correctedExcessFactor(5.0, 1.8))
                .isCloseTo(1.8 - (1.057572 + 0.140537 * 5.0), within(1e-12));
        assertThat(CatalogPreparationService.correctedExcessFactor(null, 1.2)).isEqualTo(1.2);
    }

    @Test
    void photometricCutIsPartOfTheCleaning() {
        properties.setCleanData(false);

        final var stars = service.prepare(List.of(photometricRow(2L, 1.0, 15.0, 0.8, 1.26)));

        assertThat(stars.get(0).candidateMember()).isTrue();
    }

    @Test
    void loadsRegionThroughTheArchive() {
        final var region = new SkyRegion(150.0, 20.0, 0.1, 0.1);
        when(client.fetchRegion(region)).thenReturn(List.of(row(1L, 31, 1.0, 15.0)));

        assertThat(service.loadRegion(region)).hasSize(1);
    }

    private static CatalogRow row(final long id, final int paramsSolved, final double ruwe, final double gmag) {
        return new CatalogRow(id, 150.0, 0.3, 20.0, 0.3, 1.0, 0.1, -2.0, 0.2,
                gmag, ruwe, 0.05, 12, 0.5, paramsSolved, 0.8, 1.2);
    }

    private static CatalogRow photometricRow(final long id, final double ruwe, final double gmag,
                                             final Double bpRp, final Double excessFactor) {
        return new CatalogRow(id, 150.0, 0.3, 20.0, 0.3, 1.0, 0.1, -2.0, 0.2,
                gmag, ruwe, 0.05, 12, 0.5, 31, bpRp, excessFactor);
    }
}
