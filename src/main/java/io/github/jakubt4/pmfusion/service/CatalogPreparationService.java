package io.github.jakubt4.pmfusion.service;

import io.github.jakubt4.pmfusion.client.ArchiveCatalogClient;
import io.github.jakubt4.pmfusion.config.CatalogProperties;
import io.github.jakubt4.pmfusion.dto.CatalogRow;
import io.github.jakubt4.pmfusion.dto.SkyRegion;
import io.github.jakubt4.pmfusion.model.Star;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.hipparchus.util.FastMath;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns raw archive rows into reference stars.
 *
 * <p>Proper-motion errors are inflated to account for the underestimated formal errors of the
 * catalog. Stars failing the astrometric or photometric quality cuts or outside the magnitude
 * window are kept but never seeded as members.
 *
 * <p>The photometric cut keeps stars whose colour-corrected BP/RP flux excess factor C* lies
 * within {@code sigma-flux-excess-factor} times its expected spread at the star's G magnitude
 * (Riello et al. 2021).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CatalogPreparationService {

    private final ArchiveCatalogClient archiveCatalogClient;
    private final CatalogProperties properties;

    public List<Star> loadRegion(final SkyRegion region) {
        return prepare(archiveCatalogClient.fetchRegion(region));
    }

    public List<Star> prepare(final List<CatalogRow> rows) {
        final var stars = new ArrayList<Star>(rows.size());
        var skipped = 0;
        for (final var row : rows) {
            if (!row.hasProperMotion()) {
                skipped++;
                continue;
            }
            final var inflation = row.isFiveParameter() ? properties.getInflation5p() : properties.getInflation6p();
            final var magnitude = row.gmag() == null ? Double.NaN : row.gmag();
            stars.add(Star.reference(row.sourceId(),
                    row.ra(), row.raError(), row.dec(), row.decError(),
                    row.pmRa(), row.pmRaError() * inflation,
                    row.pmDec(), row.pmDecError() * inflation,
                    magnitude,
                    passesQualityCuts(row) && inMagnitudeWindow(magnitude)));
        }
        if (skipped > 0) {
            log.info("Skipped {} catalog rows without proper motion", skipped);
        }
        log.info("Prepared {} reference stars, {} seeded as members", stars.size(),
                stars.stream().filter(Star::candidateMember).count());
        return stars;
    }

    boolean passesQualityCuts(final CatalogRow row) {
        if (!properties.isCleanData()) {
            return true;
        }
        if (properties.isOnly5p() && !row.isFiveParameter()) {
            return false;
        }
        return atMost(row.ruwe(), properties.getMaxRuwe())
                && atMost(row.ipdGofHarmonicAmplitude(), properties.getMaxIpdGofHarmonicAmplitude())
                && row.visibilityPeriodsUsed() != null
                && row.visibilityPeriodsUsed() >= properties.getMinVisibilityPeriodsUsed()
                && atMost(row.astrometricExcessNoiseSig(), properties.getMaxExcessNoiseSignificance())
                && passesPhotometricCut(row);
    }

    boolean passesPhotometricCut(final CatalogRow row) {
        if (row.gmag() == null || row.photBpRpExcessFactor() == null) {
            return false;
        }
        final var corrected = correctedExcessFactor(row.bpRp(), row.photBpRpExcessFactor());
        return FastMath.abs(corrected) < properties.getSigmaFluxExcessFactor() * excessFactorSpread(row.gmag());
    }

    /**
     * C*: the flux excess factor minus its colour dependence. Without a colour nothing is
     * subtracted, which leaves C* far outside the accepted band.
     */
    static double correctedExcessFactor(final Double bpRp, final double excessFactor) {
        if (bpRp == null || Double.isNaN(bpRp)) {
            return excessFactor;
        }
        final double colour = bpRp;
        final double correction;
        if (colour < 0.5) {
            correction = 1.154360 + 0.033772 * colour + 0.032277 * colour * colour;
        } else if (colour < 4.0) {
            correction = 1.162004 + 0.011464 * colour + 0.049255 * colour * colour
                    - 0.005879 * colour * colour * colour;
        } else {
            correction = 1.057572 + 0.140537 * colour;
        }
        return excessFactor - correction;
    }

    static double excessFactorSpread(final double gmag) {
        return 0.0059898 + 8.817481e-12 * FastMath.pow(gmag, 7.618399);
    }

    private boolean inMagnitudeWindow(final double magnitude) {
        final var min = properties.getMinMagnitude();
        final var max = properties.getMaxMagnitude();
        if (min == null && max == null) {
            return true;
        }
        return Double.isFinite(magnitude)
                && (min == null || magnitude >= min)
                && (max == null || magnitude <= max);
    }

    private static boolean atMost(final Double value, final double limit) {
        return value != null && value <= limit;
    }
}
