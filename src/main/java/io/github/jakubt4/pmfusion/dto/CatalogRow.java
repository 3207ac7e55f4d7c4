package io.github.jakubt4.pmfusion.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One source as served by the catalog archive. Quality columns may be absent.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CatalogRow(@JsonProperty("source_id") long sourceId,
                         @JsonProperty("ra") double ra,
                         @JsonProperty("ra_error") double raError,
                         @JsonProperty("dec") double dec,
                         @JsonProperty("dec_error") double decError,
                         @JsonProperty("pmra") Double pmRa,
                         @JsonProperty("pmra_error") Double pmRaError,
                         @JsonProperty("pmdec") Double pmDec,
                         @JsonProperty("pmdec_error") Double pmDecError,
                         @JsonProperty("phot_g_mean_mag") Double gmag,
                         @JsonProperty("ruwe") Double ruwe,
                         @JsonProperty("ipd_gof_harmonic_amplitude") Double ipdGofHarmonicAmplitude,
                         @JsonProperty("visibility_periods_used") Integer visibilityPeriodsUsed,
                         @JsonProperty("astrometric_excess_noise_sig") Double astrometricExcessNoiseSig,
                         @JsonProperty("astrometric_params_solved") Integer astrometricParamsSolved,
                         @JsonProperty("bp_rp") Double bpRp,
                         @JsonProperty("phot_bp_rp_excess_factor") Double photBpRpExcessFactor) {

    /** {@code astrometric_params_solved} bit mask of a five-parameter solution. */
    public static final int FIVE_PARAMETER_SOLUTION = 31;

    public boolean hasProperMotion() {
        return pmRa != null && pmDec != null && pmRaError != null && pmDecError != null;
    }

    public boolean isFiveParameter() {
        return astrometricParamsSolved != null && astrometricParamsSolved == FIVE_PARAMETER_SOLUTION;
    }
}
