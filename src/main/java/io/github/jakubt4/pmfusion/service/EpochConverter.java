package io.github.jakubt4.pmfusion.service;

import org.orekit.time.AbsoluteDate;
import org.orekit.time.TimeScalesFactory;
import org.orekit.utils.Constants;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Converts observation epochs to decimal Julian years on the TT scale.
 *
 * <p>Accepted notations: {@code J2016.0} (Julian epoch), {@code MJD57531.5} (modified Julian
 * date) and a bare decimal year such as {@code 2005.37}.
 */
@Component
public class EpochConverter {

    private static final String JULIAN_PREFIX = "J";
    private static final String MJD_PREFIX = "MJD";

    /**
     * @throws IllegalArgumentException if {@code epoch} is blank or not a number in a known notation
     */
    public double toJulianYear(final String epoch) {
        if (epoch == null || epoch.isBlank()) {
            throw new IllegalArgumentException("Epoch is required");
        }
        final var text = epoch.trim().toUpperCase(Locale.ROOT);
        try {
            if (text.startsWith(MJD_PREFIX)) {
                return fromModifiedJulianDate(Double.parseDouble(text.substring(MJD_PREFIX.length())));
            }
            if (text.startsWith(JULIAN_PREFIX)) {
                return toJulianYear(AbsoluteDate.createJulianEpoch(Double.parseDouble(text.substring(1))));
            }
            return Double.parseDouble(text);
        } catch (final NumberFormatException e) {
            throw new IllegalArgumentException("Unparseable epoch: " + epoch, e);
        }
    }

    public double fromModifiedJulianDate(final double mjd) {
        final var day = (int) Math.floor(mjd);
        final var date = AbsoluteDate.createMJDDate(day, (mjd - day) * Constants.JULIAN_DAY, TimeScalesFactory.getTT());
        return toJulianYear(date);
    }

    public double toJulianYear(final AbsoluteDate date) {
        return 2000.0 + date.durationFrom(AbsoluteDate.J2000_EPOCH) / Constants.JULIAN_YEAR;
    }
}
