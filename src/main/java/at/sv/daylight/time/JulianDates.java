package at.sv.daylight.time;

import at.sv.daylight.InvalidCalendarComponentsException;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Conversions between civil date-times and Julian Dates on the UTC time scale, and between Julian Dates and Julian
 * Centuries since the epoch J2000.0.
 */
public final class JulianDates {

    /**
     * Julian Date of the epoch J2000.0, i.e. 2000-01-01T12:00Z.
     */
    public static final double J2000 = 2451545.0;
    public static final double DAYS_PER_CENTURY = 36525.0;

    private static final double UNIX_EPOCH = 2440587.5;
    private static final double SECONDS_PER_DAY = 86400.0;

    private JulianDates() {
    }

    /**
     * Converts the given date-time into a Julian Date. The calendar components are read in the zone of the date-time
     * and shifted by its UTC offset, so the result is the same for every zone representing the same instant.
     *
     * @throws InvalidCalendarComponentsException if the components of the date-time could not be resolved
     */
    public static double toJulian(ZonedDateTime dateTime) {
        try {
            long y = dateTime.getYear();
            long m = dateTime.getMonthValue();
            long d = dateTime.getDayOfMonth();
            int millis = dateTime.getNano() / 1_000_000;

            long dayNumber = (1461 * (y + 4800 + (m - 14) / 12)) / 4
                             + (367 * (m - 2 - 12 * ((m - 14) / 12))) / 12
                             - (3 * ((y + 4900 + (m - 14) / 12) / 100)) / 4
                             + d - 32075;

            double julian = dayNumber
                            + (dateTime.getHour() - 12.0) / 24.0
                            + dateTime.getMinute() / 1440.0
                            + dateTime.getSecond() / SECONDS_PER_DAY
                            + millis / 86_400_000.0;

            int offsetSeconds = dateTime.getOffset().getTotalSeconds();
            return julian - offsetSeconds / SECONDS_PER_DAY;
        } catch (DateTimeException | ArithmeticException e) {
            throw new InvalidCalendarComponentsException("Failed to resolve calendar components of '" + dateTime + "'", e);
        }
    }

    /**
     * @throws InvalidCalendarComponentsException if the instant could not be resolved in the given zone
     */
    public static double toJulian(Instant instant, ZoneId zone) {
        ZonedDateTime dateTime;
        try {
            dateTime = instant.atZone(zone);
        } catch (DateTimeException e) {
            throw new InvalidCalendarComponentsException("Failed to resolve '" + instant + "' in zone " + zone, e);
        }
        return toJulian(dateTime);
    }

    /**
     * Converts the given Julian Date back into a date-time of the given zone, truncated to whole seconds.
     *
     * @throws InvalidCalendarComponentsException if the Julian Date lies outside the supported range
     */
    public static ZonedDateTime fromJulian(double julianDate, ZoneId zone) {
        double epochSeconds = Math.floor((julianDate - UNIX_EPOCH) * SECONDS_PER_DAY);
        if (Double.isNaN(epochSeconds) || Double.isInfinite(epochSeconds)) {
            throw new InvalidCalendarComponentsException("Invalid Julian Date: " + julianDate);
        }
        try {
            return Instant.ofEpochSecond((long) epochSeconds).atZone(zone);
        } catch (DateTimeException e) {
            throw new InvalidCalendarComponentsException("Julian Date " + julianDate + " is out of range", e);
        }
    }

    public static double toCenturies(double julianDate) {
        return (julianDate - J2000) / DAYS_PER_CENTURY;
    }

    public static double fromCenturies(double centuries) {
        return centuries * DAYS_PER_CENTURY + J2000;
    }

    /**
     * @return the Julian Date shifted by the given number of minutes
     */
    public static double plusMinutes(double julianDate, double minutes) {
        return julianDate + minutes / 1440.0;
    }
}
