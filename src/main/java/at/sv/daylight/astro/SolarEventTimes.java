package at.sv.daylight.astro;

import at.sv.daylight.Coordinate;
import at.sv.daylight.SolarEventException;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

import static at.sv.daylight.time.JulianDates.fromCenturies;
import static at.sv.daylight.time.JulianDates.plusMinutes;
import static at.sv.daylight.time.JulianDates.toCenturies;

/**
 * Calculates the time of day at which the sun crosses a given elevation. Times are returned in minutes from 00:00 UTC
 * of the calendar day, and may be negative or exceed a full day for locations far from the prime meridian.
 */
@Slf4j
public final class SolarEventTimes {

    private SolarEventTimes() {
    }

    /**
     * @param centuries     Julian Centuries of the day
     * @param westLongitude longitude of the observer in degrees, positive to the west
     * @return the time of solar noon in minutes from 00:00 UTC
     */
    public static double solarNoonUtcMinutes(double centuries, double westLongitude) {
        double noonEstimate = toCenturies(fromCenturies(centuries) + westLongitude / 360.0);
        double estimate = 720.0 + westLongitude * 4.0 - SolarEphemeris.equationOfTime(noonEstimate);

        double refined = toCenturies(plusMinutes(fromCenturies(centuries) - 0.5, estimate));
        return 720.0 + westLongitude * 4.0 - SolarEphemeris.equationOfTime(refined);
    }

    /**
     * Calculates the time at which the sun crosses the given elevation, refining the position of the sun in two
     * passes: first at solar noon, then at the time of the first estimate.
     *
     * @param julianDate the Julian Date of the local midnight starting the day
     * @param coordinate the observer
     * @param elevation  the elevation of the sun in degrees
     * @param rising     true for the morning crossing, false for the evening crossing
     * @return the time of the event in minutes from 00:00 UTC
     * @throws SolarEventException if the sun does not cross the elevation on this day
     */
    public static double eventUtcMinutes(double julianDate, Coordinate coordinate, double elevation, boolean rising) {
        double westLongitude = -coordinate.longitude();
        double centuries = toCenturies(julianDate);
        double noonMinutes = solarNoonUtcMinutes(centuries, westLongitude);

        double firstPass = timeAt(toCenturies(plusMinutes(julianDate, noonMinutes)), coordinate, elevation, rising);
        double secondPass = timeAt(toCenturies(plusMinutes(fromCenturies(centuries), firstPass)), coordinate, elevation, rising);
        log.trace("Elevation {} at {}: first pass {} min, second pass {} min", elevation, coordinate, firstPass, secondPass);
        return secondPass;
    }

    public static double sunriseUtcMinutes(double julianDate, Coordinate coordinate, double elevation) {
        return eventUtcMinutes(julianDate, coordinate, elevation, true);
    }

    public static double sunsetUtcMinutes(double julianDate, Coordinate coordinate, double elevation) {
        return eventUtcMinutes(julianDate, coordinate, elevation, false);
    }

    /**
     * Converts minutes from 00:00 UTC of the given calendar day into a date-time of the given zone, truncated to
     * whole seconds. The result is kept on the given local day: in zones whose offset is far from the longitude of the
     * observer (e.g. UTC+13 at 171°W) the minutes are counted from the neighbouring UTC midnight instead.
     */
    public static ZonedDateTime toDateTime(LocalDate day, double utcMinutes, ZoneId zone) {
        ZonedDateTime dateTime = toDateTime(day.atStartOfDay(ZoneOffset.UTC), utcMinutes, zone);
        LocalDate localDay = dateTime.toLocalDate();
        if (localDay.isAfter(day)) {
            return toDateTime(day.minusDays(1).atStartOfDay(ZoneOffset.UTC), utcMinutes, zone);
        } else if (localDay.isBefore(day)) {
            return toDateTime(day.plusDays(1).atStartOfDay(ZoneOffset.UTC), utcMinutes, zone);
        }
        return dateTime;
    }

    private static ZonedDateTime toDateTime(ZonedDateTime utcMidnight, double utcMinutes, ZoneId zone) {
        long seconds = (long) Math.floor(utcMinutes * 60.0);
        return utcMidnight.plusSeconds(seconds).withZoneSameInstant(zone);
    }

    private static double timeAt(double centuries, Coordinate coordinate, double elevation, boolean rising) {
        double equationOfTime = SolarEphemeris.equationOfTime(centuries);
        double declination = SolarEphemeris.declination(centuries);
        double hourAngle = HourAngleSolver.hourAngle(coordinate.latitude(), declination, elevation, rising);
        double delta = -coordinate.longitude() - Math.toDegrees(hourAngle);
        return 720.0 + delta * 4.0 - equationOfTime;
    }
}
