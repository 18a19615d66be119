package at.sv.daylight;

import at.sv.daylight.astro.SolarEventTimes;
import at.sv.daylight.time.JulianDates;
import lombok.extern.slf4j.Slf4j;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Entry point for calculating the times of solar events. All methods are free of side effects and may be called
 * concurrently.
 */
@Slf4j
public final class Daylight {

    private Daylight() {
    }

    /**
     * @return the time of the event on the day of the given date-time, as seen in the time zone of the location
     */
    public static SolarEventOutcome timeOf(SolarEvent event, ZonedDateTime dateTime, Location location) {
        return timeOf(event, dateTime.toInstant(), location);
    }

    /**
     * @return the time of the event on the day of the given instant, as seen in the time zone of the location
     */
    public static SolarEventOutcome timeOf(SolarEvent event, Instant instant, Location location) {
        return timeOn(event, localDate(instant, location.timeZone()), location);
    }

    /**
     * @return the time of the event on the given calendar day in the time zone of the location, truncated to whole
     * seconds. Solar noon is the midpoint of sunrise and sunset.
     */
    public static SolarEventOutcome timeOf(SolarEvent event, CalendarDay day, Location location) {
        return timeOn(event, day.toLocalDate(), location);
    }

    /**
     * @return the first occurrence of the event after the given date-time. If the event already happened on the
     * day of the reference, the event of the following calendar day is returned.
     */
    public static SolarEventOutcome timeOfNext(SolarEvent event, ZonedDateTime reference, Location location) {
        return timeOfNext(event, reference.toInstant(), location);
    }

    /**
     * @return the first occurrence of the event after the given instant. If the event already happened on the day of
     * the reference, the event of the following calendar day is returned.
     */
    public static SolarEventOutcome timeOfNext(SolarEvent event, Instant reference, Location location) {
        LocalDate today = localDate(reference, location.timeZone());
        SolarEventOutcome outcome = timeOn(event, today, location);
        LocalDate day = today;
        while (outcome.isPresent() && !outcome.getTime().toInstant().isAfter(reference)) {
            day = day.plusDays(1);
            outcome = timeOn(event, day, location);
        }
        return outcome;
    }

    /**
     * @return the Julian Date of the given instant
     */
    public static double julianDate(Instant instant, ZoneId zone) {
        return JulianDates.toJulian(instant, zone);
    }

    private static SolarEventOutcome timeOn(SolarEvent event, LocalDate day, Location location) {
        Objects.requireNonNull(event, "event");
        if (event.isNoon()) {
            return noon(day, location);
        }
        ZoneId zone = location.timeZone();
        double julianDate = JulianDates.toJulian(day.atStartOfDay(zone));
        try {
            double minutes = SolarEventTimes.eventUtcMinutes(julianDate, location.coordinate(), event.getElevation(),
                    event.isRising());
            return SolarEventOutcome.of(SolarEventTimes.toDateTime(day, minutes, zone));
        } catch (SolarEventException e) {
            log.debug("No {} on {} at {}: {}", event.getKeyword(), day, location, e.getFailure());
            return SolarEventOutcome.failure(e.getFailure());
        }
    }

    private static SolarEventOutcome noon(LocalDate day, Location location) {
        SolarEventOutcome sunrise = timeOn(SolarEvent.SUNRISE, day, location);
        if (sunrise.isFailure()) {
            return sunrise;
        }
        SolarEventOutcome sunset = timeOn(SolarEvent.SUNSET, day, location);
        if (sunset.isFailure()) {
            return sunset;
        }
        ZonedDateTime rise = sunrise.getTime();
        Duration daylight = Duration.between(rise, sunset.getTime());
        return SolarEventOutcome.of(rise.plus(daylight.dividedBy(2)).truncatedTo(ChronoUnit.SECONDS));
    }

    private static LocalDate localDate(Instant instant, ZoneId zone) {
        try {
            return instant.atZone(zone).toLocalDate();
        } catch (DateTimeException e) {
            throw new InvalidCalendarComponentsException("Failed to resolve '" + instant + "' in zone " + zone, e);
        }
    }
}
