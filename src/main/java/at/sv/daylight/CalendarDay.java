package at.sv.daylight;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * A civil date without a time of day. It is resolved to a concrete instant, the local midnight, only in the time zone
 * of the {@link Location} it is used with.
 */
public record CalendarDay(int year, int month, int day) {

    public CalendarDay {
        try {
            LocalDate.of(year, month, day);
        } catch (DateTimeException e) {
            throw new InvalidCalendarComponentsException("Invalid calendar day " + year + "-" + month + "-" + day +
                                                         ": " + e.getMessage(), e);
        }
    }

    public static CalendarDay of(int year, int month, int day) {
        return new CalendarDay(year, month, day);
    }

    public static CalendarDay of(LocalDate date) {
        return new CalendarDay(date.getYear(), date.getMonthValue(), date.getDayOfMonth());
    }

    /**
     * Parses an ISO-8601 date like {@code 2014-11-01}.
     */
    public static CalendarDay parse(String text) {
        try {
            return of(LocalDate.parse(text.trim()));
        } catch (DateTimeException e) {
            throw new InvalidCalendarComponentsException("Invalid calendar day '" + text + "': " + e.getMessage(), e);
        }
    }

    public static CalendarDay today(Clock clock, ZoneId zone) {
        return of(LocalDate.now(clock.withZone(zone)));
    }

    public LocalDate toLocalDate() {
        return LocalDate.of(year, month, day);
    }

    public CalendarDay dayBefore() {
        return of(toLocalDate().minusDays(1));
    }

    public CalendarDay dayAfter() {
        return of(toLocalDate().plusDays(1));
    }

    /**
     * @return the first valid time of this day in the given zone, usually midnight
     */
    public ZonedDateTime atMidnight(ZoneId zone) {
        return toLocalDate().atStartOfDay(zone);
    }

    public SolarEventOutcome timeOf(SolarEvent event, Location location) {
        return Daylight.timeOf(event, this, location);
    }

    @Override
    public String toString() {
        return toLocalDate().toString();
    }
}
