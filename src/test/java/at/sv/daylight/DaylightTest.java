package at.sv.daylight;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

import static org.assertj.core.api.Assertions.assertThat;

class DaylightTest {

    private static final ZoneId NEW_YORK_ZONE = ZoneId.of("America/New_York");
    private static final ZoneId SYDNEY_ZONE = ZoneId.of("Australia/Sydney");

    private Location newYork;
    private Location sydney;
    private Location svalbard;

    private static void assertTime(SolarEventOutcome outcome, LocalDate date, int hour, int minute) {
        assertThat(outcome.isPresent()).as("outcome present: %s", outcome).isTrue();
        ZonedDateTime time = outcome.getTime();
        assertThat(time.toLocalDate()).isEqualTo(date);
        Duration difference = Duration.between(LocalTime.of(hour, minute), time.toLocalTime()).abs();
        assertThat(difference).as("Time differs: %s", time).isLessThanOrEqualTo(Duration.ofMinutes(1));
    }

    private static void assertFailure(SolarEventOutcome outcome, SolarEventFailure failure) {
        assertThat(outcome.isFailure()).as("outcome failure: %s", outcome).isTrue();
        assertThat(outcome.getFailure()).contains(failure);
    }

    @BeforeEach
    void setUp() {
        newYork = Location.of(NEW_YORK_ZONE, 40.642, -74.017);
        sydney = Location.of(SYDNEY_ZONE, -33.86, 151.20);
        svalbard = Location.of(ZoneId.of("Arctic/Longyearbyen"), 75.0, 15.0);
    }

    @Test
    void newYork_november() {
        CalendarDay day = CalendarDay.of(2014, 11, 1);
        LocalDate date = day.toLocalDate();

        assertTime(Daylight.timeOf(SolarEvent.SUNRISE, day, newYork), date, 7, 26);
        assertTime(Daylight.timeOf(SolarEvent.SUNSET, day, newYork), date, 17, 52);
        assertTime(Daylight.timeOf(SolarEvent.CIVIL_DAWN, day, newYork), date, 6, 58);
        assertTime(Daylight.timeOf(SolarEvent.CIVIL_DUSK, day, newYork), date, 18, 21);
    }

    @Test
    void sydney_july() {
        CalendarDay day = CalendarDay.of(2015, 7, 1);
        LocalDate date = day.toLocalDate();

        assertTime(Daylight.timeOf(SolarEvent.SUNRISE, day, sydney), date, 7, 1);
        assertTime(Daylight.timeOf(SolarEvent.SUNSET, day, sydney), date, 16, 57);
    }

    @Test
    void result_inTimeZoneOfLocation() {
        SolarEventOutcome sunrise = Daylight.timeOf(SolarEvent.SUNRISE, CalendarDay.of(2015, 7, 1), sydney);

        assertThat(sunrise.getTime().getZone()).isEqualTo(SYDNEY_ZONE);
    }

    @Test
    void twilight_orderedByElevation() {
        CalendarDay day = CalendarDay.of(2014, 11, 1);
        ZonedDateTime previous = null;
        for (SolarEvent event : SolarEvent.values()) {
            ZonedDateTime time = Daylight.timeOf(event, day, newYork).getTime();
            if (previous != null) {
                assertThat(time).as(event.name()).isAfter(previous);
            }
            previous = time;
        }
    }

    @Test
    void instant_usesCalendarDayOfLocation() {
        // 02:00 UTC is still October 31 in New York
        Instant instant = Instant.parse("2014-11-01T02:00:00Z");

        SolarEventOutcome sunrise = Daylight.timeOf(SolarEvent.SUNRISE, instant, newYork);

        assertTime(sunrise, LocalDate.of(2014, 10, 31), 7, 25);
    }

    @Test
    void instant_zonedDateTime_calendarDay_sameResult() {
        CalendarDay day = CalendarDay.of(2014, 11, 1);
        ZonedDateTime afternoon = ZonedDateTime.of(2014, 11, 1, 15, 0, 0, 0, NEW_YORK_ZONE);

        SolarEventOutcome expected = day.timeOf(SolarEvent.CIVIL_DUSK, newYork);

        assertThat(Daylight.timeOf(SolarEvent.CIVIL_DUSK, afternoon, newYork)).isEqualTo(expected);
        assertThat(Daylight.timeOf(SolarEvent.CIVIL_DUSK, afternoon.toInstant(), newYork)).isEqualTo(expected);
        assertThat(Daylight.timeOf(SolarEvent.CIVIL_DUSK, afternoon.withZoneSameInstant(SYDNEY_ZONE), newYork))
                .isEqualTo(expected);
    }

    @Test
    void solarNoon_isMidpointOfSunriseAndSunset() {
        Location[] locations = {newYork, sydney, Location.of(ZoneId.of("Europe/Stockholm"), 59.33, 18.067)};
        CalendarDay[] days = {CalendarDay.of(2014, 11, 1), CalendarDay.of(2015, 7, 1), CalendarDay.of(2021, 3, 20)};
        for (Location location : locations) {
            for (CalendarDay day : days) {
                ZonedDateTime sunrise = day.timeOf(SolarEvent.SUNRISE, location).getTime();
                ZonedDateTime sunset = day.timeOf(SolarEvent.SUNSET, location).getTime();
                ZonedDateTime noon = day.timeOf(SolarEvent.SOLAR_NOON, location).getTime();

                Duration morning = Duration.between(sunrise, noon);
                Duration afternoon = Duration.between(noon, sunset);

                assertThat(noon.getNano()).isZero();
                assertThat(afternoon.minus(morning)).isBetween(Duration.ZERO, Duration.ofSeconds(1));
            }
        }
    }

    @Test
    void apia_eventsStayOnRequestedDay() {
        Location apia = Location.of(ZoneId.of("Pacific/Apia"), -13.83, -171.76);
        CalendarDay day = CalendarDay.of(2015, 7, 1);

        assertTime(day.timeOf(SolarEvent.SUNRISE, apia), day.toLocalDate(), 6, 51);
        for (SolarEvent event : SolarEvent.values()) {
            assertThat(day.timeOf(event, apia).getTime().toLocalDate()).as("%s", event).isEqualTo(day.toLocalDate());
        }
    }

    @Test
    void kiritimati_eventsStayOnRequestedDay() {
        Location kiritimati = Location.of(ZoneId.of("Pacific/Kiritimati"), 1.87, -157.43);
        CalendarDay day = CalendarDay.of(2015, 7, 1);

        for (SolarEvent event : SolarEvent.values()) {
            assertThat(day.timeOf(event, kiritimati).getTime().toLocalDate()).as("%s", event)
                                                                           .isEqualTo(day.toLocalDate());
        }
    }

    @Test
    void timeOfNext_apia_beforeTodaysSunrise_today() {
        Location apia = Location.of(ZoneId.of("Pacific/Apia"), -13.83, -171.76);
        ZonedDateTime early = ZonedDateTime.of(2015, 7, 1, 3, 0, 0, 0, apia.timeZone());

        assertTime(Daylight.timeOfNext(SolarEvent.SUNRISE, early, apia), LocalDate.of(2015, 7, 1), 6, 51);
    }

    @Test
    void timeOfNext_apia_afterTodaysSunset_tomorrow() {
        Location apia = Location.of(ZoneId.of("Pacific/Apia"), -13.83, -171.76);
        ZonedDateTime evening = ZonedDateTime.of(2015, 7, 1, 20, 0, 0, 0, apia.timeZone());

        SolarEventOutcome next = Daylight.timeOfNext(SolarEvent.SUNSET, evening, apia);

        assertThat(next.getTime().toLocalDate()).isEqualTo(LocalDate.of(2015, 7, 2));
        assertThat(next.getTime()).isAfter(evening);
    }

    @Test
    void polarNight_neverRises() {
        CalendarDay day = CalendarDay.of(2021, 12, 21);

        assertFailure(Daylight.timeOf(SolarEvent.SUNRISE, day, svalbard), SolarEventFailure.NEVER_RISES);
        assertFailure(Daylight.timeOf(SolarEvent.SUNSET, day, svalbard), SolarEventFailure.NEVER_RISES);
        assertFailure(Daylight.timeOf(SolarEvent.SOLAR_NOON, day, svalbard), SolarEventFailure.NEVER_RISES);
    }

    @Test
    void polarDay_neverSets() {
        CalendarDay day = CalendarDay.of(2021, 6, 21);

        assertFailure(Daylight.timeOf(SolarEvent.SUNRISE, day, svalbard), SolarEventFailure.NEVER_SETS);
        assertFailure(Daylight.timeOf(SolarEvent.SUNSET, day, svalbard), SolarEventFailure.NEVER_SETS);
        assertFailure(Daylight.timeOf(SolarEvent.SOLAR_NOON, day, svalbard), SolarEventFailure.NEVER_SETS);
    }

    @Test
    void polarNight_civilTwilightStillOccurs() {
        // 75°N in late November: the sun stays below the horizon but rises above -12°
        CalendarDay day = CalendarDay.of(2021, 11, 25);

        assertFailure(Daylight.timeOf(SolarEvent.SUNRISE, day, svalbard), SolarEventFailure.NEVER_RISES);
        assertThat(Daylight.timeOf(SolarEvent.NAUTICAL_DAWN, day, svalbard).isPresent()).isTrue();
    }

    @Test
    void timeOfNext_beforeTodaysEvent_today() {
        ZonedDateTime early = ZonedDateTime.of(2014, 11, 1, 5, 0, 0, 0, NEW_YORK_ZONE);

        assertTime(Daylight.timeOfNext(SolarEvent.SUNRISE, early, newYork), LocalDate.of(2014, 11, 1), 7, 26);
    }

    @Test
    void timeOfNext_afterTodaysEvent_tomorrow_acrossDstChange() {
        ZonedDateTime morning = ZonedDateTime.of(2014, 11, 1, 10, 0, 0, 0, NEW_YORK_ZONE);

        SolarEventOutcome next = Daylight.timeOfNext(SolarEvent.SUNRISE, morning, newYork);

        // daylight saving time ends on November 2
        assertTime(next, LocalDate.of(2014, 11, 2), 6, 27);
    }

    @Test
    void timeOfNext_exactlyAtTodaysEvent_tomorrow() {
        ZonedDateTime sunrise = Daylight.timeOf(SolarEvent.SUNRISE, CalendarDay.of(2014, 11, 1), newYork).getTime();

        SolarEventOutcome next = Daylight.timeOfNext(SolarEvent.SUNRISE, sunrise, newYork);

        assertThat(next.getTime().toLocalDate()).isEqualTo(LocalDate.of(2014, 11, 2));
    }

    @Test
    void timeOfNext_alwaysAfterReference() {
        ZonedDateTime start = ZonedDateTime.of(2014, 10, 31, 0, 0, 0, 0, NEW_YORK_ZONE);
        for (int hour = 0; hour < 72; hour += 1) {
            ZonedDateTime reference = start.plusHours(hour).plusMinutes(17);
            for (Location location : new Location[]{newYork, sydney}) {
                for (SolarEvent event : SolarEvent.values()) {
                    ZonedDateTime next = Daylight.timeOfNext(event, reference, location).getTime();

                    assertThat(next).as("%s after %s at %s", event, reference, location)
                                    .isAfter(reference)
                                    .isBefore(reference.plusDays(2));
                }
            }
        }
    }

    @Test
    void timeOfNext_polarNight_failurePropagated() {
        ZonedDateTime reference = ZonedDateTime.of(2021, 12, 21, 12, 0, 0, 0, svalbard.timeZone());

        assertFailure(Daylight.timeOfNext(SolarEvent.SUNRISE, reference, svalbard), SolarEventFailure.NEVER_RISES);
    }

    @Test
    void julianDate_exposed() {
        assertThat(Daylight.julianDate(Instant.parse("2000-01-01T00:00:00Z"), NEW_YORK_ZONE)).isEqualTo(2451544.5);
    }
}
