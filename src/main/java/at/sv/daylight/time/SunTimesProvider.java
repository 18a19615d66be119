package at.sv.daylight.time;

import at.sv.daylight.SolarEvent;
import at.sv.daylight.SolarEventOutcome;

import java.time.ZonedDateTime;

/**
 * Provides the solar events of a fixed location for the day of a given date-time.
 */
public interface SunTimesProvider {

    SolarEventOutcome getAstronomicalStart(ZonedDateTime dateTime);

    SolarEventOutcome getNauticalStart(ZonedDateTime dateTime);

    SolarEventOutcome getCivilStart(ZonedDateTime dateTime);

    SolarEventOutcome getSunrise(ZonedDateTime dateTime);

    SolarEventOutcome getNoon(ZonedDateTime dateTime);

    SolarEventOutcome getSunset(ZonedDateTime dateTime);

    SolarEventOutcome getCivilEnd(ZonedDateTime dateTime);

    SolarEventOutcome getNauticalEnd(ZonedDateTime dateTime);

    SolarEventOutcome getAstronomicalEnd(ZonedDateTime dateTime);

    SolarEventOutcome get(SolarEvent event, ZonedDateTime dateTime);

    /**
     * @return the first occurrence of the event after the given date-time
     */
    SolarEventOutcome getNext(SolarEvent event, ZonedDateTime dateTime);

    /**
     * @return all solar events of the day, one per line
     */
    String toDebugString(ZonedDateTime dateTime);
}
