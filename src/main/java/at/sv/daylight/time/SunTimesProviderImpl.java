package at.sv.daylight.time;

import at.sv.daylight.Daylight;
import at.sv.daylight.Location;
import at.sv.daylight.SolarEvent;
import at.sv.daylight.SolarEventOutcome;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

@RequiredArgsConstructor
public final class SunTimesProviderImpl implements SunTimesProvider {

    private static final DateTimeFormatter TIME_FORMATTER = DateTimeFormatter.ofPattern("HH:mm:ss");

    @Getter
    private final Location location;

    @Override
    public SolarEventOutcome getAstronomicalStart(ZonedDateTime dateTime) {
        return get(SolarEvent.ASTRONOMICAL_DAWN, dateTime);
    }

    @Override
    public SolarEventOutcome getNauticalStart(ZonedDateTime dateTime) {
        return get(SolarEvent.NAUTICAL_DAWN, dateTime);
    }

    @Override
    public SolarEventOutcome getCivilStart(ZonedDateTime dateTime) {
        return get(SolarEvent.CIVIL_DAWN, dateTime);
    }

    @Override
    public SolarEventOutcome getSunrise(ZonedDateTime dateTime) {
        return get(SolarEvent.SUNRISE, dateTime);
    }

    @Override
    public SolarEventOutcome getNoon(ZonedDateTime dateTime) {
        return get(SolarEvent.SOLAR_NOON, dateTime);
    }

    @Override
    public SolarEventOutcome getSunset(ZonedDateTime dateTime) {
        return get(SolarEvent.SUNSET, dateTime);
    }

    @Override
    public SolarEventOutcome getCivilEnd(ZonedDateTime dateTime) {
        return get(SolarEvent.CIVIL_DUSK, dateTime);
    }

    @Override
    public SolarEventOutcome getNauticalEnd(ZonedDateTime dateTime) {
        return get(SolarEvent.NAUTICAL_DUSK, dateTime);
    }

    @Override
    public SolarEventOutcome getAstronomicalEnd(ZonedDateTime dateTime) {
        return get(SolarEvent.ASTRONOMICAL_DUSK, dateTime);
    }

    @Override
    public SolarEventOutcome get(SolarEvent event, ZonedDateTime dateTime) {
        return Daylight.timeOf(event, dateTime, location);
    }

    @Override
    public SolarEventOutcome getNext(SolarEvent event, ZonedDateTime dateTime) {
        return Daylight.timeOfNext(event, dateTime, location);
    }

    @Override
    public String toDebugString(ZonedDateTime dateTime) {
        return Arrays.stream(SolarEvent.values())
                     .map(event -> event.getKeyword() + ": " + format(get(event, dateTime)))
                     .collect(Collectors.joining("\n"));
    }

    static String format(SolarEventOutcome outcome) {
        return outcome.fold(TIME_FORMATTER::format, failure -> "-- (" + failure.name().toLowerCase(Locale.ENGLISH) + ")");
    }
}
