package at.sv.daylight;

import at.sv.daylight.time.SunTimesProvider;
import at.sv.daylight.time.SunTimesProviderImpl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.PrintWriter;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.List;

@Command(name = "daylight", version = "0.1.0", mixinStandardHelpOptions = true, sortOptions = false,
        description = "Prints the times of sunrise, sunset, solar noon and twilight for a location.")
public final class DaylightCommand implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(DaylightCommand.class);
    private static final DateTimeFormatter TIME_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss xxx");

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Option(names = "--lat",
            defaultValue = "${env:LAT}",
            description = "The latitude of your location in degrees [-90..90].")
    Double latitude;
    @Option(names = "--long",
            defaultValue = "${env:LONG}",
            description = "The longitude of your location in degrees [-180..180].")
    Double longitude;
    @Option(names = "--location", paramLabel = "<coordinate>",
            defaultValue = "${env:LOCATION}",
            description = "Alternative to --lat and --long: the coordinate of your location, either in decimal degrees " +
                          "(e.g. '48.20, 16.39') or in sexagesimal degrees (e.g. '48°12'N 16°23'E').")
    String location;
    @Option(names = "--zone", paramLabel = "<zone id>",
            defaultValue = "${env:TIME_ZONE}",
            description = "The time zone used to determine the day and to display the times, e.g. Europe/Vienna. " +
                          "Default: the system time zone.")
    String zone;
    @Option(names = "--date", paramLabel = "<yyyy-MM-dd>",
            description = "The day to calculate the solar events for. Default: today.")
    String date;
    @Option(names = "--event", paramLabel = "<keyword>",
            description = "Only print the given event, e.g. sunrise, civil_dusk, noon.")
    String event;
    @Option(names = "--next",
            description = "Print the next occurrence of each event instead of the events of a single day.")
    boolean next;

    Clock clock = Clock.systemDefaultZone();

    public static void main(String[] args) {
        int execute = new CommandLine(new DaylightCommand()).execute(args);
        if (execute != 0) {
            System.exit(execute);
        }
    }

    @Override
    public void run() {
        Location resolvedLocation;
        List<SolarEvent> events;
        MDC.put("context", "init");
        try {
            resolvedLocation = resolveLocation();
            events = resolveEvents();
            LOG.debug("Location: {}, events: {}", resolvedLocation, events);
        } finally {
            MDC.remove("context");
        }

        SunTimesProvider provider = new SunTimesProviderImpl(resolvedLocation);
        PrintWriter out = spec.commandLine().getOut();
        out.println("Location: " + resolvedLocation);
        if (next) {
            ZonedDateTime now = ZonedDateTime.now(clock.withZone(resolvedLocation.timeZone()));
            out.println("Next after: " + TIME_FORMATTER.format(now));
            events.forEach(e -> out.println(e.getKeyword() + ": " + format(provider.getNext(e, now))));
        } else {
            CalendarDay day = resolveDay(resolvedLocation.timeZone());
            ZonedDateTime midnight = day.atMidnight(resolvedLocation.timeZone());
            out.println("Day: " + day);
            events.forEach(e -> out.println(e.getKeyword() + ": " + format(provider.get(e, midnight))));
        }
        out.flush();
    }

    private Location resolveLocation() {
        Coordinate coordinate;
        if (location != null) {
            coordinate = parseCoordinate();
        } else if (latitude != null && longitude != null) {
            coordinate = createCoordinate();
        } else {
            fail("Either --location or both --lat and --long are required");
            return null;
        }
        return new Location(resolveZone(), coordinate);
    }

    private Coordinate parseCoordinate() {
        try {
            return CoordinateParser.parse(location);
        } catch (InvalidCoordinateException e) {
            fail(e.getMessage());
            return null;
        }
    }

    private Coordinate createCoordinate() {
        if (latitude < -90 || latitude > 90) {
            fail("--lat must be between -90 and 90 degrees");
        }
        if (longitude < -180 || longitude > 180) {
            fail("--long must be between -180 and 180 degrees");
        }
        return Coordinate.of(latitude, longitude);
    }

    private ZoneId resolveZone() {
        if (zone == null || zone.isBlank()) {
            return clock.getZone();
        }
        try {
            return ZoneId.of(zone.trim());
        } catch (DateTimeException e) {
            fail("Invalid --zone '" + zone + "': " + e.getMessage());
            return null;
        }
    }

    private CalendarDay resolveDay(ZoneId zoneId) {
        if (date == null) {
            return CalendarDay.today(clock, zoneId);
        }
        try {
            return CalendarDay.parse(date);
        } catch (InvalidCalendarComponentsException e) {
            fail(e.getMessage());
            return null;
        }
    }

    private List<SolarEvent> resolveEvents() {
        if (event == null) {
            return Arrays.asList(SolarEvent.values());
        }
        try {
            return List.of(SolarEvent.parse(event));
        } catch (IllegalArgumentException e) {
            fail(e.getMessage());
            return null;
        }
    }

    private static String format(SolarEventOutcome outcome) {
        return outcome.fold(TIME_FORMATTER::format, failure -> switch (failure) {
            case NEVER_RISES -> "never (sun stays below)";
            case NEVER_SETS -> "never (sun stays above)";
        });
    }

    private void fail(String msg) {
        LOG.debug("Invalid parameters: {}", msg);
        if (spec != null) {
            throw new CommandLine.ParameterException(spec.commandLine(), msg);
        }
        throw new IllegalArgumentException(msg);
    }
}
