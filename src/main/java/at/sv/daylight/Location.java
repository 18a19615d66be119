package at.sv.daylight;

import lombok.Builder;

import java.time.ZoneId;
import java.util.Objects;

/**
 * The place for which solar events are calculated: a coordinate on earth, and the time zone in which the resulting
 * times are expressed and the calendar day is determined.
 */
@Builder(toBuilder = true)
public record Location(ZoneId timeZone, Coordinate coordinate) {

    public Location {
        Objects.requireNonNull(timeZone, "timeZone");
        Objects.requireNonNull(coordinate, "coordinate");
    }

    public static Location of(ZoneId timeZone, double latitude, double longitude) {
        return new Location(timeZone, Coordinate.of(latitude, longitude));
    }

    public double latitude() {
        return coordinate.latitude();
    }

    public double longitude() {
        return coordinate.longitude();
    }

    @Override
    public String toString() {
        return coordinate + " " + timeZone.getId();
    }
}
