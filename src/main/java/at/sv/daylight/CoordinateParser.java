package at.sv.daylight;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses geographic coordinates given either in decimal degrees, e.g. {@code 40.642, -74.017}, or in sexagesimal
 * degrees, e.g. {@code 40°38'31"N 74°1'1"W}.
 */
public final class CoordinateParser {

    private static final Pattern DECIMAL_DEGREES = Pattern.compile(
            "(?<latitude>[+-]?\\d+(?:\\.\\d+)?)(?:\\s*[,;]\\s*|\\s+)(?<longitude>[+-]?\\d+(?:\\.\\d+)?)");
    private static final Pattern SEXAGESIMAL_DEGREES = Pattern.compile(
            "(?<latDeg>\\d+)°(?:\\s*(?<latMin>\\d+)')?(?:\\s*(?<latSec>\\d+(?:\\.\\d+)?)\")?\\s*(?<latDir>[NS])" +
            "\\s*,?\\s*" +
            "(?<lonDeg>\\d+)°(?:\\s*(?<lonMin>\\d+)')?(?:\\s*(?<lonSec>\\d+(?:\\.\\d+)?)\")?\\s*(?<lonDir>[EW])",
            Pattern.CASE_INSENSITIVE);

    private CoordinateParser() {
    }

    /**
     * @throws InvalidCoordinateException if the input is in neither format, or lies outside the valid range
     */
    public static Coordinate parse(String input) {
        if (input == null || input.isBlank()) {
            throw new InvalidCoordinateException("Missing coordinate");
        }
        String value = input.trim();
        Matcher decimal = DECIMAL_DEGREES.matcher(value);
        if (decimal.matches()) {
            return Coordinate.of(Double.parseDouble(decimal.group("latitude")),
                    Double.parseDouble(decimal.group("longitude")));
        }
        Matcher sexagesimal = SEXAGESIMAL_DEGREES.matcher(value);
        if (sexagesimal.matches()) {
            double latitude = toDecimal(sexagesimal.group("latDeg"), sexagesimal.group("latMin"),
                    sexagesimal.group("latSec"));
            double longitude = toDecimal(sexagesimal.group("lonDeg"), sexagesimal.group("lonMin"),
                    sexagesimal.group("lonSec"));
            if (sexagesimal.group("latDir").equalsIgnoreCase("S")) {
                latitude = -latitude;
            }
            if (sexagesimal.group("lonDir").equalsIgnoreCase("W")) {
                longitude = -longitude;
            }
            return Coordinate.of(latitude, longitude);
        }
        throw new InvalidCoordinateException("Invalid coordinate '" + input + "'. Use decimal degrees like " +
                                             "'48.20, 16.39' or sexagesimal degrees like '48°12'N 16°23'E'");
    }

    private static double toDecimal(String degrees, String arcMinutes, String arcSeconds) {
        double value = Double.parseDouble(degrees);
        if (arcMinutes != null) {
            value += Double.parseDouble(arcMinutes) / 60.0;
        }
        if (arcSeconds != null) {
            value += Double.parseDouble(arcSeconds) / 3600.0;
        }
        return value;
    }
}
