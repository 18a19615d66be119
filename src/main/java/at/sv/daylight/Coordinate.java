package at.sv.daylight;

/**
 * A geographic coordinate in decimal degrees. Latitudes are positive to the north, longitudes positive to the east.
 */
public record Coordinate(double latitude, double longitude) {

    public Coordinate {
        if (Double.isNaN(latitude) || latitude < -90.0 || latitude > 90.0) {
            throw new InvalidCoordinateException("Latitude must be between -90 and 90 degrees: " + latitude);
        }
        if (Double.isNaN(longitude) || longitude < -180.0 || longitude > 180.0) {
            throw new InvalidCoordinateException("Longitude must be between -180 and 180 degrees: " + longitude);
        }
    }

    public static Coordinate of(double latitude, double longitude) {
        return new Coordinate(latitude, longitude);
    }

    @Override
    public String toString() {
        return "[" + latitude + "," + longitude + ']';
    }
}
