package at.sv.daylight.astro;

import at.sv.daylight.SolarEventException;
import at.sv.daylight.SolarEventFailure;

/**
 * Solves the hour angle at which the sun crosses a given elevation.
 */
public final class HourAngleSolver {

    /**
     * Refraction and the radius of the sun's disk lift the apparent sun at the horizon by this many degrees.
     */
    public static final double HORIZON_REFRACTION = 0.833;

    private HourAngleSolver() {
    }

    /**
     * Atmospheric refraction is only modeled at the true horizon. For any other elevation the correction just cancels
     * the requested elevation.
     */
    public static double refractiveCorrection(double elevation) {
        if (elevation == 0.0) {
            return HORIZON_REFRACTION;
        }
        return -elevation;
    }

    /**
     * @return the cosine of the hour angle. Values outside [-1, 1] mean the sun does not cross the elevation that day.
     */
    public static double cosineOfHourAngle(double latitude, double declination, double elevation) {
        double latRad = Math.toRadians(latitude);
        double decRad = Math.toRadians(declination);
        double zenith = Math.toRadians(90.0 + refractiveCorrection(elevation));
        return Math.cos(zenith) / (Math.cos(latRad) * Math.cos(decRad)) - Math.tan(latRad) * Math.tan(decRad);
    }

    /**
     * @param latitude    the latitude of the observer in degrees
     * @param declination the declination of the sun in degrees
     * @param elevation   the requested elevation of the sun in degrees
     * @return the hour angle of the rising sun in radians, always positive
     * @throws SolarEventException if the sun stays below ({@link SolarEventFailure#NEVER_RISES}) or above
     *                             ({@link SolarEventFailure#NEVER_SETS}) the elevation for the whole day
     */
    public static double sunriseHourAngle(double latitude, double declination, double elevation) {
        double cosine = cosineOfHourAngle(latitude, declination, elevation);
        if (Double.isNaN(cosine)) {
            throw new IllegalArgumentException("Hour angle undefined for latitude " + latitude +
                                               ", declination " + declination + ", elevation " + elevation);
        }
        if (cosine > 1.0) {
            throw new SolarEventException(SolarEventFailure.NEVER_RISES);
        }
        if (cosine < -1.0) {
            throw new SolarEventException(SolarEventFailure.NEVER_SETS);
        }
        return Math.acos(cosine);
    }

    /**
     * @return the hour angle of the setting sun in radians, the negation of {@link #sunriseHourAngle}
     */
    public static double sunsetHourAngle(double latitude, double declination, double elevation) {
        return -sunriseHourAngle(latitude, declination, elevation);
    }

    public static double hourAngle(double latitude, double declination, double elevation, boolean rising) {
        if (rising) {
            return sunriseHourAngle(latitude, declination, elevation);
        }
        return sunsetHourAngle(latitude, declination, elevation);
    }
}
