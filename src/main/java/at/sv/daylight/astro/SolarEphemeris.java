package at.sv.daylight.astro;

import static at.sv.daylight.astro.DegreeMath.cosDeg;
import static at.sv.daylight.astro.DegreeMath.sinDeg;
import static at.sv.daylight.astro.DegreeMath.tanDeg;

/**
 * Low precision position of the sun after the NOAA solar calculator, which is based on "Astronomical Algorithms" by
 * Jean Meeus. All functions take the time in Julian Centuries since J2000.0 and return degrees, unless stated
 * otherwise.
 */
public final class SolarEphemeris {

    private SolarEphemeris() {
    }

    /**
     * @return the geometric mean longitude of the sun, in the range [0, 360]
     */
    public static double geometricMeanLongitude(double t) {
        double longitude = 280.46646 + t * (36000.76983 + 0.0003032 * t);
        while (longitude > 360.0) {
            longitude -= 360.0;
        }
        while (longitude < 0.0) {
            longitude += 360.0;
        }
        return longitude;
    }

    public static double meanAnomaly(double t) {
        return 357.52911 + t * (35999.05029 - 0.0001537 * t);
    }

    /**
     * @return the eccentricity of earth's orbit (unitless)
     */
    public static double eccentricity(double t) {
        return 0.016708634 - t * (0.000042037 + 0.0000001267 * t);
    }

    public static double meanObliquity(double t) {
        double seconds = 21.448 - t * (46.8150 + t * (0.00059 - t * 0.001813));
        return 23.0 + (26.0 + seconds / 60.0) / 60.0;
    }

    public static double obliquityCorrection(double t) {
        return meanObliquity(t) + 0.00256 * cosDeg(ascendingNodeLongitude(t));
    }

    public static double equationOfCenter(double t) {
        double m = meanAnomaly(t);
        return sinDeg(m) * (1.914602 - t * (0.004817 + 0.000014 * t))
               + sinDeg(2.0 * m) * (0.019993 - 0.000101 * t)
               + sinDeg(3.0 * m) * 0.000289;
    }

    public static double trueLongitude(double t) {
        return geometricMeanLongitude(t) + equationOfCenter(t);
    }

    public static double apparentLongitude(double t) {
        return trueLongitude(t) - 0.00569 - 0.00478 * sinDeg(ascendingNodeLongitude(t));
    }

    public static double declination(double t) {
        double sine = sinDeg(obliquityCorrection(t)) * sinDeg(apparentLongitude(t));
        return Math.toDegrees(Math.asin(sine));
    }

    /**
     * @return the difference between true solar time and mean solar time, in minutes of time
     */
    public static double equationOfTime(double t) {
        double epsilon = obliquityCorrection(t);
        double l0 = geometricMeanLongitude(t);
        double e = eccentricity(t);
        double m = meanAnomaly(t);

        double y = tanDeg(epsilon / 2.0);
        y *= y;

        double sin2l0 = sinDeg(2.0 * l0);
        double sinm = sinDeg(m);
        double cos2l0 = cosDeg(2.0 * l0);
        double sin4l0 = sinDeg(4.0 * l0);
        double sin2m = sinDeg(2.0 * m);

        double eTime = y * sin2l0
                       - 2.0 * e * sinm
                       + 4.0 * e * y * sinm * cos2l0
                       - 0.5 * y * y * sin4l0
                       - 1.25 * e * e * sin2m;

        // radians of hour angle to minutes of time
        return Math.toDegrees(eTime * 4.0);
    }

    // longitude of the moon's ascending node, used for nutation and aberration
    private static double ascendingNodeLongitude(double t) {
        return 125.04 - 1934.136 * t;
    }
}
