package at.sv.daylight.astro;

/**
 * Trigonometric functions taking their argument in degrees.
 */
final class DegreeMath {

    private DegreeMath() {
    }

    static double sinDeg(double degrees) {
        return Math.sin(Math.toRadians(degrees));
    }

    static double cosDeg(double degrees) {
        return Math.cos(Math.toRadians(degrees));
    }

    static double tanDeg(double degrees) {
        return Math.tan(Math.toRadians(degrees));
    }
}
