package at.sv.daylight;

import java.util.Locale;

/**
 * The solar events of a day, each defined by the elevation of the sun's center at which it occurs.
 * {@link #SOLAR_NOON} has no elevation threshold, it lies halfway between {@link #SUNRISE} and {@link #SUNSET}.
 */
public enum SolarEvent {
    ASTRONOMICAL_DAWN(-18.0, Phase.RISING),
    NAUTICAL_DAWN(-12.0, Phase.RISING),
    CIVIL_DAWN(-6.0, Phase.RISING),
    SUNRISE(0.0, Phase.RISING),
    SOLAR_NOON(Double.NaN, Phase.NOON),
    SUNSET(0.0, Phase.SETTING),
    CIVIL_DUSK(-6.0, Phase.SETTING),
    NAUTICAL_DUSK(-12.0, Phase.SETTING),
    ASTRONOMICAL_DUSK(-18.0, Phase.SETTING);

    private final double elevation;
    private final Phase phase;

    SolarEvent(double elevation, Phase phase) {
        this.elevation = elevation;
        this.phase = phase;
    }

    /**
     * @return the elevation of the sun in degrees at which this event occurs
     * @throws IllegalStateException for {@link #SOLAR_NOON}, which is not defined by an elevation
     */
    public double getElevation() {
        if (phase == Phase.NOON) {
            throw new IllegalStateException("Solar noon has no elevation threshold");
        }
        return elevation;
    }

    public boolean isRising() {
        return phase == Phase.RISING;
    }

    public boolean isSetting() {
        return phase == Phase.SETTING;
    }

    public boolean isNoon() {
        return phase == Phase.NOON;
    }

    /**
     * @return the lower-case keyword of this event, e.g. {@code civil_dawn}
     */
    public String getKeyword() {
        return name().toLowerCase(Locale.ENGLISH);
    }

    /**
     * Parses a sun keyword. Besides the enum names, the aliases {@code *_start}, {@code *_end} and {@code noon}
     * are accepted.
     *
     * @throws IllegalArgumentException if the keyword is unknown
     */
    public static SolarEvent parse(String keyword) {
        return switch (keyword.trim().toLowerCase(Locale.ENGLISH)) {
            case "astronomical_start", "astronomical_dawn" -> ASTRONOMICAL_DAWN;
            case "nautical_start", "nautical_dawn" -> NAUTICAL_DAWN;
            case "civil_start", "civil_dawn" -> CIVIL_DAWN;
            case "sunrise" -> SUNRISE;
            case "noon", "solar_noon" -> SOLAR_NOON;
            case "sunset" -> SUNSET;
            case "civil_end", "civil_dusk" -> CIVIL_DUSK;
            case "nautical_end", "nautical_dusk" -> NAUTICAL_DUSK;
            case "astronomical_end", "astronomical_dusk" -> ASTRONOMICAL_DUSK;
            default -> throw new IllegalArgumentException("Invalid sun keyword: '" + keyword + "'");
        };
    }

    private enum Phase {
        RISING,
        NOON,
        SETTING
    }
}
