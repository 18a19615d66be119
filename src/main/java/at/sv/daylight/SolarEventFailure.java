package at.sv.daylight;

/**
 * The reasons why a solar event does not occur on a given day.
 */
public enum SolarEventFailure {
    /**
     * The sun stays below the requested elevation for the whole day (polar night).
     */
    NEVER_RISES,
    /**
     * The sun stays above the requested elevation for the whole day (polar day).
     */
    NEVER_SETS
}
