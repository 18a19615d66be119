package at.sv.daylight;

import lombok.Getter;

/**
 * Exception to signal that the sun does not reach the requested elevation on a given day.
 */
@Getter
public final class SolarEventException extends RuntimeException {

    private final SolarEventFailure failure;

    public SolarEventException(SolarEventFailure failure) {
        super(failure == SolarEventFailure.NEVER_RISES
                ? "The sun never rises to the requested elevation"
                : "The sun never sets below the requested elevation");
        this.failure = failure;
    }
}
