package at.sv.daylight;

import lombok.EqualsAndHashCode;

import java.time.ZonedDateTime;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * The result of a solar event calculation: either the time of the event, or the reason why it does not occur on the
 * requested day.
 */
@EqualsAndHashCode
public final class SolarEventOutcome {

    private final ZonedDateTime time;
    private final SolarEventFailure failure;

    private SolarEventOutcome(ZonedDateTime time, SolarEventFailure failure) {
        this.time = time;
        this.failure = failure;
    }

    public static SolarEventOutcome of(ZonedDateTime time) {
        return new SolarEventOutcome(Objects.requireNonNull(time, "time"), null);
    }

    public static SolarEventOutcome failure(SolarEventFailure failure) {
        return new SolarEventOutcome(null, Objects.requireNonNull(failure, "failure"));
    }

    public boolean isPresent() {
        return time != null;
    }

    public boolean isFailure() {
        return failure != null;
    }

    /**
     * @return the time of the event
     * @throws SolarEventException if the event does not occur on the requested day
     */
    public ZonedDateTime getTime() {
        if (failure != null) {
            throw new SolarEventException(failure);
        }
        return time;
    }

    public Optional<SolarEventFailure> getFailure() {
        return Optional.ofNullable(failure);
    }

    public SolarEventOutcome map(Function<ZonedDateTime, ZonedDateTime> mapper) {
        if (failure != null) {
            return this;
        }
        return of(mapper.apply(time));
    }

    public <T> T fold(Function<ZonedDateTime, T> onTime, Function<SolarEventFailure, T> onFailure) {
        if (failure != null) {
            return onFailure.apply(failure);
        }
        return onTime.apply(time);
    }

    @Override
    public String toString() {
        return failure != null ? failure.toString() : time.toString();
    }
}
