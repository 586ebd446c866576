package com.digitalgroup.scheduler.domain.task.trigger;

import com.digitalgroup.scheduler.exception.InvalidTaskException;
import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Fire time computation and trigger validation. Stateless apart from its configuration.
 *
 * An empty {@link Optional} means the trigger is exhausted: no further valid fire time exists.
 */
@Getter
@Component
public class TriggerEngine {

    private final Duration minLeadTime;
    private final Duration minInterval;

    public TriggerEngine(@Value("${scheduler.min-lead-time:PT5S}") Duration minLeadTime,
                         @Value("${scheduler.min-interval:PT1M}") Duration minInterval) {
        this.minLeadTime = minLeadTime;
        this.minInterval = minInterval;
    }

    /**
     * Rejects trigger definitions that could never fire correctly.
     *
     * @param now creation time used for the "in the future" checks
     * @throws InvalidTaskException describing the first violated rule
     */
    public void validate(TaskTrigger trigger, Instant now) {
        if (trigger instanceof OneTimeTrigger oneTime) {
            if (!oneTime.runAt().isAfter(now.plus(minLeadTime))) {
                throw new InvalidTaskException("run_datetime " + oneTime.runAt()
                        + " has already passed or is less than " + minLeadTime.getSeconds() + "s from now");
            }
            return;
        }
        if (!(trigger instanceof PeriodicTrigger periodic)) {
            throw new InvalidTaskException("Task type not correct. Please use periodic or one_time as task type.");
        }

        Duration interval = periodic.interval();
        if (interval.isZero() || interval.isNegative()) {
            throw new InvalidTaskException("Frequency must be a positive duration");
        }
        if (interval.compareTo(minInterval) < 0) {
            throw new InvalidTaskException("Frequency " + interval.getSeconds()
                    + "s is below the minimum of " + minInterval.getSeconds() + "s");
        }
        if (!periodic.endAt().isAfter(periodic.startAt())) {
            throw new InvalidTaskException("end_datetime must be after start_datetime");
        }
        if (Duration.between(periodic.startAt(), periodic.endAt()).compareTo(interval) < 0) {
            throw new InvalidTaskException("Frequency is greater than the interval between start_datetime and end_datetime");
        }
        if (!periodic.endAt().isAfter(now)) {
            throw new InvalidTaskException("end_datetime " + periodic.endAt() + " has already passed");
        }
        if (computeFirstFire(periodic, now).isEmpty()) {
            throw new InvalidTaskException("No fire time left between now and end_datetime " + periodic.endAt());
        }
    }

    /**
     * First fire time at or after {@code floor}.
     *
     * One-time: {@code runAt}, or {@code floor} when {@code runAt} already passed (overdue tasks fire once
     * immediately). Periodic: the smallest {@code startAt + n * interval >= floor}, empty if beyond {@code endAt}.
     */
    public Optional<Instant> computeFirstFire(TaskTrigger trigger, Instant floor) {
        if (trigger instanceof OneTimeTrigger oneTime) {
            Instant runAt = oneTime.runAt();
            return Optional.of(runAt.isBefore(floor) ? floor : runAt);
        }
        PeriodicTrigger periodic = (PeriodicTrigger) trigger;
        Instant start = periodic.startAt();
        Instant candidate = start;
        if (start.isBefore(floor)) {
            Duration interval = periodic.interval();
            long steps = Duration.between(start, floor).dividedBy(interval);
            candidate = start.plus(interval.multipliedBy(steps));
            if (candidate.isBefore(floor)) {
                candidate = candidate.plus(interval);
            }
        }
        return candidate.isAfter(periodic.endAt()) ? Optional.empty() : Optional.of(candidate);
    }

    /**
     * Fire time following {@code lastFiredAt}. One-time triggers are always exhausted after their firing.
     */
    public Optional<Instant> computeNextFire(TaskTrigger trigger, Instant lastFiredAt) {
        if (trigger instanceof OneTimeTrigger) {
            return Optional.empty();
        }
        PeriodicTrigger periodic = (PeriodicTrigger) trigger;
        Instant next = lastFiredAt.plus(periodic.interval());
        return next.isAfter(periodic.endAt()) ? Optional.empty() : Optional.of(next);
    }
}
