package com.digitalgroup.scheduler.domain.task.trigger;

import com.digitalgroup.scheduler.exception.InvalidTaskException;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Periodic task interval as sent on the wire: {"weeks", "days", "hours", "minutes", "seconds"}.
 */
public record Frequency(long weeks, long days, long hours, long minutes, long seconds) {

    public static final List<String> UNITS = List.of("seconds", "minutes", "hours", "days", "weeks");

    /**
     * Builds a frequency from the request map. Unknown units, non-integral and non-positive values are rejected.
     */
    public static Frequency fromMap(Map<String, Object> values) {
        if (values == null || values.isEmpty()) {
            throw new InvalidTaskException("Field 'frequency' is missing or empty");
        }
        Map<String, Long> parsed = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            String unit = entry.getKey();
            if (!UNITS.contains(unit)) {
                throw new InvalidTaskException("Invalid input " + unit + " in frequency");
            }
            Object raw = entry.getValue();
            if (!(raw instanceof Integer) && !(raw instanceof Long)) {
                throw new InvalidTaskException("Invalid value " + raw + " in frequency");
            }
            long value = ((Number) raw).longValue();
            if (value <= 0) {
                throw new InvalidTaskException("Invalid value " + value + " in frequency");
            }
            parsed.put(unit, value);
        }
        Frequency frequency = new Frequency(
                parsed.getOrDefault("weeks", 0L),
                parsed.getOrDefault("days", 0L),
                parsed.getOrDefault("hours", 0L),
                parsed.getOrDefault("minutes", 0L),
                parsed.getOrDefault("seconds", 0L));
        frequency.toDuration();
        return frequency;
    }

    /**
     * @throws InvalidTaskException when the sum does not fit in a {@link Duration}
     */
    public Duration toDuration() {
        try {
            return Duration.ofDays(Math.addExact(Math.multiplyExact(weeks, 7), days))
                    .plusHours(hours)
                    .plusMinutes(minutes)
                    .plusSeconds(seconds);
        } catch (ArithmeticException e) {
            throw new InvalidTaskException("Invalid frequency " + this + ": value out of range");
        }
    }
}
