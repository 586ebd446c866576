package com.digitalgroup.scheduler.domain.task.trigger;

import com.digitalgroup.scheduler.exception.InvalidTaskException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FrequencyTest {

    @Test
    void fromMap_MixedUnits_SumsToDuration() {
        Frequency frequency = Frequency.fromMap(Map.of("weeks", 1, "days", 2, "hours", 3, "minutes", 4, "seconds", 5));

        assertEquals(Duration.ofDays(9).plusHours(3).plusMinutes(4).plusSeconds(5), frequency.toDuration());
    }

    @Test
    void fromMap_UnknownUnit_ThrowsException() {
        assertThrows(InvalidTaskException.class, () -> Frequency.fromMap(Map.of("months", 1)));
    }

    @Test
    void fromMap_NonPositiveValue_ThrowsException() {
        assertThrows(InvalidTaskException.class, () -> Frequency.fromMap(Map.of("hours", 0)));
        assertThrows(InvalidTaskException.class, () -> Frequency.fromMap(Map.of("hours", -2)));
    }

    @Test
    void fromMap_NonIntegerValue_ThrowsException() {
        assertThrows(InvalidTaskException.class, () -> Frequency.fromMap(Map.of("hours", "1")));
        assertThrows(InvalidTaskException.class, () -> Frequency.fromMap(Map.of("hours", 1.5)));
    }

    @Test
    void fromMap_Empty_ThrowsException() {
        assertThrows(InvalidTaskException.class, () -> Frequency.fromMap(Map.of()));
    }

    @Test
    void fromMap_ValueOverflowsDuration_ThrowsException() {
        assertThrows(InvalidTaskException.class, () -> Frequency.fromMap(Map.of("weeks", 1_000_000_000_000_000L)));
        assertThrows(InvalidTaskException.class, () -> Frequency.fromMap(Map.of("seconds", Long.MAX_VALUE, "days", 1)));
    }
}
