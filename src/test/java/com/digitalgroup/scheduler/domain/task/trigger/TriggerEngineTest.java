package com.digitalgroup.scheduler.domain.task.trigger;

import com.digitalgroup.scheduler.exception.InvalidTaskException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class TriggerEngineTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    private TriggerEngine triggerEngine;

    @BeforeEach
    void setUp() {
        triggerEngine = new TriggerEngine(Duration.ofSeconds(5), Duration.ofMinutes(1));
    }

    @Test
    void periodic_HourlyWindow_FiresOnGridUntilEnd() {
        Instant start = NOW.plusSeconds(10);
        Instant end = NOW.plus(Duration.ofHours(3)).plus(Duration.ofMinutes(5));
        PeriodicTrigger trigger = new PeriodicTrigger(Duration.ofHours(1), start, end);

        triggerEngine.validate(trigger, NOW);

        List<Instant> fires = new ArrayList<>();
        Optional<Instant> next = triggerEngine.computeFirstFire(trigger, NOW);
        while (next.isPresent()) {
            fires.add(next.get());
            next = triggerEngine.computeNextFire(trigger, next.get());
        }

        assertEquals(List.of(start, start.plus(Duration.ofHours(1)), start.plus(Duration.ofHours(2)),
                start.plus(Duration.ofHours(3))), fires);
        assertTrue(fires.stream().noneMatch(fire -> fire.isAfter(end)));
        assertTrue(start.plus(Duration.ofHours(4)).isAfter(end));
    }

    @Test
    void computeFirstFire_StartInPast_ReturnsNextGridPointNotBeforeNow() {
        Instant start = NOW.minus(Duration.ofMinutes(25));
        PeriodicTrigger trigger = new PeriodicTrigger(Duration.ofMinutes(10), start, NOW.plus(Duration.ofHours(1)));

        assertEquals(Optional.of(NOW.plus(Duration.ofMinutes(5))), triggerEngine.computeFirstFire(trigger, NOW));
    }

    @Test
    void computeFirstFire_NowOnGridPoint_ReturnsNow() {
        Instant start = NOW.minus(Duration.ofMinutes(20));
        PeriodicTrigger trigger = new PeriodicTrigger(Duration.ofMinutes(10), start, NOW.plus(Duration.ofHours(1)));

        assertEquals(Optional.of(NOW), triggerEngine.computeFirstFire(trigger, NOW));
    }

    @Test
    void computeFirstFire_PastEndOfWindow_ReturnsEmpty() {
        PeriodicTrigger trigger = new PeriodicTrigger(Duration.ofMinutes(10),
                NOW.minus(Duration.ofHours(2)), NOW.minus(Duration.ofMinutes(1)));

        assertTrue(triggerEngine.computeFirstFire(trigger, NOW).isEmpty());
    }

    @Test
    void computeFirstFire_OverdueOneTime_ReturnsFloor() {
        OneTimeTrigger trigger = new OneTimeTrigger(NOW.minusSeconds(30));

        assertEquals(Optional.of(NOW), triggerEngine.computeFirstFire(trigger, NOW));
    }

    @Test
    void computeNextFire_OneTime_IsExhausted() {
        OneTimeTrigger trigger = new OneTimeTrigger(NOW.plusSeconds(60));

        assertTrue(triggerEngine.computeNextFire(trigger, NOW.plusSeconds(60)).isEmpty());
    }

    @Test
    void validate_OneTimeInPast_ThrowsException() {
        OneTimeTrigger trigger = new OneTimeTrigger(NOW.minusSeconds(1));

        assertThrows(InvalidTaskException.class, () -> triggerEngine.validate(trigger, NOW));
    }

    @Test
    void validate_OneTimeWithinLeadTime_ThrowsException() {
        OneTimeTrigger trigger = new OneTimeTrigger(NOW.plusSeconds(3));

        assertThrows(InvalidTaskException.class, () -> triggerEngine.validate(trigger, NOW));
    }

    @Test
    void validate_WindowShorterThanInterval_ThrowsException() {
        PeriodicTrigger trigger = new PeriodicTrigger(Duration.ofHours(2),
                NOW.plusSeconds(60), NOW.plus(Duration.ofHours(1)));

        InvalidTaskException ex = assertThrows(InvalidTaskException.class,
                () -> triggerEngine.validate(trigger, NOW));
        assertTrue(ex.getMessage().contains("Frequency is greater"));
    }

    @Test
    void validate_ZeroInterval_ThrowsException() {
        PeriodicTrigger trigger = new PeriodicTrigger(Duration.ZERO, NOW, NOW.plus(Duration.ofHours(1)));

        assertThrows(InvalidTaskException.class, () -> triggerEngine.validate(trigger, NOW));
    }

    @Test
    void validate_IntervalBelowMinimum_ThrowsException() {
        PeriodicTrigger trigger = new PeriodicTrigger(Duration.ofSeconds(30), NOW, NOW.plus(Duration.ofHours(1)));

        assertThrows(InvalidTaskException.class, () -> triggerEngine.validate(trigger, NOW));
    }

    @Test
    void validate_EndBeforeStart_ThrowsException() {
        PeriodicTrigger trigger = new PeriodicTrigger(Duration.ofMinutes(1),
                NOW.plus(Duration.ofHours(2)), NOW.plus(Duration.ofHours(1)));

        assertThrows(InvalidTaskException.class, () -> triggerEngine.validate(trigger, NOW));
    }

    @Test
    void validate_EndAlreadyPassed_ThrowsException() {
        PeriodicTrigger trigger = new PeriodicTrigger(Duration.ofMinutes(1),
                NOW.minus(Duration.ofHours(2)), NOW.minusSeconds(1));

        assertThrows(InvalidTaskException.class, () -> triggerEngine.validate(trigger, NOW));
    }

    @Test
    void validate_StartInPastEndInFuture_Accepted() {
        PeriodicTrigger trigger = new PeriodicTrigger(Duration.ofMinutes(10),
                NOW.minus(Duration.ofHours(1)), NOW.plus(Duration.ofHours(1)));

        assertDoesNotThrow(() -> triggerEngine.validate(trigger, NOW));
    }
}
