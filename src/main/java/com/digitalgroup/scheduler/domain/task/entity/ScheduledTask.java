package com.digitalgroup.scheduler.domain.task.entity;

import com.digitalgroup.scheduler.domain.task.enums.TriggerKind;
import com.digitalgroup.scheduler.domain.task.trigger.OneTimeTrigger;
import com.digitalgroup.scheduler.domain.task.trigger.PeriodicTrigger;
import com.digitalgroup.scheduler.domain.task.trigger.TaskTrigger;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Persisted task definition plus its mutable scheduling state.
 *
 * Trigger columns are only written by {@link #create}, so a row carries either the one-time
 * group ({@code run_at}) or the periodic group ({@code interval_seconds, start_at, end_at}), never both.
 */
@Entity
@Table(name = "scheduled_tasks", indexes = {
    @Index(name = "idx_scheduled_tasks_owner_id", columnList = "owner_id"),
    @Index(name = "idx_scheduled_tasks_active_next_fire_at", columnList = "active, next_fire_at")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder(toBuilder = true, access = AccessLevel.PRIVATE)
public class ScheduledTask {

    public static final String DEFAULT_CONTENT_TYPE = "application/json";

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "task_name", unique = true)
    private String taskName;

    /**
     * Null for general tasks created by the system caller.
     */
    @Column(name = "owner_id")
    private Long ownerId;

    @Enumerated(EnumType.STRING)
    @Column(name = "trigger_kind", nullable = false, length = 16)
    private TriggerKind triggerKind;

    @Column(name = "run_at")
    private Instant runAt;

    @Column(name = "interval_seconds")
    private Long intervalSeconds;

    @Column(name = "start_at")
    private Instant startAt;

    @Column(name = "end_at")
    private Instant endAt;

    @Column(name = "target_url", nullable = false, length = 2048)
    private String targetUrl;

    @Column(name = "content_type", nullable = false)
    private String contentType;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "payload")
    private Map<String, Object> payload;

    /**
     * Authorization header value replayed on every dispatch.
     */
    @Column(name = "authorization_header", columnDefinition = "text")
    private String authorization;

    @Column(name = "secret_ref")
    private String secretRef;

    @Setter
    @Column(nullable = false)
    private boolean active;

    @Setter
    @Column(name = "next_fire_at")
    private Instant nextFireAt;

    @Setter
    @Column(name = "last_run_at")
    private Instant lastRunAt;

    @Setter
    @Column(name = "last_run_status")
    private String lastRunStatus;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Version
    private Long version;

    public static ScheduledTask create(Long ownerId,
                                       String taskName,
                                       TaskTrigger trigger,
                                       String targetUrl,
                                       String contentType,
                                       Map<String, Object> payload,
                                       String authorization,
                                       String secretRef,
                                       Instant createdAt) {
        Objects.requireNonNull(trigger, "trigger");
        ScheduledTaskBuilder builder = ScheduledTask.builder()
                .id(UUID.randomUUID().toString())
                .ownerId(ownerId)
                .taskName(taskName)
                .triggerKind(trigger.kind())
                .targetUrl(targetUrl)
                .contentType(contentType != null ? contentType : DEFAULT_CONTENT_TYPE)
                .payload(payload != null ? new HashMap<>(payload) : new HashMap<>())
                .authorization(authorization)
                .secretRef(secretRef)
                .active(true)
                .createdAt(createdAt);

        if (trigger instanceof OneTimeTrigger oneTime) {
            builder.runAt(oneTime.runAt());
        } else if (trigger instanceof PeriodicTrigger periodic) {
            builder.intervalSeconds(periodic.interval().getSeconds())
                    .startAt(periodic.startAt())
                    .endAt(periodic.endAt());
        } else {
            throw new IllegalArgumentException("Unsupported trigger " + trigger.getClass().getName());
        }
        return builder.build();
    }

    public TaskTrigger getTrigger() {
        return switch (triggerKind) {
            case ONE_TIME -> new OneTimeTrigger(runAt);
            case PERIODIC -> new PeriodicTrigger(Duration.ofSeconds(intervalSeconds), startAt, endAt);
        };
    }

    public boolean isOwnedBy(Long userId) {
        return ownerId != null && ownerId.equals(userId);
    }

    public boolean isPaused() {
        return !active;
    }

    /**
     * Detached copy, used by stores that must not share instances with callers.
     */
    public ScheduledTask copy() {
        return toBuilder()
                .payload(payload != null ? new HashMap<>(payload) : null)
                .build();
    }

    public void incrementVersion() {
        this.version = version == null ? 0L : version + 1;
    }
}
