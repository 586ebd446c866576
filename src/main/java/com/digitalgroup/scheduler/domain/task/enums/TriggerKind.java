package com.digitalgroup.scheduler.domain.task.enums;

import lombok.Getter;

@Getter
public enum TriggerKind {
    ONE_TIME("one_time"),
    PERIODIC("periodic");

    private final String value;

    TriggerKind(String value) {
        this.value = value;
    }

    /**
     * Resolves the wire value ("one_time" / "periodic"), case-insensitive.
     * Returns null for anything else.
     */
    public static TriggerKind fromValue(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase();
        for (TriggerKind kind : TriggerKind.values()) {
            if (kind.value.equals(normalized)) {
                return kind;
            }
        }
        return null;
    }

    public boolean isPeriodic() {
        return this == PERIODIC;
    }
}
