package com.digitalgroup.scheduler.job;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-id outcome of a batch operation. Every requested id lands in exactly one list.
 */
public record BatchResult(List<String> succeeded,
                          List<String> notFound,
                          List<String> forbidden,
                          List<String> conflict) {

    public static BatchResult empty() {
        return new BatchResult(new ArrayList<>(), new ArrayList<>(), new ArrayList<>(), new ArrayList<>());
    }

    public boolean isComplete() {
        return notFound.isEmpty() && forbidden.isEmpty() && conflict.isEmpty();
    }
}
