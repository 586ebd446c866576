package com.digitalgroup.scheduler.api.v1.dto.task;

import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public record TaskIdsRequest(@NotEmpty List<String> ids) {
}
