package com.digitalgroup.scheduler.api.v1.dto.task;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Body of {@code POST /tasks}. Field presence is checked per task type by the task service.
 */
public record CreateTaskRequest(
        @JsonProperty("task_type") String taskType,
        @JsonProperty("task_name") String taskName,
        @JsonProperty("url") String url,
        @JsonProperty("content_type") String contentType,
        @JsonProperty("post_data") Map<String, Object> postData,
        @JsonProperty("run_datetime") String runDatetime,
        @JsonProperty("start_datetime") String startDatetime,
        @JsonProperty("end_datetime") String endDatetime,
        @JsonProperty("frequency") Map<String, Object> frequency
) {
}
