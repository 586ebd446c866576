package com.digitalgroup.scheduler.api.v1;

import com.digitalgroup.scheduler.job.SchedulerCore;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequiredArgsConstructor
public class HealthController {

    private final SchedulerCore schedulerCore;

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of(
                "status", "ok",
                "scheduler_running", schedulerCore.isRunning()
        ));
    }
}
