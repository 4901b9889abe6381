package com.example.jobscheduler.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Read-only view of a registered job
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobInfo {

    private String jobId;
    private String description;
    private String trigger;
    private Instant nextFireTime;
    private boolean paused;
    private int runningInstances;
    private int maxInstances;
    private boolean distributed;
}
