package com.yoursp.xerosync.modules.jobs.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobStartResult {

    private String status;
    private String message;
    private String jobId;

    /** True when an active job already existed and was returned unchanged. */
    private boolean alreadyScheduled;

    private String scheduleDescription;
    private OffsetDateTime processedAt;
    private OffsetDateTime nextRun;
}
