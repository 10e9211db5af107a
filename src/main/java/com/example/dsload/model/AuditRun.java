package com.example.dsload.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditRun implements Serializable {
    private long runId;
    private String jobName;
    private AuditStatus status;
    private Long rowsProcessed;
    private String message;
    private OffsetDateTime startedAt;
    private OffsetDateTime finishedAt;
}
