package com.example.dsload.model;

import lombok.Builder;
import lombok.Value;

import java.io.Serializable;

@Value
@Builder
public class FileLoadResult implements Serializable {
    String fileName;
    Long runId;
    boolean success;
    LoadStatistics statistics;
    String errorMessage;
}
