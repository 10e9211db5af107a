package com.example.dsload.model;

import lombok.Value;

import java.io.Serializable;

@Value
public class LoadStatistics implements Serializable {
    int rowsLoaded;
    int rowsDeduplicated;
    int dateParseErrors;

    public String toAuditMessage() {
        return "deduped=" + rowsDeduplicated + ", date_err=" + dateParseErrors;
    }
}
