package com.example.dsload.model;

import lombok.Value;

import java.util.List;

@Value
public class NormalizationReport {
    int dateParseErrors;
    List<String> flagColumns;
}
