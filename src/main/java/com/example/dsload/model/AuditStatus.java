package com.example.dsload.model;

public enum AuditStatus {
    START,
    END,
    ERROR
}
