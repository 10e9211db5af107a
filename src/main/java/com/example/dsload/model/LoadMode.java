package com.example.dsload.model;

public enum LoadMode {
    MERGE,
    REPLACE
}
