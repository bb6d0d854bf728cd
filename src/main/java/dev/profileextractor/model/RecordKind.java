package dev.profileextractor.model;

public enum RecordKind {
    WORK,
    EDUCATION
}
