package dev.profileextractor.model;

/**
 * Label assigned to a captured line.
 * Work lines use the first five; education lines use SCHOOL, DEGREE and DATE_RANGE.
 */
public enum LineLabel {
    TITLE,
    COMPANY,
    DATE_RANGE,
    METADATA,
    UNCLASSIFIED,
    SCHOOL,
    DEGREE
}
