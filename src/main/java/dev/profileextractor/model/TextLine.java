package dev.profileextractor.model;

/**
 * One cleaned line of captured text and its position in the cleaned sequence.
 */
public record TextLine(String content, int index) {
}
