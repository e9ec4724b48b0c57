package io.governor.model;

/** A failure source (e.g. a brewer) and the number of pending dead letters attributed to it. */
public record SourceCount(String source, int count) {
}
