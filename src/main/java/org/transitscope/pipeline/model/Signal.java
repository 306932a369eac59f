package org.transitscope.pipeline.model;

public record Signal(long id, Point position, SignalState state) {
}
