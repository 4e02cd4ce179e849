package org.example.storyteller.model;

public record Boundary(int offset, BoundaryKind kind, int priority) {

    public static Boundary of(int offset, BoundaryKind kind) {
        return new Boundary(offset, kind, kind.priority());
    }
}
