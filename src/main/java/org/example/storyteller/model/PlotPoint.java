package org.example.storyteller.model;

public record PlotPoint(int segmentIndex, String text) {
}
