package org.example.storyteller.model;

public enum FailureReason {
    SEGMENTATION_ERROR,
    ALL_BACKENDS_EXHAUSTED,
    CANCELLED
}
