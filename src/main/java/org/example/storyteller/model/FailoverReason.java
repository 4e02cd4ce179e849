package org.example.storyteller.model;

public enum FailoverReason {
    UNAVAILABLE,
    QUOTA_EXCEEDED
}
