package org.example.storyteller.service.extract;

public enum ExtractionCategory {
    CHARACTER,
    LOCATION,
    EVENT
}
