package org.example.storyteller.model;

/**
 * Raw transcribed session text plus its estimated token count.
 */
public record Transcript(String text, int estimatedTokens) {
}
