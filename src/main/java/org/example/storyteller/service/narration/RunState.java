package org.example.storyteller.service.narration;

/**
 * Lifecycle of one synthesis run. Failover happens inside NARRATING without resetting the segment index.
 */
public enum RunState {
    IDLE,
    SEGMENTING,
    NARRATING,
    SYNTHESIZING,
    COMPLETE,
    FAILED
}
