package com.questrail.transferd.engine;

/**
 * Lifecycle state of a transfer job as reported by the engine.
 */
public enum JobState
{
    QUEUED,
    ACTIVE,
    PAUSED,
    COMPLETED,
    ERROR,
    REMOVED
}
