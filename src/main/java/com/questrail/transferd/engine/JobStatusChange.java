package com.questrail.transferd.engine;

import java.time.Instant;

/**
 * A job moved from one state to another.
 *
 * @param previous {@code null} for a newly added job
 */
public record JobStatusChange(String jobId, JobState previous, JobState current, Instant timestamp)
{
}
