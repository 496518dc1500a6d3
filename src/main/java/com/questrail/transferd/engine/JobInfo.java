package com.questrail.transferd.engine;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Snapshot of one job.
 */
public record JobInfo(String id, String source, JobState state, Map<String, Object> options, Instant added)
{
    public JobInfo {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(state, "state");
        options = options == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(options));
    }

    public JobInfo withState(JobState next) {
        return new JobInfo(id, source, next, options, added);
    }
}
