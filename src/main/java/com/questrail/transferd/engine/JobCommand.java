package com.questrail.transferd.engine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Commands accepted by a {@link JobEngine}.
 */
public sealed interface JobCommand
        permits JobCommand.Add, JobCommand.Remove, JobCommand.Pause, JobCommand.Resume,
                JobCommand.Status, JobCommand.ListAll
{
    /** Add a job for {@code source}; result is the new {@link JobInfo}. */
    record Add(String source, Map<String, Object> options) implements JobCommand {
        public Add {
            Objects.requireNonNull(source, "source");
            options = options == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(options));
        }
    }

    /** Remove a job; result is {@code true}. */
    record Remove(String jobId, boolean removeData) implements JobCommand {
        public Remove {
            Objects.requireNonNull(jobId, "jobId");
        }
    }

    record Pause(String jobId) implements JobCommand {
        public Pause {
            Objects.requireNonNull(jobId, "jobId");
        }
    }

    record Resume(String jobId) implements JobCommand {
        public Resume {
            Objects.requireNonNull(jobId, "jobId");
        }
    }

    record Status(String jobId) implements JobCommand {
        public Status {
            Objects.requireNonNull(jobId, "jobId");
        }
    }

    /** Result is a list of {@link JobInfo} ordered by id. */
    record ListAll() implements JobCommand {
    }
}
