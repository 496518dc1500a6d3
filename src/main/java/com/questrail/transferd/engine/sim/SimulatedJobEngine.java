package com.questrail.transferd.engine.sim;

import com.questrail.transferd.engine.JobCommand;
import com.questrail.transferd.engine.JobEngine;
import com.questrail.transferd.engine.JobEngineException;
import com.questrail.transferd.engine.JobInfo;
import com.questrail.transferd.engine.JobState;
import com.questrail.transferd.engine.JobStatusChange;
import com.questrail.transferd.engine.JobStatusListener;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * SimulatedJobEngine
 * =============================================================================
 * In-memory engine that tracks job state without moving any data.
 *
 * <p>Jobs are numbered {@code job-1}, {@code job-2}, ... in the order added.
 * Adding a job whose source is already tracked is rejected. Every state
 * change, including add and remove, is reported to the listeners after the
 * engine lock is released.</p>
 */
public final class SimulatedJobEngine implements JobEngine
{
    private static final Logger log = LoggerFactory.getLogger(SimulatedJobEngine.class);

    private final Clock clock;
    private final Map<String, JobInfo> jobs = new LinkedHashMap<>();
    private final List<JobStatusListener> listeners = new CopyOnWriteArrayList<>();
    private long nextId = 1;

    public SimulatedJobEngine() {
        this(Clock.systemUTC());
    }

    public SimulatedJobEngine(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public void onStatusChange(JobStatusListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    @Override
    public Object execute(JobCommand command) throws JobEngineException {
        Objects.requireNonNull(command, "command");
        if (command instanceof JobCommand.Add add) {
            return add(add);
        } else if (command instanceof JobCommand.Remove remove) {
            return remove(remove.jobId());
        } else if (command instanceof JobCommand.Pause pause) {
            return move(pause.jobId(), JobState.PAUSED);
        } else if (command instanceof JobCommand.Resume resume) {
            return move(resume.jobId(), JobState.QUEUED);
        } else if (command instanceof JobCommand.Status status) {
            return find(status.jobId());
        } else {
            return listAll();
        }
    }

    private JobInfo add(JobCommand.Add add) throws JobEngineException {
        if (add.source().isBlank()) {
            throw new JobEngineException("Job source must not be empty");
        }
        JobInfo job;
        synchronized (this) {
            for (JobInfo existing : jobs.values()) {
                if (existing.source().equals(add.source())) {
                    throw new JobEngineException("A job for " + add.source() + " already exists: " + existing.id());
                }
            }
            job = new JobInfo("job-" + nextId++, add.source(), JobState.QUEUED, add.options(), clock.instant());
            jobs.put(job.id(), job);
        }
        log.debug("Added {} for {}", job.id(), job.source());
        fire(new JobStatusChange(job.id(), null, JobState.QUEUED, clock.instant()));
        return job;
    }

    private Boolean remove(String jobId) throws JobEngineException {
        JobInfo removed;
        synchronized (this) {
            removed = jobs.remove(jobId);
        }
        if (removed == null) {
            throw new JobEngineException("No such job: " + jobId);
        }
        log.debug("Removed {}", jobId);
        fire(new JobStatusChange(jobId, removed.state(), JobState.REMOVED, clock.instant()));
        return Boolean.TRUE;
    }

    private JobInfo move(String jobId, JobState next) throws JobEngineException {
        JobInfo before;
        JobInfo after;
        synchronized (this) {
            before = jobs.get(jobId);
            if (before == null) {
                throw new JobEngineException("No such job: " + jobId);
            }
            after = before.withState(next);
            jobs.put(jobId, after);
        }
        if (before.state() != next) {
            fire(new JobStatusChange(jobId, before.state(), next, clock.instant()));
        }
        return after;
    }

    private synchronized JobInfo find(String jobId) throws JobEngineException {
        JobInfo job = jobs.get(jobId);
        if (job == null) {
            throw new JobEngineException("No such job: " + jobId);
        }
        return job;
    }

    private synchronized List<JobInfo> listAll() {
        List<JobInfo> all = new ArrayList<>(jobs.values());
        all.sort(Comparator.comparingLong(j -> Long.parseLong(j.id().substring("job-".length()))));
        return all;
    }

    private void fire(JobStatusChange change) {
        for (JobStatusListener listener : listeners) {
            try {
                listener.onStatusChange(change);
            } catch (RuntimeException e) {
                log.warn("Job status listener failed for {}", change.jobId(), e);
            }
        }
    }
}
