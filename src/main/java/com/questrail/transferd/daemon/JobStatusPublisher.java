package com.questrail.transferd.daemon;

import com.questrail.transferd.component.Component;
import com.questrail.transferd.engine.JobEngine;
import com.questrail.transferd.engine.JobStatusChange;
import com.questrail.transferd.event.EventManager;
import com.questrail.transferd.protocol.model.Event;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Republishes engine status changes as {@code job.status} events while
 * started.
 */
public final class JobStatusPublisher implements Component
{
    public static final String COMPONENT_NAME = "JobStatusPublisher";
    public static final String EVENT_NAME = "job.status";

    private final EventManager events;
    private volatile boolean started;

    public JobStatusPublisher(JobEngine engine, EventManager events) {
        this.events = Objects.requireNonNull(events, "events");
        Objects.requireNonNull(engine, "engine").onStatusChange(this::onStatusChange);
    }

    @Override
    public String name() {
        return COMPONENT_NAME;
    }

    @Override
    public Set<String> dependencies() {
        return Set.of(EventManager.COMPONENT_NAME);
    }

    @Override
    public void start() {
        started = true;
    }

    @Override
    public void stop() {
        started = false;
    }

    void onStatusChange(JobStatusChange change) {
        if (!started) {
            return;
        }
        Map<String, Object> value = new LinkedHashMap<>();
        value.put("job_id", change.jobId());
        value.put("previous", change.previous() == null ? null : change.previous().name());
        value.put("state", change.current().name());
        events.publish(new Event(EVENT_NAME, value, change.timestamp() == null ? Instant.now() : change.timestamp()));
    }
}
