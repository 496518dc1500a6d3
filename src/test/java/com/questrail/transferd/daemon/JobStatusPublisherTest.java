package com.questrail.transferd.daemon;

import com.questrail.transferd.api.AuthLevel;
import com.questrail.transferd.engine.JobState;
import com.questrail.transferd.engine.RecordingJobEngine;
import com.questrail.transferd.event.EventManager;
import com.questrail.transferd.protocol.model.Event;
import com.questrail.transferd.session.Session;
import com.questrail.transferd.session.TestSessions;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JobStatusPublisherTest
{
    private final TestSessions fixture = new TestSessions();
    private final EventManager events = new EventManager(Runnable::run, fixture.sink);
    private final RecordingJobEngine engine = new RecordingJobEngine();
    private final JobStatusPublisher publisher = new JobStatusPublisher(engine, events);

    @Test
    void statusChangesBecomeJobStatusEvents()
    {
        Session session = fixture.loggedIn("c1", AuthLevel.READ_ONLY);
        events.subscribe(session, List.of(JobStatusPublisher.EVENT_NAME));
        publisher.start();

        engine.emit("job-1", JobState.QUEUED, JobState.ACTIVE);

        List<Event> received = fixture.sentEvents(session);
        assertEquals(1, received.size());
        assertEquals("job.status", received.get(0).name());
        assertEquals(Map.of("job_id", "job-1", "previous", "QUEUED", "state", "ACTIVE"), received.get(0).value());
    }

    @Test
    void nothingIsPublishedWhileStopped()
    {
        Session session = fixture.loggedIn("c1", AuthLevel.READ_ONLY);
        events.subscribe(session, List.of("*"));

        engine.emit("job-1", null, JobState.QUEUED);
        publisher.start();
        publisher.stop();
        engine.emit("job-1", JobState.QUEUED, JobState.PAUSED);

        assertTrue(fixture.sentEvents(session).isEmpty());
    }
}
