package com.questrail.transferd.session;

import com.questrail.transferd.protocol.model.DaemonMessage;
import com.questrail.transferd.protocol.model.Event;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * OutboundQueue
 * -----------------------------------------------------------------------------
 * Per-session FIFO of messages waiting for the session writer.
 *
 * <ul>
 *   <li>Responses are always accepted while the queue is open.</li>
 *   <li>Events are bounded: once {@code eventCapacity} events are waiting,
 *       further events are rejected (drop-newest).</li>
 *   <li>A sealed queue accepts nothing new but still drains what it holds.</li>
 *   <li>A discarded queue drops everything.</li>
 * </ul>
 *
 * <p>The queue also tracks whether a writer currently owns it, so that at most
 * one drain runs per session.</p>
 */
final class OutboundQueue
{
    private final int eventCapacity;
    private final Deque<DaemonMessage> messages = new ArrayDeque<>();
    private int queuedEvents;
    private boolean draining;
    private boolean sealed;
    private boolean discarded;

    OutboundQueue(int eventCapacity) {
        if (eventCapacity <= 0) {
            throw new IllegalArgumentException("eventCapacity must be positive");
        }
        this.eventCapacity = eventCapacity;
    }

    synchronized DeliveryResult offer(DaemonMessage message) {
        if (sealed || discarded) {
            return DeliveryResult.SESSION_CLOSED;
        }
        if (message instanceof Event) {
            if (queuedEvents >= eventCapacity) {
                return DeliveryResult.QUEUE_FULL;
            }
            queuedEvents++;
        }
        messages.addLast(message);
        return DeliveryResult.QUEUED;
    }

    /**
     * Claims the writer role if there is work and no writer is active.
     */
    synchronized boolean tryAcquireWriter() {
        if (draining || discarded || messages.isEmpty()) {
            return false;
        }
        draining = true;
        return true;
    }

    /**
     * Next message for the active writer, or {@code null} once empty, in
     * which case the writer role is released.
     */
    synchronized DaemonMessage pollOrRelease() {
        DaemonMessage next = discarded ? null : messages.pollFirst();
        if (next == null) {
            draining = false;
            return null;
        }
        if (next instanceof Event) {
            queuedEvents--;
        }
        return next;
    }

    /**
     * Stop accepting messages.
     *
     * @return {@code true} if nothing is left to write and no writer is active
     */
    synchronized boolean seal() {
        sealed = true;
        return !draining && messages.isEmpty();
    }

    synchronized boolean isSealed() {
        return sealed;
    }

    synchronized void discard() {
        discarded = true;
        messages.clear();
        queuedEvents = 0;
    }

    synchronized int size() {
        return messages.size();
    }

    synchronized int queuedEvents() {
        return queuedEvents;
    }
}
