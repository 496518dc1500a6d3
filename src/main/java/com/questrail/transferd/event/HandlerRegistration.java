package com.questrail.transferd.event;

import com.questrail.transferd.internal.exec.SerialExecutor;

import java.util.Objects;

/**
 * One in-process handler subscription: the owner tag, the event name it
 * listens for ({@code *} for every event) and the lane its callbacks run on.
 */
public final class HandlerRegistration
{
    private final String owner;
    private final String eventName;
    private final EventHandler handler;
    private final SerialExecutor lane;

    HandlerRegistration(String owner, String eventName, EventHandler handler, SerialExecutor lane) {
        this.owner = Objects.requireNonNull(owner, "owner");
        this.eventName = Objects.requireNonNull(eventName, "eventName");
        this.handler = Objects.requireNonNull(handler, "handler");
        this.lane = lane;
    }

    public String owner() {
        return owner;
    }

    public String eventName() {
        return eventName;
    }

    boolean matches(String name) {
        return eventName.equals(name) || eventName.equals("*");
    }

    EventHandler handler() {
        return handler;
    }

    SerialExecutor lane() {
        return lane;
    }

    @Override
    public String toString() {
        return "HandlerRegistration[owner=" + owner + ", event=" + eventName + "]";
    }
}
