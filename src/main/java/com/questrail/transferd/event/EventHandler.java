package com.questrail.transferd.event;

import com.questrail.transferd.protocol.model.Event;

/**
 * In-process consumer of published events, registered by plugins and daemon
 * components. Invoked asynchronously on the handler's own lane.
 */
@FunctionalInterface
public interface EventHandler
{
    void onEvent(Event event) throws Exception;
}
