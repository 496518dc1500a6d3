package com.questrail.transferd.component;

/**
 * Lifecycle state of a registered {@link Component}.
 */
public enum ComponentState
{
    STOPPED,
    STARTED
}
