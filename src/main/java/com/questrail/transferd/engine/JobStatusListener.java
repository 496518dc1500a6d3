package com.questrail.transferd.engine;

@FunctionalInterface
public interface JobStatusListener
{
    void onStatusChange(JobStatusChange change);
}
