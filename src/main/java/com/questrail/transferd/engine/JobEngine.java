package com.questrail.transferd.engine;

/**
 * JobEngine
 * -----------------------------------------------------------------------------
 * Port to the component that actually performs transfers.
 *
 * <p>The daemon never inspects engine internals: it submits
 * {@link JobCommand}s and listens for status changes. Implementations must be
 * safe to call from many dispatch threads at once and may invoke listeners
 * from any thread.</p>
 */
public interface JobEngine
{
    /**
     * @return a wire-representable result, as documented on each command
     * @throws JobEngineException if the command is rejected or fails
     */
    Object execute(JobCommand command) throws JobEngineException;

    void onStatusChange(JobStatusListener listener);
}
