package com.questrail.transferd.api;

/**
 * OperationHandler
 * -----------------------------------------------------------------------------
 * Implementation of one callable operation.
 *
 * <p>Handlers receive the caller's identity explicitly and return a value
 * that the daemon normalizes into plain wire values. Any exception thrown
 * is caught at the dispatch boundary:</p>
 * <ul>
 *   <li>{@link FaultException} becomes a fault of its own kind</li>
 *   <li>anything else becomes a {@code HandlerError} fault</li>
 * </ul>
 *
 * <p>Handlers are invoked concurrently for different sessions and must be
 * thread-safe.</p>
 */
@FunctionalInterface
public interface OperationHandler
{
    Object handle(CallContext context, Arguments arguments) throws Exception;
}
