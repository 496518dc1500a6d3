package com.questrail.transferd.rpc;

import com.questrail.transferd.api.Arguments;
import com.questrail.transferd.api.AuthLevel;
import com.questrail.transferd.api.CallContext;
import com.questrail.transferd.api.FaultException;
import com.questrail.transferd.auth.AccessPolicy;
import com.questrail.transferd.observability.DaemonObservabilitySink;
import com.questrail.transferd.observability.DispatchFaultEvent;
import com.questrail.transferd.protocol.codec.PayloadCodec;
import com.questrail.transferd.protocol.model.Fault;
import com.questrail.transferd.protocol.model.FaultKind;
import com.questrail.transferd.protocol.model.Request;
import com.questrail.transferd.protocol.model.Response;
import com.questrail.transferd.session.Session;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * RpcDispatcher
 * =============================================================================
 * Resolves, authorizes and invokes one request, always producing exactly one
 * {@link Response} with the request's id.
 *
 * <h2>Algorithm</h2>
 * <ol>
 *   <li>Look the operation up; absent → {@code MethodNotFound}.</li>
 *   <li>Check the session's current level against the operation's required
 *       level; insufficient → {@code AuthError} and the handler is never
 *       invoked.</li>
 *   <li>Build a {@link CallContext} for this one call.</li>
 *   <li>Invoke the handler. A {@link FaultException} becomes a fault of its
 *       kind; any other exception becomes {@code HandlerError}.</li>
 *   <li>Normalize the result to wire values; a result that cannot be
 *       represented becomes {@code HandlerError}.</li>
 * </ol>
 *
 * <h2>Handler timeout</h2>
 * When a timeout is configured, handlers run on the handler executor and the
 * caller gets a {@code Timeout} fault if the handler overruns. The handler is
 * not interrupted; its eventual result is discarded.
 *
 * <p>{@link #dispatch(Session, Request)} never throws, except to let a
 * {@link VirtualMachineError} raised by a handler reach the worker.</p>
 */
public final class RpcDispatcher
{
    private final OperationRegistry registry;
    private final PayloadCodec payloadCodec;
    private final DaemonObservabilitySink observability;
    private final Duration handlerTimeout;
    private final ExecutorService handlerExecutor;

    /**
     * Dispatcher without a handler timeout; handlers run on the calling thread.
     */
    public RpcDispatcher(OperationRegistry registry, PayloadCodec payloadCodec, DaemonObservabilitySink observability) {
        this(registry, payloadCodec, observability, null, null);
    }

    /**
     * @param handlerTimeout  maximum handler run time, {@code null} for none
     * @param handlerExecutor executor for timed handlers; required when a timeout is set
     */
    public RpcDispatcher(OperationRegistry registry,
                         PayloadCodec payloadCodec,
                         DaemonObservabilitySink observability,
                         Duration handlerTimeout,
                         ExecutorService handlerExecutor)
    {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.payloadCodec = Objects.requireNonNull(payloadCodec, "payloadCodec");
        this.observability = Objects.requireNonNull(observability, "observability");
        if (handlerTimeout != null && handlerExecutor == null) {
            throw new IllegalArgumentException("handlerExecutor is required when a handler timeout is set");
        }
        this.handlerTimeout = handlerTimeout;
        this.handlerExecutor = handlerExecutor;
    }

    public OperationRegistry registry() {
        return registry;
    }

    public Response dispatch(Session session, Request request) {
        String operation = request.operation();

        OperationRecord record = registry.lookup(operation).orElse(null);
        if (record == null) {
            return fault(session, request, FaultKind.METHOD_NOT_FOUND, "Unknown method '" + operation + "'", null);
        }

        AuthLevel level = session.level();
        if (!AccessPolicy.permits(level, record.requiredLevel())) {
            String message = record.requiredLevel() == null
                    ? "Operation '" + operation + "' is not available"
                    : "Operation '" + operation + "' requires level " + record.requiredLevel() + ", session has " + level;
            return fault(session, request, FaultKind.AUTH_ERROR, message, null);
        }

        CallContext context = new CallContext(session.id(), session.username(), level,
                session.remoteAddress(), request.requestId(), operation);
        Arguments arguments = new Arguments(request.args(), request.kwargs());

        Object result;
        try {
            result = invoke(record, context, arguments);
        } catch (FaultException e) {
            return fault(session, request, e.kind(), e.getMessage(), e);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable e) {
            return fault(session, request, FaultKind.HANDLER_ERROR, describe(e), e);
        }

        try {
            return Response.success(request.requestId(), payloadCodec.normalize(result));
        } catch (IllegalArgumentException e) {
            return fault(session, request, FaultKind.HANDLER_ERROR,
                    "Result of '" + operation + "' cannot be encoded: " + e.getMessage(), e);
        }
    }

    private Object invoke(OperationRecord record, CallContext context, Arguments arguments) throws Exception {
        if (handlerTimeout == null) {
            return record.handler().handle(context, arguments);
        }

        Future<Object> future = handlerExecutor.submit(() -> record.handler().handle(context, arguments));
        try {
            return future.get(handlerTimeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            throw new FaultException(FaultKind.TIMEOUT,
                    "Operation '" + record.name() + "' did not complete within " + handlerTimeout.toMillis() + " ms");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FaultException(FaultKind.HANDLER_ERROR, "Interrupted while waiting for '" + record.name() + "'", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception exception) {
                throw exception;
            }
            throw new FaultException(FaultKind.HANDLER_ERROR, describe(cause), cause);
        }
    }

    private Response fault(Session session, Request request, FaultKind kind, String message, Throwable cause) {
        Fault fault = new Fault(kind, message);
        observability.onDispatchFault(new DispatchFaultEvent(
                Instant.now(), session.id(), request.requestId(), request.operation(), fault, cause));
        return Response.failure(request.requestId(), fault);
    }

    private static String describe(Throwable t) {
        String name = t.getClass().getSimpleName();
        return t.getMessage() == null ? name : name + ": " + t.getMessage();
    }
}
