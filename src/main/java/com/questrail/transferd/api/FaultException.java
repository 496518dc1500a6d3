package com.questrail.transferd.api;

import com.questrail.transferd.protocol.model.Fault;
import com.questrail.transferd.protocol.model.FaultKind;

import java.util.Objects;

/**
 * Failure that maps onto a specific {@link FaultKind} when it crosses the
 * dispatch boundary. Handlers throw it to choose the fault a caller sees.
 */
public class FaultException extends RuntimeException
{
    private final FaultKind kind;

    public FaultException(FaultKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public FaultException(FaultKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public FaultKind kind() {
        return kind;
    }

    public Fault toFault() {
        return new Fault(kind, getMessage());
    }

    public static FaultException invalidArguments(String message) {
        return new FaultException(FaultKind.INVALID_ARGUMENTS, message);
    }
}
