package com.questrail.transferd.protocol.model;

import java.util.Objects;

/**
 * Structured failure returned inside a {@link Response}.
 */
public record Fault(FaultKind kind, String message) {

    public Fault {
        Objects.requireNonNull(kind, "kind");
        message = message == null ? "" : message;
    }
}
