package com.questrail.transferd.rpc;

import com.questrail.transferd.api.AuthLevel;
import com.questrail.transferd.api.OperationHandler;

import java.util.Objects;
import java.util.Optional;

/**
 * One entry of the operation registry.
 *
 * @param name          unique, fully qualified operation name
 * @param handler       implementation
 * @param requiredLevel minimum session level; {@code null} makes the operation unreachable
 * @param owner         tag of the owning plugin, {@code null} for built-in operations
 */
public record OperationRecord(String name, OperationHandler handler, AuthLevel requiredLevel, String owner)
{
    public OperationRecord {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(handler, "handler");
        if (name.isBlank()) {
            throw new IllegalArgumentException("operation name must not be blank");
        }
    }

    public static OperationRecord builtIn(String name, AuthLevel requiredLevel, OperationHandler handler) {
        return new OperationRecord(name, handler, requiredLevel, null);
    }

    public Optional<String> ownerTag() {
        return Optional.ofNullable(owner);
    }
}
