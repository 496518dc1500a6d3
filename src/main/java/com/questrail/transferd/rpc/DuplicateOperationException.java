package com.questrail.transferd.rpc;

/**
 * Raised when an operation name is registered twice.
 */
public class DuplicateOperationException extends RuntimeException
{
    private final String operation;

    public DuplicateOperationException(String operation) {
        super("Operation already registered: " + operation);
        this.operation = operation;
    }

    public String operation() {
        return operation;
    }
}
