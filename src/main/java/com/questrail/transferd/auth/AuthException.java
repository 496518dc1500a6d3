package com.questrail.transferd.auth;

import com.questrail.transferd.api.FaultException;
import com.questrail.transferd.protocol.model.FaultKind;

/**
 * Bad credentials, or a session whose level is below what an operation
 * requires. Always answered with an {@code AuthError} fault; the connection
 * stays open.
 */
public final class AuthException extends FaultException
{
    public AuthException(String message) {
        super(FaultKind.AUTH_ERROR, message);
    }
}
