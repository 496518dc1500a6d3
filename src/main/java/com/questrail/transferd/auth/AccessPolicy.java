package com.questrail.transferd.auth;

import com.questrail.transferd.api.AuthLevel;

/**
 * AccessPolicy
 * -----------------------------------------------------------------------------
 * The single place where a session level is compared against an operation's
 * declared minimum.
 *
 * <p>Default deny: an operation that declares no minimum level is
 * unreachable for every session, administrators included.</p>
 */
public final class AccessPolicy
{
    private AccessPolicy() {}

    public static boolean permits(AuthLevel sessionLevel, AuthLevel required) {
        if (required == null || sessionLevel == null) {
            return false;
        }
        return sessionLevel.isAtLeast(required);
    }
}
