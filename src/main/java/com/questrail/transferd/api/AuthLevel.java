package com.questrail.transferd.api;

import java.util.Optional;

/**
 * AuthLevel
 * -----------------------------------------------------------------------------
 * Totally ordered authorization tiers.
 *
 * <p>Every registered operation declares the lowest level allowed to invoke
 * it; a session may call the operation when its own level is at least that
 * high. The numeric values are the ones exchanged with clients and leave room
 * for intermediate tiers.</p>
 */
public enum AuthLevel
{
    NONE(0),
    READ_ONLY(1),
    NORMAL(5),
    ADMIN(10);

    private final int value;

    AuthLevel(int value) {
        this.value = value;
    }

    public int value() {
        return value;
    }

    public boolean isAtLeast(AuthLevel required) {
        return value >= required.value;
    }

    public static Optional<AuthLevel> fromValue(int value) {
        for (AuthLevel level : values()) {
            if (level.value == value) {
                return Optional.of(level);
            }
        }
        return Optional.empty();
    }
}
