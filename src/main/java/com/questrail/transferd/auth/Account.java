package com.questrail.transferd.auth;

import com.questrail.transferd.api.AuthLevel;

import java.util.Objects;

/**
 * An account known to the daemon and the level it is granted on login.
 */
public record Account(String username, String password, AuthLevel level) {

    public Account {
        Objects.requireNonNull(username, "username");
        Objects.requireNonNull(password, "password");
        Objects.requireNonNull(level, "level");
        if (username.isBlank()) {
            throw new IllegalArgumentException("username must not be blank");
        }
    }

    @Override
    public String toString() {
        return "Account[username=" + username + ", level=" + level + "]";
    }
}
