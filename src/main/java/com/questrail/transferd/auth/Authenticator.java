package com.questrail.transferd.auth;

import com.questrail.transferd.api.AuthLevel;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Objects;
import java.util.Optional;

/**
 * Authenticator
 * -----------------------------------------------------------------------------
 * Verifies credentials against a {@link CredentialStore}.
 *
 * <p>Unknown users and wrong passwords produce the same {@link AuthException}
 * message so that a caller cannot probe for account names. Password
 * comparison is constant-time.</p>
 */
public final class Authenticator
{
    private final CredentialStore store;

    public Authenticator(CredentialStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    /**
     * @return the level granted to the account
     * @throws AuthException if the credentials are not accepted
     */
    public AuthLevel authenticate(Credentials credentials) {
        Objects.requireNonNull(credentials, "credentials");

        Optional<Account> account = store.lookup(credentials.username());
        byte[] presented = credentials.password().getBytes(StandardCharsets.UTF_8);
        byte[] expected = account.map(a -> a.password().getBytes(StandardCharsets.UTF_8)).orElse(new byte[0]);

        if (account.isEmpty() || !MessageDigest.isEqual(presented, expected)) {
            throw new AuthException("Username or password is incorrect");
        }
        return account.get().level();
    }
}
