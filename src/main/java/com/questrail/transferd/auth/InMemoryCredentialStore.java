package com.questrail.transferd.auth;

import com.questrail.transferd.api.AuthLevel;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable {@link CredentialStore} populated through a builder.
 */
public final class InMemoryCredentialStore implements CredentialStore
{
    private final Map<String, Account> accounts;

    private InMemoryCredentialStore(Map<String, Account> accounts) {
        this.accounts = Collections.unmodifiableMap(new LinkedHashMap<>(accounts));
    }

    @Override
    public Optional<Account> lookup(String username) {
        return Optional.ofNullable(accounts.get(username));
    }

    public int size() {
        return accounts.size();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<String, Account> accounts = new LinkedHashMap<>();

        public Builder addAccount(String username, String password, AuthLevel level) {
            return addAccount(new Account(username, password, level));
        }

        public Builder addAccount(Account account) {
            Objects.requireNonNull(account, "account");
            if (accounts.putIfAbsent(account.username(), account) != null) {
                throw new IllegalArgumentException("Duplicate account: " + account.username());
            }
            return this;
        }

        public InMemoryCredentialStore build() {
            return new InMemoryCredentialStore(accounts);
        }
    }
}
