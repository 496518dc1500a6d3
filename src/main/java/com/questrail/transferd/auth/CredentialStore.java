package com.questrail.transferd.auth;

import java.util.Optional;

/**
 * Source of accounts. Persistence of accounts lives outside the daemon core;
 * implementations only answer lookups.
 */
public interface CredentialStore
{
    Optional<Account> lookup(String username);
}
