package com.library.borrowing.security;

import org.springframework.security.authentication.BadCredentialsException;

/**
 * Checks an email/password pair and resolves the matching account.
 *
 * <p>Handlers never see how passwords are stored; replacing the implementation is
 * enough to move to hashed storage.
 */
public interface CredentialVerifier {

    /**
     * @throws BadCredentialsException if the email is unknown or the password does not match
     */
    AuthenticatedUser verify(String email, String password);
}
