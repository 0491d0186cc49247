package com.library.borrowing.security;

/**
 * Identity of the caller once credentials have been verified. Exposed to controllers
 * as the authentication principal.
 */
public record AuthenticatedUser(Long id, String email, boolean admin) {}
