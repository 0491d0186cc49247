package com.library.borrowing.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Account created as administrator on startup when no user with {@code email} exists.
 * Leave {@code email} blank to skip the bootstrap.
 */
@ConfigurationProperties(prefix = "library.bootstrap-admin")
public record BootstrapAdminProperties(String email, String password) {}
