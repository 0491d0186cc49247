package com.library.borrowing.security;

import lombok.RequiredArgsConstructor;
import org.springframework.security.authentication.AuthenticationProvider;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Bridges HTTP Basic authentication to {@link CredentialVerifier}. Every caller gets
 * {@code ROLE_USER}; administrators additionally get {@code ROLE_ADMIN}.
 */
@Component
@RequiredArgsConstructor
public class CredentialAuthenticationProvider implements AuthenticationProvider {

    private final CredentialVerifier credentialVerifier;

    @Override
    public Authentication authenticate(Authentication authentication) {
        String email = authentication.getName();
        String password = authentication.getCredentials() != null
            ? authentication.getCredentials().toString()
            : "";

        AuthenticatedUser user = credentialVerifier.verify(email, password);

        List<GrantedAuthority> authorities = new ArrayList<>();
        authorities.add(new SimpleGrantedAuthority("ROLE_USER"));
        if (user.admin()) {
            authorities.add(new SimpleGrantedAuthority("ROLE_ADMIN"));
        }
        return UsernamePasswordAuthenticationToken.authenticated(user, null, authorities);
    }

    @Override
    public boolean supports(Class<?> authentication) {
        return UsernamePasswordAuthenticationToken.class.isAssignableFrom(authentication);
    }
}
