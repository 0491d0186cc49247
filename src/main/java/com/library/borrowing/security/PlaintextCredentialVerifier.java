package com.library.borrowing.security;

import com.library.borrowing.entity.User;
import com.library.borrowing.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
@RequiredArgsConstructor
public class PlaintextCredentialVerifier implements CredentialVerifier {

    private static final Logger log = LoggerFactory.getLogger(PlaintextCredentialVerifier.class);

    static final String INVALID_CREDENTIALS = "Invalid email or password";

    private final UserRepository userRepository;

    @Override
    @Transactional(readOnly = true)
    public AuthenticatedUser verify(String email, String password) {
        User user = userRepository.findByEmail(email)
            .filter(candidate -> candidate.getPassword().equals(password))
            .orElseThrow(() -> {
                log.warn("Rejected credentials for {}", email);
                return new BadCredentialsException(INVALID_CREDENTIALS);
            });
        return new AuthenticatedUser(user.getId(), user.getEmail(), user.isAdmin());
    }
}
