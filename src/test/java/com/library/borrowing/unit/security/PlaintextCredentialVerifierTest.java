package com.library.borrowing.unit.security;

import com.library.borrowing.entity.User;
import com.library.borrowing.repository.UserRepository;
import com.library.borrowing.security.AuthenticatedUser;
import com.library.borrowing.security.PlaintextCredentialVerifier;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PlaintextCredentialVerifierTest {

    @Mock
    private UserRepository userRepository;

    @InjectMocks
    private PlaintextCredentialVerifier verifier;

    @Test
    void verify_matchingPassword_returnsIdentity() {
        User admin = new User("admin@example.com", "admin-secret", true);
        ReflectionTestUtils.setField(admin, "id", 1L);
        when(userRepository.findByEmail("admin@example.com")).thenReturn(Optional.of(admin));

        AuthenticatedUser identity = verifier.verify("admin@example.com", "admin-secret");

        assertThat(identity).isEqualTo(new AuthenticatedUser(1L, "admin@example.com", true));
    }

    @Test
    void verify_wrongPassword_throwsBadCredentials() {
        when(userRepository.findByEmail("admin@example.com"))
            .thenReturn(Optional.of(new User("admin@example.com", "admin-secret", true)));

        assertThatThrownBy(() -> verifier.verify("admin@example.com", "Admin-secret"))
            .isInstanceOf(BadCredentialsException.class)
            .hasMessage("Invalid email or password");
    }

    @Test
    void verify_unknownEmail_throwsBadCredentials() {
        when(userRepository.findByEmail("ghost@example.com")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> verifier.verify("ghost@example.com", "whatever"))
            .isInstanceOf(BadCredentialsException.class);
    }
}
