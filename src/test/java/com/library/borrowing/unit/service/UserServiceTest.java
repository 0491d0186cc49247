package com.library.borrowing.unit.service;

import com.library.borrowing.dto.request.CreateUserRequest;
import com.library.borrowing.dto.response.UserCreatedResponse;
import com.library.borrowing.entity.User;
import com.library.borrowing.exception.DuplicateEmailException;
import com.library.borrowing.repository.UserRepository;
import com.library.borrowing.service.UserService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class UserServiceTest {

    @Mock
    private UserRepository userRepository;

    @InjectMocks
    private UserService userService;

    @Test
    void create_happyPath_savesRegularUser() {
        when(userRepository.existsByEmail("bob@example.com")).thenReturn(false);
        when(userRepository.save(any(User.class))).thenAnswer(invocation -> {
            User saved = invocation.getArgument(0);
            ReflectionTestUtils.setField(saved, "id", 3L);
            return saved;
        });

        UserCreatedResponse response = userService.create(new CreateUserRequest("bob@example.com", "secret1"));

        assertThat(response.userId()).isEqualTo(3L);
        assertThat(response.message()).isEqualTo("User created successfully");

        ArgumentCaptor<User> captor = ArgumentCaptor.forClass(User.class);
        verify(userRepository).save(captor.capture());
        assertThat(captor.getValue().getEmail()).isEqualTo("bob@example.com");
        assertThat(captor.getValue().getPassword()).isEqualTo("secret1");
        assertThat(captor.getValue().isAdmin()).isFalse();
    }

    @Test
    void create_whenEmailTaken_throwsDuplicateEmailException() {
        when(userRepository.existsByEmail("bob@example.com")).thenReturn(true);

        assertThatThrownBy(() -> userService.create(new CreateUserRequest("bob@example.com", "secret1")))
            .isInstanceOf(DuplicateEmailException.class)
            .hasMessageContaining("User already exists");

        verify(userRepository, never()).save(any());
    }
}
