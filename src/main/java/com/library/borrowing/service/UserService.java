package com.library.borrowing.service;

import com.library.borrowing.dto.request.CreateUserRequest;
import com.library.borrowing.dto.response.UserCreatedResponse;
import com.library.borrowing.entity.User;
import com.library.borrowing.exception.DuplicateEmailException;
import com.library.borrowing.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class UserService {

    private static final Logger log = LoggerFactory.getLogger(UserService.class);

    private final UserRepository userRepository;

    @Transactional
    public UserCreatedResponse create(CreateUserRequest request) {
        if (userRepository.existsByEmail(request.email())) {
            throw new DuplicateEmailException(request.email());
        }

        User saved = userRepository.save(new User(request.email(), request.password(), false));
        log.info("Created user {} with id {}", saved.getEmail(), saved.getId());
        return new UserCreatedResponse("User created successfully", saved.getId());
    }
}
