package com.library.borrowing.config;

import com.library.borrowing.entity.User;
import com.library.borrowing.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
@RequiredArgsConstructor
public class AdminAccountInitializer implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(AdminAccountInitializer.class);

    private final BootstrapAdminProperties properties;
    private final UserRepository userRepository;

    @Override
    @Transactional
    public void run(ApplicationArguments args) {
        String email = properties.email();
        if (email == null || email.isBlank()) {
            log.info("No bootstrap admin configured");
            return;
        }
        if (userRepository.existsByEmail(email)) {
            log.debug("Bootstrap admin {} already present", email);
            return;
        }
        if (properties.password() == null || properties.password().length() < 6) {
            throw new IllegalStateException(
                "library.bootstrap-admin.password must be at least 6 characters");
        }
        User admin = userRepository.save(new User(email, properties.password(), true));
        log.info("Created bootstrap admin {} with id {}", email, admin.getId());
    }
}
