package com.library.borrowing;

import com.library.borrowing.integration.AbstractIntegrationTest;
import com.library.borrowing.repository.UserRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import static org.assertj.core.api.Assertions.assertThat;

class LibraryBorrowingApplicationTests extends AbstractIntegrationTest {

    @Autowired
    private UserRepository userRepository;

    @Test
    void contextLoads() {
        // PostgreSQL is up, Flyway has migrated and seeded it, Hibernate validated the mappings.
        assertThat(bookRepository.count()).isGreaterThanOrEqualTo(5);
    }

    @Test
    void bootstrapAdminIsCreated() {
        assertThat(userRepository.findByEmail(ADMIN_EMAIL))
            .hasValueSatisfying(admin -> assertThat(admin.isAdmin()).isTrue());
    }
}
