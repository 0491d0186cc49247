package com.library.borrowing.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A library account.
 *
 * <p>The password is stored as given and compared verbatim by
 * {@code PlaintextCredentialVerifier}; nothing else in the application reads it.
 * Users are created by an administrator (always as regular users) or by the
 * startup admin bootstrap, and are never updated or deleted afterwards.
 *
 * <p>Email uniqueness is enforced by {@code idx_users_email} (V1). The index name
 * is matched by {@code GlobalExceptionHandler} to report a duplicate email that
 * slipped past the service-level check.
 */
@Entity
@Table(name = "users")
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@EqualsAndHashCode(of = "id", callSuper = false)
public class User extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "email", nullable = false, unique = true, length = 255)
    private String email;

    @Column(name = "password", nullable = false, length = 255)
    private String password;

    @Column(name = "is_admin", nullable = false)
    private boolean admin;

    public User(String email, String password, boolean admin) {
        this.email = email;
        this.password = password;
        this.admin = admin;
    }
}
