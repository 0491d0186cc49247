package com.library.borrowing.dto.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record CreateUserRequest(

    @NotNull(message = "Email is required")
    @Pattern(regexp = "(?s).*@.*", message = "Invalid email format")
    @Size(max = 255, message = "Email must not exceed 255 characters")
    String email,

    @NotNull(message = "Password is required")
    @Size(min = 6, message = "Password must be at least 6 characters")
    @Size(max = 255, message = "Password must not exceed 255 characters")
    String password
) {}
