package com.fotoreport.backend.modules.account.application;

import com.fotoreport.backend.modules.account.domain.UserRole;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record CreateUserCommand(
        @NotBlank String login,
        @NotBlank String fullName,
        String email,
        @NotNull UserRole role,
        @NotBlank String rawPassword
) {

    @Override
    public String toString() {
        return "CreateUserCommand[login=" + login + ", role=" + role + "]";
    }
}
