package com.fotoreport.backend.modules.account.domain;

import java.util.Arrays;

/**
 * Closed set of roles allowed by the {@code usuarios.rol} check constraint.
 */
public enum UserRole {
    ADMIN("admin"),
    WORKER("worker");

    private final String code;

    UserRole(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static UserRole fromCode(String code) {
        return Arrays.stream(values())
                .filter(role -> role.code.equals(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown role code: " + code));
    }
}
