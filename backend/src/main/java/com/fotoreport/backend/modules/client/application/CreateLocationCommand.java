package com.fotoreport.backend.modules.client.application;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record CreateLocationCommand(
        @NotNull Long clientId,
        String siteCode,
        @NotBlank String siteName,
        String address,
        String city
) {
}
