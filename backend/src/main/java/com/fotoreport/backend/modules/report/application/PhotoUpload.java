package com.fotoreport.backend.modules.report.application;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

public record PhotoUpload(
        String fileName,
        @NotBlank String mimeType,
        @NotEmpty byte[] imageBytes,
        String comment
) {

    @Override
    public String toString() {
        int size = imageBytes != null ? imageBytes.length : 0;
        return "PhotoUpload[fileName=" + fileName + ", mimeType=" + mimeType + ", bytes=" + size + "]";
    }
}
