package com.fotoreport.backend.modules.report.application;

import java.time.LocalDate;
import java.util.List;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

public record FileReportCommand(
        @NotNull Long locationId,
        @NotNull Long authorId,
        @NotNull LocalDate visitDate,
        String notes,
        @NotNull List<@Valid PhotoUpload> photos
) {

    public FileReportCommand {
        photos = photos != null ? List.copyOf(photos) : List.of();
    }
}
