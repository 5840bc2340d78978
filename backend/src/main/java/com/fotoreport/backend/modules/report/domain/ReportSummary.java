package com.fotoreport.backend.modules.report.domain;

import java.time.LocalDate;

/**
 * Read model of a report joined with its location, client and author.
 */
public record ReportSummary(
        Long reportId,
        LocalDate visitDate,
        String notes,
        Long locationId,
        String siteName,
        String siteCode,
        String city,
        String clientName,
        String authorName
) {
}
