package com.fotoreport.backend.modules.report.application;

import java.time.LocalDate;
import java.util.List;

import com.fotoreport.backend.global.common.Texts;
import com.fotoreport.backend.global.error.ProblemException;
import com.fotoreport.backend.modules.account.domain.FieldUser;
import com.fotoreport.backend.modules.account.infrastructure.persistence.FieldUserRepository;
import com.fotoreport.backend.modules.client.domain.Location;
import com.fotoreport.backend.modules.client.infrastructure.persistence.ClientRepository;
import com.fotoreport.backend.modules.client.infrastructure.persistence.LocationRepository;
import com.fotoreport.backend.modules.report.domain.Photo;
import com.fotoreport.backend.modules.report.domain.ReportSummary;
import com.fotoreport.backend.modules.report.domain.VisitReport;
import com.fotoreport.backend.modules.report.infrastructure.persistence.PhotoRepository;
import com.fotoreport.backend.modules.report.infrastructure.persistence.VisitReportRepository;

import jakarta.validation.Valid;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

/**
 * Files visit reports with their photos and serves the date-range report queries.
 */
@Service
@Validated
@Transactional
public class VisitReportService {

    private static final Logger log = LoggerFactory.getLogger(VisitReportService.class);

    private final VisitReportRepository visitReportRepository;
    private final PhotoRepository photoRepository;
    private final LocationRepository locationRepository;
    private final ClientRepository clientRepository;
    private final FieldUserRepository fieldUserRepository;

    public VisitReportService(
            VisitReportRepository visitReportRepository,
            PhotoRepository photoRepository,
            LocationRepository locationRepository,
            ClientRepository clientRepository,
            FieldUserRepository fieldUserRepository
    ) {
        this.visitReportRepository = visitReportRepository;
        this.photoRepository = photoRepository;
        this.locationRepository = locationRepository;
        this.clientRepository = clientRepository;
        this.fieldUserRepository = fieldUserRepository;
    }

    /**
     * Inserts the report and every attached photo in one transaction and returns the report id.
     */
    public Long fileReport(@Valid @NonNull FileReportCommand command) {
        Location location = locationRepository.findById(command.locationId())
                .orElseThrow(() -> ProblemException.notFound(
                        "location.not_found", "No location with id " + command.locationId()));
        FieldUser author = fieldUserRepository.findById(command.authorId())
                .orElseThrow(() -> ProblemException.notFound(
                        "account.user_not_found", "No user with id " + command.authorId()));
        command.photos().forEach(VisitReportService::checkUpload);

        VisitReport report = new VisitReport();
        report.setLocation(location);
        report.setAuthor(author);
        report.setVisitDate(command.visitDate());
        report.setNotes(Texts.trimToEmpty(command.notes()));
        VisitReport saved = visitReportRepository.save(report);

        for (PhotoUpload upload : command.photos()) {
            photoRepository.save(toPhoto(saved, upload));
        }

        log.info("Filed report {} for location {} by user {} on {} with {} photo(s)",
                saved.getId(), location.getId(), author.getId(), saved.getVisitDate(), command.photos().size());
        return saved.getId();
    }

    public Photo attachPhoto(@NonNull Long reportId, @Valid @NonNull PhotoUpload upload) {
        checkUpload(upload);
        VisitReport report = findReport(reportId);
        Photo saved = photoRepository.save(toPhoto(report, upload));
        log.info("Attached photo {} to report {}", saved.getId(), reportId);
        return saved;
    }

    /**
     * Reports authored by the user with a visit date in {@code [from, to]}, newest first.
     */
    @Transactional(readOnly = true)
    public List<ReportSummary> myReports(@NonNull Long userId, @NonNull LocalDate from, @NonNull LocalDate to) {
        checkRange(from, to);
        return visitReportRepository.findAuthoredBetween(userId, from, to);
    }

    @Transactional(readOnly = true)
    public List<ReportSummary> reportsInRange(@NonNull LocalDate from, @NonNull LocalDate to) {
        checkRange(from, to);
        return visitReportRepository.findAllBetween(from, to);
    }

    /**
     * Reports on any location of the client with a visit date in {@code [from, to]},
     * ordered by visit date, site name and id.
     */
    @Transactional(readOnly = true)
    public List<ReportSummary> clientReports(@NonNull Long clientId, @NonNull LocalDate from, @NonNull LocalDate to) {
        checkRange(from, to);
        if (!clientRepository.existsById(clientId)) {
            throw ProblemException.notFound("client.not_found", "No client with id " + clientId);
        }
        return visitReportRepository.findForClientBetween(clientId, from, to);
    }

    @Transactional(readOnly = true)
    public List<Photo> photos(@NonNull Long reportId) {
        return photoRepository.findByReportIdOrderByIdAsc(reportId);
    }

    /**
     * Removes the report; the database cascades to its photos. Author and location stay.
     */
    public void deleteReport(@NonNull Long reportId) {
        VisitReport report = findReport(reportId);
        visitReportRepository.delete(report);
        visitReportRepository.flush();
        log.info("Deleted report {}", reportId);
    }

    private VisitReport findReport(Long reportId) {
        return visitReportRepository.findById(reportId)
                .orElseThrow(() -> ProblemException.notFound("report.not_found", "No report with id " + reportId));
    }

    private static Photo toPhoto(VisitReport report, PhotoUpload upload) {
        Photo photo = new Photo();
        photo.setReport(report);
        photo.setFileName(Texts.blankToNull(upload.fileName()));
        photo.setMimeType(upload.mimeType().trim());
        photo.setImageBytes(upload.imageBytes());
        photo.setComment(Texts.trimToEmpty(upload.comment()));
        return photo;
    }

    private static void checkUpload(PhotoUpload upload) {
        if (upload.mimeType() == null || upload.mimeType().isBlank()) {
            throw ProblemException.invalid("photo.mime_required", "Photo MIME type must not be blank.");
        }
        if (upload.imageBytes() == null || upload.imageBytes().length == 0) {
            throw ProblemException.invalid("photo.empty", "Photo payload must not be empty.");
        }
    }

    private static void checkRange(LocalDate from, LocalDate to) {
        if (from.isAfter(to)) {
            throw ProblemException.invalid("report.invalid_range", "Range start " + from + " is after end " + to);
        }
    }
}
