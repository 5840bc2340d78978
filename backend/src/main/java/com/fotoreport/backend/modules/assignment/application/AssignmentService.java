package com.fotoreport.backend.modules.assignment.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;

import com.fotoreport.backend.global.error.ProblemException;
import com.fotoreport.backend.modules.account.infrastructure.persistence.FieldUserRepository;
import com.fotoreport.backend.modules.assignment.domain.Assignment;
import com.fotoreport.backend.modules.assignment.infrastructure.persistence.AssignmentRepository;
import com.fotoreport.backend.modules.client.domain.Location;
import com.fotoreport.backend.modules.client.infrastructure.persistence.LocationRepository;

import jakarta.validation.constraints.NotNull;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

@Service
@Validated
@Transactional
public class AssignmentService {

    private static final Logger log = LoggerFactory.getLogger(AssignmentService.class);

    private final AssignmentRepository assignmentRepository;
    private final FieldUserRepository fieldUserRepository;
    private final LocationRepository locationRepository;
    private final Clock clock;

    public AssignmentService(
            AssignmentRepository assignmentRepository,
            FieldUserRepository fieldUserRepository,
            LocationRepository locationRepository,
            Clock clock
    ) {
        this.assignmentRepository = assignmentRepository;
        this.fieldUserRepository = fieldUserRepository;
        this.locationRepository = locationRepository;
        this.clock = clock;
    }

    /**
     * Assigns the user to the location. An existing assignment for the same pair is returned
     * unchanged, whatever its active flag; concurrent calls for one pair all return the same row.
     */
    public Assignment assign(@NotNull Long userId, @NotNull Long locationId) {
        if (!fieldUserRepository.existsById(userId)) {
            throw ProblemException.notFound("account.user_not_found", "No user with id " + userId);
        }
        if (!locationRepository.existsById(locationId)) {
            throw ProblemException.notFound("location.not_found", "No location with id " + locationId);
        }

        int inserted = assignmentRepository.insertIfAbsent(userId, locationId, OffsetDateTime.now(clock));
        Assignment assignment = assignmentRepository.findByUserAndLocation(userId, locationId)
                .orElseThrow(() -> new IllegalStateException(
                        "Assignment for user " + userId + " and location " + locationId + " vanished after insert"));
        if (inserted == 0) {
            log.debug("User {} already assigned to location {}", userId, locationId);
        } else {
            log.info("Assigned user {} to location {} (assignment id={})", userId, locationId, assignment.getId());
        }
        return assignment;
    }

    /**
     * Locations the user may report on: assignment, location and client all active.
     */
    @Transactional(readOnly = true)
    public List<Location> assignedLocations(@NotNull Long userId) {
        return assignmentRepository.findActiveAssignedLocations(userId);
    }

    /**
     * Every assignment with its user, client and location, ordered by handle, client name, site name.
     */
    @Transactional(readOnly = true)
    public List<Assignment> listAll() {
        return assignmentRepository.findAllWithUserAndLocation();
    }

    @Transactional(readOnly = true)
    public List<Assignment> listForUser(@NotNull Long userId) {
        return assignmentRepository.findByUserId(userId);
    }

    @Transactional(readOnly = true)
    public List<Assignment> listForLocation(@NotNull Long locationId) {
        return assignmentRepository.findByLocationId(locationId);
    }

    public Assignment setActive(@NotNull Long assignmentId, boolean active) {
        Assignment assignment = findAssignment(assignmentId);
        assignment.setActive(active);
        return assignment;
    }

    public void unassign(@NotNull Long assignmentId) {
        Assignment assignment = findAssignment(assignmentId);
        assignmentRepository.delete(assignment);
        log.info("Removed assignment {}", assignmentId);
    }

    private Assignment findAssignment(Long assignmentId) {
        return assignmentRepository.findById(assignmentId)
                .orElseThrow(() -> ProblemException.notFound(
                        "assignment.not_found", "No assignment with id " + assignmentId));
    }
}
