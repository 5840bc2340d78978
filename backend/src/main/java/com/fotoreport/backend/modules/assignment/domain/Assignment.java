package com.fotoreport.backend.modules.assignment.domain;

import java.time.OffsetDateTime;

import com.fotoreport.backend.modules.account.domain.FieldUser;
import com.fotoreport.backend.modules.client.domain.Location;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

/**
 * Grants a user responsibility for a location. At most one row per (user, location).
 */
@Entity
@Table(
        name = "asignaciones",
        uniqueConstraints = @UniqueConstraint(columnNames = {"usuario_id", "local_id"})
)
public class Assignment {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "usuario_id", nullable = false)
    private FieldUser user;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "local_id", nullable = false)
    private Location location;

    @Column(name = "activo", nullable = false)
    private boolean active = true;

    @Column(name = "asignado_en", nullable = false, updatable = false)
    private OffsetDateTime assignedAt;

    public Long getId() {
        return id;
    }

    public FieldUser getUser() {
        return user;
    }

    public void setUser(FieldUser user) {
        this.user = user;
    }

    public Location getLocation() {
        return location;
    }

    public void setLocation(Location location) {
        this.location = location;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public OffsetDateTime getAssignedAt() {
        return assignedAt;
    }

    public void setAssignedAt(OffsetDateTime assignedAt) {
        this.assignedAt = assignedAt;
    }
}
