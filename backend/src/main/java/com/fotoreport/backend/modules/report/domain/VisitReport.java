package com.fotoreport.backend.modules.report.domain;

import java.time.LocalDate;

import com.fotoreport.backend.global.jpa.AbstractCreatedEntity;
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

/**
 * One visit by a user to a location on a calendar date.
 */
@Entity
@Table(name = "reportes")
public class VisitReport extends AbstractCreatedEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "local_id", nullable = false)
    private Location location;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "usuario_id", nullable = false)
    private FieldUser author;

    @Column(name = "fecha_visita", nullable = false)
    private LocalDate visitDate;

    @Column(name = "notas")
    private String notes;

    public Long getId() {
        return id;
    }

    public Location getLocation() {
        return location;
    }

    public void setLocation(Location location) {
        this.location = location;
    }

    public FieldUser getAuthor() {
        return author;
    }

    public void setAuthor(FieldUser author) {
        this.author = author;
    }

    public LocalDate getVisitDate() {
        return visitDate;
    }

    public void setVisitDate(LocalDate visitDate) {
        this.visitDate = visitDate;
    }

    public String getNotes() {
        return notes;
    }

    public void setNotes(String notes) {
        this.notes = notes;
    }
}
