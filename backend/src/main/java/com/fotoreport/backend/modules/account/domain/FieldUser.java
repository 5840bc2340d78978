package com.fotoreport.backend.modules.account.domain;

import com.fotoreport.backend.global.jpa.AbstractCreatedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * Account of someone who visits sites (worker) or manages the directory (admin).
 */
@Entity
@Table(name = "usuarios")
public class FieldUser extends AbstractCreatedEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "usuario", nullable = false, unique = true)
    private String login;

    @Column(name = "nombre_completo", nullable = false)
    private String fullName;

    @Column(name = "email")
    private String email;

    @Convert(converter = UserRoleConverter.class)
    @Column(name = "rol", nullable = false)
    private UserRole role;

    @Column(name = "pw_salt", nullable = false)
    private byte[] passwordSalt;

    @Column(name = "pw_hash", nullable = false)
    private byte[] passwordHash;

    @Column(name = "activo", nullable = false)
    private boolean active = true;

    public Long getId() {
        return id;
    }

    public String getLogin() {
        return login;
    }

    public void setLogin(String login) {
        this.login = login;
    }

    public String getFullName() {
        return fullName;
    }

    public void setFullName(String fullName) {
        this.fullName = fullName;
    }

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }

    public UserRole getRole() {
        return role;
    }

    public void setRole(UserRole role) {
        this.role = role;
    }

    public byte[] getPasswordSalt() {
        return passwordSalt;
    }

    public void setPasswordSalt(byte[] passwordSalt) {
        this.passwordSalt = passwordSalt;
    }

    public byte[] getPasswordHash() {
        return passwordHash;
    }

    public void setPasswordHash(byte[] passwordHash) {
        this.passwordHash = passwordHash;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }
}
