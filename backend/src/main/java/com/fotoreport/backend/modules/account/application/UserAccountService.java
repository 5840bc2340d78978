package com.fotoreport.backend.modules.account.application;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

import com.fotoreport.backend.global.common.Texts;
import com.fotoreport.backend.global.error.ProblemException;
import com.fotoreport.backend.modules.account.domain.FieldUser;
import com.fotoreport.backend.modules.account.domain.UserRole;
import com.fotoreport.backend.modules.account.infrastructure.crypto.CredentialHasher;
import com.fotoreport.backend.modules.account.infrastructure.persistence.FieldUserRepository;

import jakarta.validation.Valid;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

@Service
@Validated
@Transactional
public class UserAccountService {

    private static final Logger log = LoggerFactory.getLogger(UserAccountService.class);

    private final FieldUserRepository fieldUserRepository;
    private final CredentialHasher credentialHasher;

    public UserAccountService(FieldUserRepository fieldUserRepository, CredentialHasher credentialHasher) {
        this.fieldUserRepository = fieldUserRepository;
        this.credentialHasher = credentialHasher;
    }

    public FieldUser createUser(@Valid @NonNull CreateUserCommand command) {
        String login = normalizeLogin(command.login());
        if (login.isEmpty()) {
            throw ProblemException.invalid("account.login_required", "Login handle must not be blank.");
        }
        if (fieldUserRepository.existsByLogin(login)) {
            throw ProblemException.conflict("account.login_taken", "Login handle already in use: " + login);
        }

        byte[] salt = credentialHasher.newSalt();

        FieldUser user = new FieldUser();
        user.setLogin(login);
        user.setFullName(command.fullName().trim());
        user.setEmail(Texts.blankToNull(command.email()));
        user.setRole(command.role());
        user.setPasswordSalt(salt);
        user.setPasswordHash(credentialHasher.hash(command.rawPassword(), salt));
        user.setActive(true);

        FieldUser saved = fieldUserRepository.save(user);
        log.info("Created {} account '{}' (id={})", saved.getRole().getCode(), saved.getLogin(), saved.getId());
        return saved;
    }

    @Transactional(readOnly = true)
    public boolean activeAdminExists() {
        return fieldUserRepository.existsActiveWithRole(UserRole.ADMIN);
    }

    @Transactional(readOnly = true)
    public Optional<FieldUser> findByLogin(String login) {
        if (login == null) {
            return Optional.empty();
        }
        return fieldUserRepository.findByLogin(normalizeLogin(login));
    }

    /**
     * Active users of any role, ordered by handle.
     */
    @Transactional(readOnly = true)
    public List<FieldUser> listActive() {
        return fieldUserRepository.findByActiveTrueOrderByLoginAsc();
    }

    @Transactional(readOnly = true)
    public List<FieldUser> listActive(@NonNull UserRole role) {
        return fieldUserRepository.findActiveByRole(role);
    }

    @Transactional(readOnly = true)
    public List<FieldUser> listAll() {
        return fieldUserRepository.findAllByOrderByRoleAscLoginAsc();
    }

    public FieldUser setActive(@NonNull Long userId, boolean active) {
        FieldUser user = findUser(userId);
        if (user.isActive() != active) {
            user.setActive(active);
            log.info("User '{}' is now {}", user.getLogin(), active ? "active" : "inactive");
        }
        return user;
    }

    public void deleteUser(@NonNull Long userId) {
        FieldUser user = findUser(userId);
        fieldUserRepository.delete(user);
        fieldUserRepository.flush();
        log.info("Deleted user '{}' (id={}) with its assignments and reports", user.getLogin(), userId);
    }

    FieldUser findUser(Long userId) {
        return fieldUserRepository.findById(userId)
                .orElseThrow(() -> ProblemException.notFound("account.user_not_found", "No user with id " + userId));
    }

    static String normalizeLogin(String login) {
        return login.trim().toLowerCase(Locale.ROOT);
    }
}
