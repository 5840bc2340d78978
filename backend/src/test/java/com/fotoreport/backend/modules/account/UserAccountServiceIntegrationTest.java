package com.fotoreport.backend.modules.account;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.LocalDate;

import com.fotoreport.backend.global.error.ProblemException;
import com.fotoreport.backend.modules.account.application.CreateUserCommand;
import com.fotoreport.backend.modules.account.application.UserAccountService;
import com.fotoreport.backend.modules.account.domain.FieldUser;
import com.fotoreport.backend.modules.account.domain.UserRole;
import com.fotoreport.backend.modules.account.infrastructure.crypto.CredentialHasher;
import com.fotoreport.backend.modules.account.infrastructure.persistence.FieldUserRepository;
import com.fotoreport.backend.support.AbstractPostgresIntegrationTest;
import com.fotoreport.backend.support.TestDataFactory;

import jakarta.validation.ConstraintViolationException;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;

@SpringBootTest
class UserAccountServiceIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    UserAccountService userAccountService;

    @Autowired
    FieldUserRepository fieldUserRepository;

    @Autowired
    CredentialHasher credentialHasher;

    @Autowired
    TestDataFactory testData;

    @Autowired
    JdbcTemplate jdbcTemplate;

    @Test
    void createUserNormalizesAndHashes() {
        FieldUser created = userAccountService.createUser(new CreateUserCommand(
                "  Maria.Lopez ", " Maria Lopez ", "   ", UserRole.WORKER, "s3cret!"));

        FieldUser stored = fieldUserRepository.findById(created.getId()).orElseThrow();
        assertThat(stored.getLogin()).isEqualTo("maria.lopez");
        assertThat(stored.getFullName()).isEqualTo("Maria Lopez");
        assertThat(stored.getEmail()).isNull();
        assertThat(stored.getRole()).isEqualTo(UserRole.WORKER);
        assertThat(stored.isActive()).isTrue();
        assertThat(stored.getCreatedAt()).isNotNull();
        assertThat(stored.getPasswordSalt()).hasSize(16);
        assertThat(credentialHasher.matches("s3cret!", stored.getPasswordSalt(), stored.getPasswordHash())).isTrue();
        assertThat(credentialHasher.matches("wrong", stored.getPasswordSalt(), stored.getPasswordHash())).isFalse();
    }

    @Test
    void roleIsStoredAsLowercaseCode() {
        FieldUser admin = testData.admin("root");

        String stored = jdbcTemplate.queryForObject("SELECT rol FROM usuarios WHERE id = ?", String.class, admin.getId());
        assertThat(stored).isEqualTo("admin");
    }

    @Test
    void duplicateLoginIsRejectedIgnoringCase() {
        testData.worker("alice");

        assertThatThrownBy(() -> userAccountService.createUser(
                new CreateUserCommand("ALICE", "Alice Again", null, UserRole.ADMIN, "pw")))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("account.login_taken"));
    }

    @Test
    void blankFieldsAreRejectedBeforeTouchingTheDatabase() {
        assertThatThrownBy(() -> userAccountService.createUser(
                new CreateUserCommand(" ", "Nobody", null, UserRole.WORKER, "pw")))
                .isInstanceOf(ConstraintViolationException.class);
        assertThat(fieldUserRepository.count()).isZero();
    }

    @Test
    void activeAdminExistsTracksActiveFlag() {
        assertThat(userAccountService.activeAdminExists()).isFalse();
        testData.worker("bob");
        assertThat(userAccountService.activeAdminExists()).isFalse();

        FieldUser admin = testData.admin("root");
        assertThat(userAccountService.activeAdminExists()).isTrue();

        userAccountService.setActive(admin.getId(), false);
        assertThat(userAccountService.activeAdminExists()).isFalse();
    }

    @Test
    void listsActiveUsersByRole() {
        testData.worker("zoe");
        FieldUser carl = testData.worker("carl");
        testData.admin("root");
        userAccountService.setActive(carl.getId(), false);
        testData.worker("anna");

        assertThat(userAccountService.listActive(UserRole.WORKER))
                .extracting(FieldUser::getLogin)
                .containsExactly("anna", "zoe");
        assertThat(userAccountService.listAll())
                .extracting(FieldUser::getLogin)
                .containsExactly("root", "anna", "carl", "zoe");
    }

    @Test
    void listsActiveUsersOfEveryRoleByHandle() {
        testData.worker("zoe");
        testData.admin("root");
        FieldUser carl = testData.admin("carl");
        testData.worker("anna");
        userAccountService.setActive(carl.getId(), false);

        assertThat(userAccountService.listActive())
                .extracting(FieldUser::getLogin)
                .containsExactly("anna", "root", "zoe");
    }

    @Test
    void findByLoginIgnoresCaseAndWhitespace() {
        testData.worker("dana");

        assertThat(userAccountService.findByLogin(" DANA ")).isPresent();
        assertThat(userAccountService.findByLogin("nobody")).isEmpty();
    }

    @Test
    void deleteUserCascadesToAssignmentsAndReports() {
        FieldUser maria = testData.worker("maria");
        var location = testData.location(testData.client("Acme"), "Centro");
        jdbcTemplate.update("INSERT INTO asignaciones(usuario_id, local_id) VALUES (?, ?)", maria.getId(), location.getId());
        testData.report(location, maria, LocalDate.of(2025, 5, 2), 2);

        userAccountService.deleteUser(maria.getId());

        assertThat(fieldUserRepository.existsById(maria.getId())).isFalse();
        assertThat(jdbcTemplate.queryForObject("SELECT count(*) FROM asignaciones", Long.class)).isZero();
        assertThat(jdbcTemplate.queryForObject("SELECT count(*) FROM reportes", Long.class)).isZero();
        assertThat(jdbcTemplate.queryForObject("SELECT count(*) FROM fotos", Long.class)).isZero();
        assertThat(jdbcTemplate.queryForObject("SELECT count(*) FROM locales", Long.class)).isEqualTo(1L);
    }

    @Test
    void unknownUserIsReported() {
        assertThatThrownBy(() -> userAccountService.setActive(404L, false))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("account.user_not_found"));
    }
}
