package com.fotoreport.backend.global.error;

import static org.assertj.core.api.Assertions.assertThat;

import java.sql.SQLException;

import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;

class IntegrityViolationTest {

    @Test
    void classifiesByNestedSqlState() {
        SQLException unique = new SQLException("duplicate key", "23505");
        RuntimeException hibernateLike = new RuntimeException("could not execute statement", unique);
        DataIntegrityViolationException translated = new DataIntegrityViolationException("insert failed", hibernateLike);

        assertThat(IntegrityViolation.classify(translated)).isEqualTo(IntegrityViolation.UNIQUE);
    }

    @Test
    void mapsEachConstraintState() {
        assertThat(IntegrityViolation.fromSqlState("23503")).isEqualTo(IntegrityViolation.FOREIGN_KEY);
        assertThat(IntegrityViolation.fromSqlState("23514")).isEqualTo(IntegrityViolation.CHECK);
        assertThat(IntegrityViolation.fromSqlState("23502")).isEqualTo(IntegrityViolation.NOT_NULL);
        assertThat(IntegrityViolation.fromSqlState("40001")).isEqualTo(IntegrityViolation.OTHER);
    }

    @Test
    void unrelatedFailuresAreOther() {
        assertThat(IntegrityViolation.classify(new IllegalStateException("boom"))).isEqualTo(IntegrityViolation.OTHER);
        assertThat(IntegrityViolation.classify(new SQLException("no state"))).isEqualTo(IntegrityViolation.OTHER);
        assertThat(IntegrityViolation.classify(null)).isEqualTo(IntegrityViolation.OTHER);
    }
}
