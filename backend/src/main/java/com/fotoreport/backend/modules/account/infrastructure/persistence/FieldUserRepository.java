package com.fotoreport.backend.modules.account.infrastructure.persistence;

import java.util.List;
import java.util.Optional;

import com.fotoreport.backend.modules.account.domain.FieldUser;
import com.fotoreport.backend.modules.account.domain.UserRole;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface FieldUserRepository extends JpaRepository<FieldUser, Long> {

    Optional<FieldUser> findByLogin(String login);

    boolean existsByLogin(String login);

    @Query("""
            select case when count(u) > 0 then true else false end
              from FieldUser u
             where u.role = :role
               and u.active = true
            """)
    boolean existsActiveWithRole(@Param("role") UserRole role);

    @Query("""
            select u
              from FieldUser u
             where u.role = :role
               and u.active = true
             order by u.login
            """)
    List<FieldUser> findActiveByRole(@Param("role") UserRole role);

    List<FieldUser> findByActiveTrueOrderByLoginAsc();

    List<FieldUser> findAllByOrderByRoleAscLoginAsc();
}
