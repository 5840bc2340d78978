package com.fotoreport.backend.modules.assignment.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

import com.fotoreport.backend.modules.assignment.domain.Assignment;
import com.fotoreport.backend.modules.client.domain.Location;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AssignmentRepository extends JpaRepository<Assignment, Long> {

    @Query("select a from Assignment a where a.user.id = :userId and a.location.id = :locationId")
    Optional<Assignment> findByUserAndLocation(@Param("userId") Long userId, @Param("locationId") Long locationId);

    /**
     * Inserts an active assignment unless the pair already exists. Returns the number of rows inserted.
     */
    @Modifying
    @Query(value = """
            INSERT INTO asignaciones (usuario_id, local_id, activo, asignado_en)
            VALUES (:userId, :locationId, TRUE, :assignedAt)
            ON CONFLICT (usuario_id, local_id) DO NOTHING
            """, nativeQuery = true)
    int insertIfAbsent(
            @Param("userId") Long userId,
            @Param("locationId") Long locationId,
            @Param("assignedAt") OffsetDateTime assignedAt
    );

    @Query("""
            select a
              from Assignment a
              join fetch a.user u
              join fetch a.location l
              join fetch l.client c
             order by u.login, c.name, l.siteName
            """)
    List<Assignment> findAllWithUserAndLocation();

    @Query("""
            select a
              from Assignment a
              join fetch a.user u
              join fetch a.location l
              join fetch l.client c
             where u.id = :userId
             order by c.name, l.siteName
            """)
    List<Assignment> findByUserId(@Param("userId") Long userId);

    @Query("""
            select a
              from Assignment a
              join fetch a.user u
              join fetch a.location l
              join fetch l.client
             where l.id = :locationId
             order by u.login
            """)
    List<Assignment> findByLocationId(@Param("locationId") Long locationId);

    @Query("""
            select l
              from Assignment a
              join a.location l
              join fetch l.client c
             where a.user.id = :userId
               and a.active = true
               and l.active = true
               and c.active = true
             order by c.name, l.siteName
            """)
    List<Location> findActiveAssignedLocations(@Param("userId") Long userId);
}
