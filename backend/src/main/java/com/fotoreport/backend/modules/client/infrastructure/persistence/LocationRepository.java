package com.fotoreport.backend.modules.client.infrastructure.persistence;

import java.util.List;
import java.util.Optional;

import com.fotoreport.backend.modules.client.domain.Location;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface LocationRepository extends JpaRepository<Location, Long> {

    @Query("""
            select l
              from Location l
              join fetch l.client c
             where l.active = true
               and c.active = true
             order by c.name, l.siteName
            """)
    List<Location> findActiveWithActiveClient();

    @Query("""
            select l
              from Location l
              join fetch l.client c
             where c.id = :clientId
             order by l.siteName
            """)
    List<Location> findByClientId(@Param("clientId") Long clientId);

    @Query("select l from Location l join fetch l.client where l.id = :id")
    Optional<Location> findWithClient(@Param("id") Long id);
}
