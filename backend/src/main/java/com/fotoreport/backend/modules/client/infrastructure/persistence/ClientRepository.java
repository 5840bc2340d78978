package com.fotoreport.backend.modules.client.infrastructure.persistence;

import java.util.List;

import com.fotoreport.backend.modules.client.domain.Client;

import org.springframework.data.jpa.repository.JpaRepository;

public interface ClientRepository extends JpaRepository<Client, Long> {

    boolean existsByName(String name);

    List<Client> findByActiveTrueOrderByNameAsc();

    List<Client> findAllByOrderByNameAsc();
}
