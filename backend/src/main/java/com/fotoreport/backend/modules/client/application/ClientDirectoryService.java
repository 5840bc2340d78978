package com.fotoreport.backend.modules.client.application;

import java.util.List;

import com.fotoreport.backend.global.common.Texts;
import com.fotoreport.backend.global.error.ProblemException;
import com.fotoreport.backend.modules.client.domain.Client;
import com.fotoreport.backend.modules.client.domain.Location;
import com.fotoreport.backend.modules.client.infrastructure.persistence.ClientRepository;
import com.fotoreport.backend.modules.client.infrastructure.persistence.LocationRepository;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

/**
 * Maintains the client directory and the sites that belong to each client.
 */
@Service
@Validated
@Transactional
public class ClientDirectoryService {

    private static final Logger log = LoggerFactory.getLogger(ClientDirectoryService.class);

    private final ClientRepository clientRepository;
    private final LocationRepository locationRepository;

    public ClientDirectoryService(ClientRepository clientRepository, LocationRepository locationRepository) {
        this.clientRepository = clientRepository;
        this.locationRepository = locationRepository;
    }

    public Client createClient(@NotBlank String name) {
        String trimmed = Texts.trimToEmpty(name);
        if (trimmed.isEmpty()) {
            throw ProblemException.invalid("client.name_required", "Client name must not be blank.");
        }
        if (clientRepository.existsByName(trimmed)) {
            throw ProblemException.conflict("client.name_taken", "Client already exists: " + trimmed);
        }

        Client client = new Client();
        client.setName(trimmed);
        client.setActive(true);
        Client saved = clientRepository.save(client);
        log.info("Created client '{}' (id={})", saved.getName(), saved.getId());
        return saved;
    }

    public Location createLocation(@Valid @NonNull CreateLocationCommand command) {
        Client client = findClient(command.clientId());
        String siteName = Texts.trimToEmpty(command.siteName());
        if (siteName.isEmpty()) {
            throw ProblemException.invalid("location.name_required", "Site name must not be blank.");
        }

        Location location = new Location();
        location.setClient(client);
        location.setSiteCode(Texts.blankToNull(command.siteCode()));
        location.setSiteName(siteName);
        location.setAddress(Texts.blankToNull(command.address()));
        location.setCity(Texts.blankToNull(command.city()));
        location.setActive(true);
        Location saved = locationRepository.save(location);
        log.info("Created location '{}' for client '{}' (id={})", saved.getSiteName(), client.getName(), saved.getId());
        return saved;
    }

    @Transactional(readOnly = true)
    public List<Client> listActiveClients() {
        return clientRepository.findByActiveTrueOrderByNameAsc();
    }

    @Transactional(readOnly = true)
    public List<Client> listAllClients() {
        return clientRepository.findAllByOrderByNameAsc();
    }

    /**
     * Locations that are active and whose client is active, ordered by client then site name.
     */
    @Transactional(readOnly = true)
    public List<Location> listActiveLocations() {
        return locationRepository.findActiveWithActiveClient();
    }

    @Transactional(readOnly = true)
    public List<Location> listLocations(@NonNull Long clientId) {
        findClient(clientId);
        return locationRepository.findByClientId(clientId);
    }

    public Client setClientActive(@NonNull Long clientId, boolean active) {
        Client client = findClient(clientId);
        client.setActive(active);
        return client;
    }

    public Location setLocationActive(@NonNull Long locationId, boolean active) {
        Location location = locationRepository.findWithClient(locationId)
                .orElseThrow(() -> locationNotFound(locationId));
        location.setActive(active);
        return location;
    }

    /**
     * Removes the client row; the database cascades to its locations, their assignments,
     * reports and photos.
     */
    public void deleteClient(@NonNull Long clientId) {
        Client client = findClient(clientId);
        clientRepository.delete(client);
        clientRepository.flush();
        log.info("Deleted client '{}' (id={})", client.getName(), clientId);
    }

    Client findClient(Long clientId) {
        return clientRepository.findById(clientId)
                .orElseThrow(() -> ProblemException.notFound("client.not_found", "No client with id " + clientId));
    }

    private static ProblemException locationNotFound(Long locationId) {
        return ProblemException.notFound("location.not_found", "No location with id " + locationId);
    }
}
