package com.fotoreport.backend.support;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import com.fotoreport.backend.modules.account.application.CreateUserCommand;
import com.fotoreport.backend.modules.account.application.UserAccountService;
import com.fotoreport.backend.modules.account.domain.FieldUser;
import com.fotoreport.backend.modules.account.domain.UserRole;
import com.fotoreport.backend.modules.client.application.ClientDirectoryService;
import com.fotoreport.backend.modules.client.application.CreateLocationCommand;
import com.fotoreport.backend.modules.client.domain.Client;
import com.fotoreport.backend.modules.client.domain.Location;
import com.fotoreport.backend.modules.report.application.FileReportCommand;
import com.fotoreport.backend.modules.report.application.PhotoUpload;
import com.fotoreport.backend.modules.report.application.VisitReportService;

import org.springframework.stereotype.Component;

@Component
public class TestDataFactory {

    private final UserAccountService userAccountService;
    private final ClientDirectoryService clientDirectoryService;
    private final VisitReportService visitReportService;

    public TestDataFactory(
            UserAccountService userAccountService,
            ClientDirectoryService clientDirectoryService,
            VisitReportService visitReportService
    ) {
        this.userAccountService = userAccountService;
        this.clientDirectoryService = clientDirectoryService;
        this.visitReportService = visitReportService;
    }

    public FieldUser worker(String login) {
        return userAccountService.createUser(
                new CreateUserCommand(login, "Worker " + login, login + "@example.com", UserRole.WORKER, "secret1!"));
    }

    public FieldUser admin(String login) {
        return userAccountService.createUser(
                new CreateUserCommand(login, "Admin " + login, null, UserRole.ADMIN, "admin1!"));
    }

    public Client client(String name) {
        return clientDirectoryService.createClient(name);
    }

    public Location location(Client client, String siteName) {
        return clientDirectoryService.createLocation(
                new CreateLocationCommand(client.getId(), null, siteName, null, "Lima"));
    }

    public Long report(Location location, FieldUser author, LocalDate visitDate, int photoCount) {
        List<PhotoUpload> photos = new ArrayList<>();
        for (int i = 0; i < photoCount; i++) {
            photos.add(photo("photo-" + i + ".jpg"));
        }
        return visitReportService.fileReport(
                new FileReportCommand(location.getId(), author.getId(), visitDate, "visit notes", photos));
    }

    public static PhotoUpload photo(String fileName) {
        return new PhotoUpload(fileName, "image/jpeg", new byte[]{(byte) 0xFF, (byte) 0xD8, 0x01, 0x02}, "front door");
    }
}
