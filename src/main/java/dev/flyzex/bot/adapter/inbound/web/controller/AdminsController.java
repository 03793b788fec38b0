package dev.flyzex.bot.adapter.inbound.web.controller;

import dev.flyzex.bot.adapter.inbound.web.dto.AdminRequest;
import dev.flyzex.bot.domain.model.AdminProfile;
import dev.flyzex.bot.domain.service.AdminService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Admin registry API.
 */
@RestController
@RequestMapping("/api/admins")
@RequiredArgsConstructor
@Slf4j
public class AdminsController {

    private static final int MAX_USERNAME_LENGTH = 64;
    private static final int MAX_FULL_NAME_LENGTH = 128;

    private final AdminService adminService;

    @GetMapping
    public Mono<ResponseEntity<AdminsResponse>> listAdmins() {
        List<AdminProfile> admins = adminService.getAdminDetails();
        return Mono.just(ResponseEntity.ok(new AdminsResponse(admins.size(), admins)));
    }

    @PostMapping
    public Mono<ResponseEntity<AdminChangeResponse>> addAdmin(@RequestBody AdminRequest request) {
        validate(request);
        long userId = request.getUserId();
        boolean existed = adminService.isAdmin(userId);
        boolean changed = adminService.addAdmin(userId, request.getUsername(), request.getFullName());
        if (!changed) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "Admin already exists with the same details");
        }
        log.info("[API] Admin {} {}", userId, existed ? "updated" : "created");
        return Mono.just(ResponseEntity.ok(new AdminChangeResponse(existed ? "updated" : "created")));
    }

    @DeleteMapping("/{userId}")
    public Mono<ResponseEntity<Void>> removeAdmin(@PathVariable long userId) {
        if (!adminService.removeAdmin(userId)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Admin not found");
        }
        log.info("[API] Admin {} removed", userId);
        return Mono.just(ResponseEntity.noContent().build());
    }

    private static void validate(AdminRequest request) {
        if (request == null || request.getUserId() == null || request.getUserId() < 1) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "user_id must be a positive number");
        }
        if (request.getUsername() != null && request.getUsername().length() > MAX_USERNAME_LENGTH) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                    "username must be at most " + MAX_USERNAME_LENGTH + " characters");
        }
        if (request.getFullName() != null && request.getFullName().length() > MAX_FULL_NAME_LENGTH) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                    "full_name must be at most " + MAX_FULL_NAME_LENGTH + " characters");
        }
    }

    record AdminsResponse(int total, List<AdminProfile> admins) {
    }

    record AdminChangeResponse(String status) {
    }
}
