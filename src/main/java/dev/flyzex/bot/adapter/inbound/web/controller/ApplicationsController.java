package dev.flyzex.bot.adapter.inbound.web.controller;

import dev.flyzex.bot.adapter.inbound.web.dto.DecisionRequest;
import dev.flyzex.bot.domain.model.Application;
import dev.flyzex.bot.domain.model.ApplicationHistoryEntry;
import dev.flyzex.bot.domain.model.ApplicationStatistics;
import dev.flyzex.bot.domain.model.Decision;
import dev.flyzex.bot.domain.model.DecisionResult;
import dev.flyzex.bot.domain.service.ApplicationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Locale;

/**
 * Application review API: pending queue, insights, per-user status and
 * decisions.
 */
@RestController
@RequestMapping("/api/applications")
@RequiredArgsConstructor
@Slf4j
public class ApplicationsController {

    private final ApplicationService applicationService;

    @GetMapping("/pending")
    public Mono<ResponseEntity<PendingResponse>> getPending() {
        List<Application> pending = applicationService.listPending();
        return Mono.just(ResponseEntity.ok(new PendingResponse(pending.size(), pending)));
    }

    @GetMapping("/insights")
    public Mono<ResponseEntity<ApplicationStatistics>> getInsights() {
        return Mono.just(ResponseEntity.ok(applicationService.getStatistics()));
    }

    @GetMapping("/{userId}/status")
    public Mono<ResponseEntity<ApplicationHistoryEntry>> getStatus(@PathVariable long userId) {
        ApplicationHistoryEntry entry = applicationService.getStatus(userId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "No application history"));
        return Mono.just(ResponseEntity.ok(entry));
    }

    @PostMapping("/{userId}/decision")
    public Mono<ResponseEntity<DecisionResponse>> decide(@PathVariable long userId,
            @RequestBody DecisionRequest request) {
        Decision decision = parseDecision(request != null ? request.getDecision() : null);
        String note = request.getNote() != null && !request.getNote().isBlank() ? request.getNote().trim() : null;

        DecisionResult result = applicationService.decide(userId, decision, note);
        if (result == DecisionResult.NOT_FOUND) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "No pending application");
        }
        log.info("[API] Application of {} decided: {}", userId, decision);
        return Mono.just(ResponseEntity.ok(new DecisionResponse(decision.toStatus().getValue())));
    }

    private static Decision parseDecision(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "decision is required");
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
        case "approve" -> Decision.APPROVE;
        case "deny" -> Decision.DENY;
        default -> throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                "decision must be 'approve' or 'deny'");
        };
    }

    record PendingResponse(int total, List<Application> applications) {
    }

    record DecisionResponse(String status) {
    }
}
