package dev.flyzex.bot.adapter.inbound.web.controller;

import dev.flyzex.bot.domain.model.Cup;
import dev.flyzex.bot.domain.model.LeaderboardEntry;
import dev.flyzex.bot.domain.service.EngagementService;
import dev.flyzex.bot.infrastructure.config.BotProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Read-only engagement API: XP leaderboard and cups of a group chat.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class EngagementController {

    private final EngagementService engagementService;
    private final BotProperties properties;

    @GetMapping("/xp")
    public Mono<ResponseEntity<LeaderboardResponse>> getLeaderboard(
            @RequestParam("chat_id") long chatId,
            @RequestParam(value = "limit", required = false) Integer limit) {
        int effectiveLimit = resolveLimit(limit, properties.getXp().getLeaderboardSize());
        List<LeaderboardEntry> leaderboard = engagementService.getLeaderboard(chatId, effectiveLimit);
        return Mono.just(ResponseEntity.ok(new LeaderboardResponse(chatId, effectiveLimit, leaderboard)));
    }

    @GetMapping("/cups")
    public Mono<ResponseEntity<CupsResponse>> getCups(
            @RequestParam("chat_id") long chatId,
            @RequestParam(value = "limit", required = false) Integer limit) {
        int effectiveLimit = resolveLimit(limit, properties.getCups().getLeaderboardSize());
        List<Cup> cups = engagementService.getCups(chatId, effectiveLimit);
        return Mono.just(ResponseEntity.ok(new CupsResponse(chatId, effectiveLimit, cups)));
    }

    private static int resolveLimit(Integer requested, int defaultLimit) {
        int limit = requested != null ? requested : defaultLimit;
        if (limit < 1) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "limit must be at least 1");
        }
        return limit;
    }

    record LeaderboardResponse(long chatId, int limit, List<LeaderboardEntry> leaderboard) {
    }

    record CupsResponse(long chatId, int limit, List<Cup> cups) {
    }
}
