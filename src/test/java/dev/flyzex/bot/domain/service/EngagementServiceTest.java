package dev.flyzex.bot.domain.service;

import dev.flyzex.bot.domain.model.Cup;
import dev.flyzex.bot.domain.model.LeaderboardEntry;
import dev.flyzex.bot.testsupport.MutableClock;
import dev.flyzex.bot.testsupport.TestStateStores;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EngagementServiceTest {

    private static final long CHAT_ID = -1001L;

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private EngagementService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T12:00:00Z"));
        service = new EngagementService(TestStateStores.create(tempDir), clock);
    }

    @Test
    void shouldAccumulateXpPerChat() {
        assertEquals(5L, service.addXp(CHAT_ID, 1L, 5));
        assertEquals(15L, service.addXp(CHAT_ID, 1L, 10));
        assertEquals(3L, service.addXp(-2002L, 1L, 3));
        assertEquals(15L, service.addXp(CHAT_ID, 1L, 0));
    }

    @Test
    void shouldAccumulateAndRankSingleUser() {
        assertEquals(5L, service.addXp(100L, 1L, 5));
        assertEquals(10L, service.addXp(100L, 1L, 5));

        assertEquals(List.of(new LeaderboardEntry(1L, 10L)), service.getLeaderboard(100L, 5));
    }

    @Test
    void shouldStoreCupPodiumInOrder() {
        service.addCup(100L, "Cup", "Desc", List.of("A", "B", "C"));

        List<Cup> cups = service.getCups(100L, 5);

        assertEquals(1, cups.size());
        assertEquals("Cup", cups.get(0).getTitle());
        assertEquals(List.of("A", "B", "C"), cups.get(0).getPodium());
    }

    @Test
    void shouldRejectNegativeXp() {
        assertThrows(IllegalArgumentException.class, () -> service.addXp(CHAT_ID, 1L, -1));
        assertTrue(service.getLeaderboard(CHAT_ID, 10).isEmpty());
    }

    @Test
    void shouldRejectXpThatWouldOverflowTotal() {
        service.addXp(CHAT_ID, 1L, Long.MAX_VALUE - 1);

        assertThrows(ArithmeticException.class, () -> service.addXp(CHAT_ID, 1L, 5));
        assertEquals(Long.MAX_VALUE - 1, service.getLeaderboard(CHAT_ID, 1).get(0).score());
    }

    @Test
    void shouldRankLeaderboardAndKeepTieOrder() {
        service.addXp(CHAT_ID, 1L, 10);
        service.addXp(CHAT_ID, 2L, 30);
        service.addXp(CHAT_ID, 3L, 10);
        service.addXp(CHAT_ID, 4L, 20);

        List<LeaderboardEntry> leaderboard = service.getLeaderboard(CHAT_ID, 3);

        assertEquals(List.of(new LeaderboardEntry(2L, 30), new LeaderboardEntry(4L, 20),
                new LeaderboardEntry(1L, 10)), leaderboard);
    }

    @Test
    void shouldReturnEmptyLeaderboardForUnknownChatOrNonPositiveLimit() {
        service.addXp(CHAT_ID, 1L, 10);

        assertTrue(service.getLeaderboard(42L, 10).isEmpty());
        assertTrue(service.getLeaderboard(CHAT_ID, 0).isEmpty());
        assertTrue(service.getLeaderboard(CHAT_ID, -5).isEmpty());
    }

    @Test
    void shouldCountConcurrentXpExactly() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<Long>> futures = new ArrayList<>();
            for (int i = 0; i < 40; i++) {
                futures.add(executor.submit(() -> service.addXp(CHAT_ID, 7L, 5)));
            }
            for (Future<Long> future : futures) {
                future.get();
            }
        } finally {
            executor.shutdown();
        }

        assertEquals(200L, service.getLeaderboard(CHAT_ID, 1).get(0).score());
    }

    @Test
    void shouldAddCupWithCleanPodium() {
        Cup cup = service.addCup(CHAT_ID, "  Raid Cup ", " weekly ", Arrays.asList(" @a ", "", null, "@b"));

        assertEquals("Raid Cup", cup.getTitle());
        assertEquals("weekly", cup.getDescription());
        assertEquals(List.of("@a", "@b"), cup.getPodium());
        assertEquals("2024-05-01T12:00:00.000000+00:00", cup.getCreatedAt());
    }

    @Test
    void shouldRejectBlankCupTitle() {
        assertThrows(IllegalArgumentException.class, () -> service.addCup(CHAT_ID, "  ", "d", List.of()));
        assertTrue(service.getCups(CHAT_ID, 5).isEmpty());
    }

    @Test
    void shouldListNewestCupsFirst() {
        service.addCup(CHAT_ID, "First", "", List.of());
        clock.advance(Duration.ofHours(1));
        service.addCup(CHAT_ID, "Second", "", List.of());
        clock.advance(Duration.ofHours(1));
        service.addCup(CHAT_ID, "Third", "", List.of());

        List<String> titles = service.getCups(CHAT_ID, 2).stream().map(Cup::getTitle).toList();

        assertEquals(List.of("Third", "Second"), titles);
        assertTrue(service.getCups(CHAT_ID, 0).isEmpty());
        assertTrue(service.getCups(99L, 5).isEmpty());
    }
}
