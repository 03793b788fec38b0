package dev.flyzex.bot.adapter.inbound.web.controller;

import dev.flyzex.bot.adapter.inbound.web.dto.DecisionRequest;
import dev.flyzex.bot.domain.model.Application;
import dev.flyzex.bot.domain.model.ApplicationHistoryEntry;
import dev.flyzex.bot.domain.model.ApplicationStatistics;
import dev.flyzex.bot.domain.model.ApplicationStatus;
import dev.flyzex.bot.domain.model.Decision;
import dev.flyzex.bot.domain.model.DecisionResult;
import dev.flyzex.bot.domain.service.ApplicationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ApplicationsControllerTest {

    private ApplicationService applicationService;
    private ApplicationsController controller;

    @BeforeEach
    void setUp() {
        applicationService = mock(ApplicationService.class);
        controller = new ApplicationsController(applicationService);
    }

    @Test
    void shouldListPendingApplications() {
        Application first = Application.builder().userId(1L).fullName("A").answer("a").build();
        Application second = Application.builder().userId(2L).fullName("B").answer("b").build();
        when(applicationService.listPending()).thenReturn(List.of(first, second));

        StepVerifier.create(controller.getPending())
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertNotNull(response.getBody());
                    assertEquals(2, response.getBody().total());
                    assertEquals(List.of(first, second), response.getBody().applications());
                })
                .verifyComplete();
    }

    @Test
    void shouldReturnInsights() {
        ApplicationStatistics statistics = ApplicationStatistics.builder()
                .pending(1)
                .total(3)
                .statusCounts(Map.of("pending", 1, "denied", 2))
                .languages(Map.of("fa", 3))
                .averagePendingAnswerLength(12.5)
                .recentUpdates(List.of())
                .build();
        when(applicationService.getStatistics()).thenReturn(statistics);

        StepVerifier.create(controller.getInsights())
                .assertNext(response -> assertEquals(statistics, response.getBody()))
                .verifyComplete();
    }

    @Test
    void shouldReturnStatus() {
        ApplicationHistoryEntry entry = ApplicationHistoryEntry.builder()
                .status(ApplicationStatus.DENIED)
                .updatedAt("2024-05-01T12:00:00.000000+00:00")
                .note("later")
                .build();
        when(applicationService.getStatus(5L)).thenReturn(Optional.of(entry));

        StepVerifier.create(controller.getStatus(5L))
                .assertNext(response -> assertEquals(entry, response.getBody()))
                .verifyComplete();
    }

    @Test
    void shouldReturnNotFoundForUnknownStatus() {
        when(applicationService.getStatus(5L)).thenReturn(Optional.empty());

        ResponseStatusException error = assertThrows(ResponseStatusException.class, () -> controller.getStatus(5L));

        assertEquals(HttpStatus.NOT_FOUND, error.getStatusCode());
    }

    @Test
    void shouldApproveApplication() {
        when(applicationService.decide(5L, Decision.APPROVE, "welcome")).thenReturn(DecisionResult.DECIDED);

        StepVerifier.create(controller.decide(5L, new DecisionRequest(" Approve ", " welcome ")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertEquals("approved", response.getBody().status());
                })
                .verifyComplete();
    }

    @Test
    void shouldDenyWithoutNote() {
        when(applicationService.decide(5L, Decision.DENY, null)).thenReturn(DecisionResult.DECIDED);

        StepVerifier.create(controller.decide(5L, new DecisionRequest("deny", "  ")))
                .assertNext(response -> assertEquals("denied", response.getBody().status()))
                .verifyComplete();
    }

    @Test
    void shouldRejectUnknownDecision() {
        ResponseStatusException error = assertThrows(ResponseStatusException.class,
                () -> controller.decide(5L, new DecisionRequest("maybe", null)));

        assertEquals(HttpStatus.BAD_REQUEST, error.getStatusCode());
        assertThrows(ResponseStatusException.class, () -> controller.decide(5L, new DecisionRequest(null, null)));
        verify(applicationService, never()).decide(anyLong(), any(), any());
    }

    @Test
    void shouldReturnNotFoundWhenNothingIsPending() {
        when(applicationService.decide(5L, Decision.DENY, null)).thenReturn(DecisionResult.NOT_FOUND);

        ResponseStatusException error = assertThrows(ResponseStatusException.class,
                () -> controller.decide(5L, new DecisionRequest("deny", null)));

        assertEquals(HttpStatus.NOT_FOUND, error.getStatusCode());
    }
}
