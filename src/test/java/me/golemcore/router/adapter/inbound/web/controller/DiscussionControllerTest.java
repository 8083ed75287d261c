package me.golemcore.router.adapter.inbound.web.controller;

import me.golemcore.router.domain.model.DiscussionLog;
import me.golemcore.router.domain.model.DiscussionRequest;
import me.golemcore.router.domain.model.DiscussionResult;
import me.golemcore.router.domain.service.GroupDiscussionOrchestrator;
import me.golemcore.router.domain.service.OptimizationManager;
import me.golemcore.router.infrastructure.config.RouterProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DiscussionControllerTest {

    private OptimizationManager optimizationManager;
    private GroupDiscussionOrchestrator orchestrator;
    private DiscussionController controller;

    @BeforeEach
    void setUp() {
        optimizationManager = mock(OptimizationManager.class);
        orchestrator = mock(GroupDiscussionOrchestrator.class);
        RouterProperties properties = new RouterProperties();
        properties.getDiscussion().setMaxRounds(5);
        controller = new DiscussionController(optimizationManager, orchestrator, properties);
    }

    @Test
    void shouldRunDiscussion() {
        DiscussionRequest request = DiscussionRequest.of("Compare two designs");
        DiscussionResult result = DiscussionResult.builder()
                .response("synthesis")
                .discussionId("disc_1")
                .rounds(2)
                .success(true)
                .build();
        when(optimizationManager.conductDiscussion(request)).thenReturn(result);

        StepVerifier.create(controller.startDiscussion(request))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertEquals("synthesis", response.getBody().getResponse());
                })
                .verifyComplete();
    }

    @Test
    void shouldRejectInvalidDiscussionRequests() {
        DiscussionRequest noQuery = DiscussionRequest.of(" ");
        DiscussionRequest zeroRounds = DiscussionRequest.builder().query("q").rounds(0).build();
        DiscussionRequest tooManyRounds = DiscussionRequest.builder().query("q").rounds(100_000).build();

        assertEquals(HttpStatus.BAD_REQUEST, assertThrows(ResponseStatusException.class,
                () -> controller.startDiscussion(noQuery)).getStatusCode());
        assertEquals(HttpStatus.BAD_REQUEST, assertThrows(ResponseStatusException.class,
                () -> controller.startDiscussion(zeroRounds)).getStatusCode());
        assertEquals(HttpStatus.BAD_REQUEST, assertThrows(ResponseStatusException.class,
                () -> controller.startDiscussion(tooManyRounds)).getStatusCode());
        verify(optimizationManager, never()).conductDiscussion(any());
    }

    @Test
    void shouldListDiscussionIds() {
        when(orchestrator.listDiscussions()).thenReturn(List.of("disc_1", "disc_2"));

        StepVerifier.create(controller.listDiscussions())
                .assertNext(response -> assertEquals(List.of("disc_1", "disc_2"), response.getBody()))
                .verifyComplete();
    }

    @Test
    void shouldReturnStoredDiscussion() {
        DiscussionLog log = DiscussionLog.builder().id("disc_1").query("q").rounds(List.of()).build();
        when(orchestrator.getDiscussion("disc_1")).thenReturn(Optional.of(log));

        StepVerifier.create(controller.getDiscussion("disc_1"))
                .assertNext(response -> assertEquals(log, response.getBody()))
                .verifyComplete();
    }

    @Test
    void shouldReturn404ForUnknownDiscussion() {
        when(orchestrator.getDiscussion("nope")).thenReturn(Optional.empty());

        ResponseStatusException error = assertThrows(ResponseStatusException.class,
                () -> controller.getDiscussion("nope"));

        assertEquals(HttpStatus.NOT_FOUND, error.getStatusCode());
    }
}
