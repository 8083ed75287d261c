package me.golemcore.router.adapter.outbound.inference;

import me.golemcore.router.domain.model.InferenceRequest;
import me.golemcore.router.domain.model.InferenceResponse;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NoOpInferenceAdapterTest {

    private final NoOpInferenceAdapter adapter = new NoOpInferenceAdapter();

    @Test
    void shouldFailEveryRequest() throws Exception {
        InferenceResponse response = adapter.generate(InferenceRequest.builder().model("m").prompt("hi").build())
                .get();

        assertFalse(response.isSuccess());
        assertFalse(response.hasText());
        assertEquals("m", response.getModel());
        assertTrue(response.getError().contains("No inference provider"));
    }

    @Test
    void shouldReportUnavailable() {
        assertEquals("none", adapter.getProviderId());
        assertFalse(adapter.isAvailable());
    }
}
