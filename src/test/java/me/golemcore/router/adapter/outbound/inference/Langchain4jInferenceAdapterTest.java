package me.golemcore.router.adapter.outbound.inference;

import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import me.golemcore.router.domain.model.InferenceRequest;
import me.golemcore.router.domain.model.InferenceResponse;
import me.golemcore.router.infrastructure.config.RouterProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class Langchain4jInferenceAdapterTest {

    private RouterProperties properties;
    private Langchain4jInferenceAdapter adapter;

    @BeforeEach
    void setUp() {
        properties = new RouterProperties();
        properties.getInference().setBaseUrl("http://127.0.0.1:1/v1");
        properties.getInference().setMaxRetries(0);
        properties.getInference().setTimeoutMs(2000);
        adapter = new Langchain4jInferenceAdapter(properties);
    }

    @Test
    void shouldPutSystemPromptBeforeUserMessage() {
        List<ChatMessage> messages = adapter.toMessages(InferenceRequest.builder()
                .model("m")
                .systemPrompt("You are terse.")
                .prompt("Hello")
                .build());

        assertEquals(2, messages.size());
        assertInstanceOf(SystemMessage.class, messages.get(0));
        assertEquals("You are terse.", ((SystemMessage) messages.get(0)).text());
        assertEquals("Hello", ((UserMessage) messages.get(1)).singleText());
    }

    @Test
    void shouldOmitBlankSystemPrompt() {
        List<ChatMessage> messages = adapter.toMessages(InferenceRequest.builder().model("m").prompt("Hi").build());

        assertEquals(1, messages.size());
        assertInstanceOf(UserMessage.class, messages.get(0));
    }

    @Test
    void shouldReportUnreachableEndpointAsFailure() throws Exception {
        InferenceResponse response = adapter.generate(InferenceRequest.builder()
                .model("qwen2.5-coder:7b")
                .prompt("ping")
                .build()).get(30, TimeUnit.SECONDS);

        assertFalse(response.isSuccess());
        assertNotNull(response.getError());
        assertEquals("qwen2.5-coder:7b", response.getModel());
    }

    @Test
    void shouldBeAvailableOnlyWithBaseUrl() {
        assertTrue(adapter.isAvailable());
        properties.getInference().setBaseUrl(" ");
        assertFalse(adapter.isAvailable());
        assertEquals("langchain4j", adapter.getProviderId());
    }
}
