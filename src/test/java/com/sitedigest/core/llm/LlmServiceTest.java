package com.sitedigest.core.llm;

import com.sitedigest.core.model.PageSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.client.ChatClient.CallResponseSpec;
import org.springframework.ai.chat.client.ChatClient.ChatClientRequestSpec;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link LlmService}.
 * <p>
 * Mocks the entire {@link ChatClient} chain so no real model calls are made.
 */
class LlmServiceTest {

    private ChatClientRequestSpec mockRequestSpec;
    private CallResponseSpec mockCallResponse;
    private LlmService llmService;

    @BeforeEach
    void setUp() {
        ChatClient mockChatClient = mock(ChatClient.class);
        mockRequestSpec = mock(ChatClientRequestSpec.class);
        mockCallResponse = mock(CallResponseSpec.class);

        // Wire up the fluent API chain
        when(mockChatClient.prompt()).thenReturn(mockRequestSpec);
        when(mockRequestSpec.system(anyString())).thenReturn(mockRequestSpec);
        when(mockRequestSpec.user(anyString())).thenReturn(mockRequestSpec);
        when(mockRequestSpec.call()).thenReturn(mockCallResponse);

        ChatClient.Builder mockBuilder = mock(ChatClient.Builder.class);
        when(mockBuilder.build()).thenReturn(mockChatClient);

        llmService = new LlmService(mockBuilder, "http://test:1234");
    }

    @Test
    @DisplayName("structuredCall sends the system prompt and appends format instructions to the user prompt")
    void sendsPrompts() {
        when(mockCallResponse.content()).thenReturn("{\"title\":\"T\",\"description\":\"D\"}");

        llmService.structuredCall("System prompt", "User prompt", PageSummary.class);

        verify(mockRequestSpec).system("System prompt");
        ArgumentCaptor<String> userCaptor = ArgumentCaptor.forClass(String.class);
        verify(mockRequestSpec).user(userCaptor.capture());
        String capturedUser = userCaptor.getValue();
        assertTrue(capturedUser.startsWith("User prompt\n\n"));
        assertTrue(capturedUser.length() > "User prompt\n\n".length(), "Should contain format instructions");
    }

    @Test
    @DisplayName("structuredCall deserializes the JSON answer into the target type")
    void deserializes() {
        when(mockCallResponse.content()).thenReturn("""
                {"title":"Pricing","description":"Plans and prices for the hosted product."}
                """);

        PageSummary result = llmService.structuredCall("s", "u", PageSummary.class);

        assertEquals("Pricing", result.title());
        assertEquals("Plans and prices for the hosted product.", result.description());
    }

    @Test
    @DisplayName("an answer wrapped in a markdown fence with extra fields is still read")
    void lenientFallback() {
        when(mockCallResponse.content()).thenReturn("""
                ```json
                {"title":"Docs","description":"Getting started guide.","confidence":0.9}
                ```
                """);

        PageSummary result = llmService.structuredCall("s", "u", PageSummary.class);

        assertEquals("Docs", result.title());
        assertEquals("Getting started guide.", result.description());
    }

    @Test
    @DisplayName("empty content raises LlmEmptyResponseException")
    void emptyContent() {
        when(mockCallResponse.content()).thenReturn("  ");

        assertThrows(LlmEmptyResponseException.class,
                () -> llmService.structuredCall("s", "u", PageSummary.class));
    }

    @Test
    @DisplayName("content that is not JSON raises LlmParseException")
    void notJson() {
        when(mockCallResponse.content()).thenReturn("Sorry, I cannot summarize this page.");

        var e = assertThrows(LlmParseException.class,
                () -> llmService.structuredCall("s", "u", PageSummary.class));
        assertTrue(e.getMessage().contains("PageSummary"));
    }

    @Test
    @DisplayName("stripCodeFence removes json and bare fences")
    void stripCodeFence() {
        assertEquals("{}", LlmService.stripCodeFence("```json\n{}\n```"));
        assertEquals("{}", LlmService.stripCodeFence("```{}```"));
        assertEquals("{}", LlmService.stripCodeFence("  {}  "));
    }
}
