package org.example.storybook.service.workflow;

import org.example.storybook.model.ConversationContext;
import org.example.storybook.service.ConversationContextManager;
import org.example.storybook.service.llm.ConversationTurn;
import org.example.storybook.service.llm.ConversationalLlmProvider;
import org.example.storybook.service.llm.LlmOptions;
import org.example.storybook.service.llm.ProviderContinuation;
import org.example.storybook.service.llm.ProviderContinuityDegenerateException;
import org.example.storybook.service.llm.ResponseIdContinuation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ContextualTextGeneratorTest {

    private static final LlmOptions OPTIONS = LlmOptions.narrative(2500);

    @Mock
    private ConversationContextManager contextManager;

    @Mock
    private ConversationalLlmProvider provider;

    private ContextualTextGenerator generator;

    @BeforeEach
    void setUp() {
        generator = new ContextualTextGenerator(contextManager);
    }

    @Test
    void generate_passesStoredContinuationAndStoresTheNewOne() {
        when(provider.getProviderName()).thenReturn("xai");
        ResponseIdContinuation previous = new ResponseIdContinuation("resp-1");
        ResponseIdContinuation next = new ResponseIdContinuation("resp-2");
        ConversationContext context = context(Map.of("xai", previous));
        when(provider.continueConversation("system prompt", previous, "write chapter 2", OPTIONS))
                .thenReturn(new ConversationTurn("  Chapter two text.  ", next));

        String text = generator.generate(provider, context, "write chapter 2", OPTIONS);

        assertEquals("Chapter two text.", text);
        verify(contextManager).updateProviderData("story-1-run-1", "xai", next);
    }

    @Test
    void generate_emptyTurn_fallsBackToStatelessCallWithoutTouchingSlot() {
        when(provider.getProviderName()).thenReturn("xai");
        ConversationContext context = context(Map.of());
        when(provider.continueConversation("system prompt", null, "write chapter 1", OPTIONS))
                .thenReturn(new ConversationTurn("", null));
        when(provider.generate("system prompt\n\nwrite chapter 1", OPTIONS)).thenReturn("Fallback text.");

        String text = generator.generate(provider, context, "write chapter 1", OPTIONS);

        assertEquals("Fallback text.", text);
        verifyNoInteractions(contextManager);
    }

    @Test
    void generate_fallbackAlsoEmpty_throwsDegenerateError() {
        when(provider.getProviderName()).thenReturn("xai");
        ConversationContext context = context(Map.of());
        when(provider.continueConversation("system prompt", null, "write chapter 1", OPTIONS)).thenReturn(null);
        when(provider.generate("system prompt\n\nwrite chapter 1", OPTIONS)).thenReturn("   ");

        ProviderContinuityDegenerateException error = assertThrows(ProviderContinuityDegenerateException.class,
                () -> generator.generate(provider, context, "write chapter 1", OPTIONS));

        assertEquals("story-1-run-1", error.getContextId());
        verify(contextManager, never()).updateProviderData(anyString(), anyString(), any());
    }

    @Test
    void statelessPrompt_withoutSystemPrompt_returnsPromptOnly() {
        assertEquals("hello", ContextualTextGenerator.statelessPrompt(null, "hello"));
        assertEquals("sys\n\nhello", ContextualTextGenerator.statelessPrompt("sys", "hello"));
    }

    private static ConversationContext context(Map<String, ProviderContinuation> slots) {
        LocalDateTime now = LocalDateTime.now();
        return new ConversationContext("story-1-run-1", "story-1", "system prompt", slots, now, now);
    }
}
