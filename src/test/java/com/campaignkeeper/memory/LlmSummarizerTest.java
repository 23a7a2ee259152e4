package com.campaignkeeper.memory;

import com.campaignkeeper.model.Turn;
import dev.langchain4j.model.chat.ChatModel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("LlmSummarizer")
class LlmSummarizerTest {

    private static final Instant START = Instant.parse("2026-03-01T18:00:00Z");

    @Mock
    private ChatModel chatModel;

    private LlmSummarizer summarizer;

    @BeforeEach
    void setUp() {
        summarizer = new LlmSummarizer(chatModel);
    }

    @Test
    @DisplayName("Should send the previous summary and labelled turns to the model")
    void shouldBuildPrompt() {
        when(chatModel.chat(anyString())).thenReturn("The party met Brannoc.");
        List<Turn> turns = List.of(
            Turn.player("hello there", START, "scene-0001"),
            Turn.npc("I am Brannoc.", START.plusSeconds(1), "scene-0001"));

        String summary = summarizer.summarize("They arrived at the inn.", turns, 600);

        assertEquals("The party met Brannoc.", summary);
        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(chatModel).chat(prompt.capture());
        assertTrue(prompt.getValue().contains("Previous summary (keep all of its facts):\nThey arrived at the inn."));
        assertTrue(prompt.getValue().contains("Player: hello there"));
        assertTrue(prompt.getValue().contains("NPC: I am Brannoc."));
        assertTrue(prompt.getValue().contains("under 600 characters"));
    }

    @Test
    @DisplayName("Should propagate model failures")
    void shouldPropagateFailure() {
        when(chatModel.chat(anyString())).thenThrow(new RuntimeException("quota exceeded"));

        assertThrows(RuntimeException.class,
            () -> summarizer.summarize(null, List.of(Turn.player("hi", START, null)), 600));
    }
}
