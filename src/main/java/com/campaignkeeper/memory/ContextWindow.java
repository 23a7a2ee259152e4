package com.campaignkeeper.memory;

import com.campaignkeeper.model.Turn;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;

import java.util.ArrayList;
import java.util.List;

/**
 * The compressed view of a scene handed to the language-generation collaborator:
 * rolling summary, uncompressed turns and a world-state excerpt.
 */
public record ContextWindow(
    String sceneTitle,
    String rollingSummary,
    List<Turn> activeTurns,
    String worldExcerpt,
    String planOutline,
    List<String> recentScenes
) {

    public static final String SUMMARY_PREFIX = "Summary of earlier conversation:\n";

    public ContextWindow {
        activeTurns = List.copyOf(activeTurns);
        recentScenes = List.copyOf(recentScenes);
    }

    /**
     * Renders the window as chat messages: instructions and context as system messages, player
     * turns as user messages, narrator and NPC turns as assistant messages.
     */
    public List<ChatMessage> toChatMessages(String instructions) {
        List<ChatMessage> messages = new ArrayList<>();
        messages.add(SystemMessage.from(instructions));
        StringBuilder context = new StringBuilder("Current scene: ").append(sceneTitle);
        if (worldExcerpt != null && !worldExcerpt.isBlank()) {
            context.append("\nWorld state:\n").append(worldExcerpt);
        }
        if (planOutline != null && !planOutline.isBlank()) {
            context.append("\nStory plan: ").append(planOutline);
        }
        if (!recentScenes.isEmpty()) {
            context.append("\nEarlier scenes:\n- ").append(String.join("\n- ", recentScenes));
        }
        messages.add(SystemMessage.from(context.toString()));
        if (rollingSummary != null && !rollingSummary.isBlank()) {
            messages.add(SystemMessage.from(SUMMARY_PREFIX + rollingSummary));
        }
        for (Turn turn : activeTurns) {
            switch (turn.role()) {
                case PLAYER -> messages.add(UserMessage.from(turn.content()));
                case NARRATOR -> messages.add(AiMessage.from(turn.content()));
                case NPC -> messages.add(AiMessage.from("[NPC] " + turn.content()));
            }
        }
        return messages;
    }
}
