package com.campaignkeeper.memory;

import com.campaignkeeper.model.Turn;
import dev.langchain4j.model.chat.ChatModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Summarizer backed by a langchain4j chat model.
 *
 * <p>Failures are not papered over: exceptions from the model propagate so the compressor can
 * report them and keep the uncompressed buffer.</p>
 */
public class LlmSummarizer implements Summarizer {

    private static final Logger log = LoggerFactory.getLogger(LlmSummarizer.class);

    private static final String SUMMARIZATION_PROMPT = """
        Summarise the following part of a tabletop role-playing session as concise third-person prose.
        Preserve: resolved and still-open plot facts, changes in relationships with NPCs,
        every newly introduced name, and where the party moved from and to.
        Do not quote dialogue verbatim. Do not invent facts.
        Keep the summary under %d characters.

        %s
        Provide the summary only:
        """;

    private final ChatModel chatModel;

    public LlmSummarizer(ChatModel chatModel) {
        this.chatModel = chatModel;
    }

    @Override
    public String summarize(String previousSummary, List<Turn> turns, int maxChars) {
        StringBuilder conversationText = new StringBuilder();

        if (previousSummary != null && !previousSummary.isBlank()) {
            conversationText.append("Previous summary (keep all of its facts):\n")
                .append(previousSummary).append("\n\n");
            conversationText.append("New turns to incorporate:\n");
        } else {
            conversationText.append("Turns to summarise:\n");
        }

        for (Turn turn : turns) {
            conversationText.append(speakerLabel(turn)).append(": ").append(turn.content()).append("\n");
        }

        String prompt = String.format(SUMMARIZATION_PROMPT, maxChars, conversationText);
        log.debug("Requesting summary of {} turns ({} prompt chars)", turns.size(), prompt.length());
        return chatModel.chat(prompt);
    }

    private static String speakerLabel(Turn turn) {
        return switch (turn.role()) {
            case PLAYER -> "Player";
            case NARRATOR -> "Narrator";
            case NPC -> "NPC";
        };
    }
}
