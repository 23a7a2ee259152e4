package com.campaignkeeper.collaborator;

import com.campaignkeeper.exception.CollaboratorException;
import com.campaignkeeper.memory.ContextWindow;
import com.campaignkeeper.model.BeatStatus;
import com.campaignkeeper.model.BeatTransition;
import com.campaignkeeper.model.EntityKind;
import com.campaignkeeper.model.EntityUpsert;
import com.campaignkeeper.model.WorldEntity;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Narrator backed by a langchain4j chat model.
 *
 * <p>The model answers with narration prose, optionally followed by a fenced JSON block listing
 * world-state changes. The block is stripped from the narration shown to the player.</p>
 */
public class LlmNarrationGenerator implements NarrationGenerator {

    private static final Logger log = LoggerFactory.getLogger(LlmNarrationGenerator.class);

    static final String INSTRUCTIONS = """
        You are the narrator and game master of a tabletop role-playing campaign.
        Answer the player's action with vivid narration in the second person, two short paragraphs at most.
        Stay consistent with the world state, story plan and earlier scenes you are given.

        If anything in the world changed, end your answer with a fenced ```json block of this shape
        (omit keys that did not change):
        {"npcs": [{"name": "", "description": "", "tags": []}],
         "locations": [{"name": "", "description": "", "tags": []}],
         "items": [{"name": "", "description": "", "tags": []}],
         "beat": {"order": 1, "status": "active|done"},
         "new_threads": [""], "resolved_threads": [""],
         "scene_ended": false, "scene_description": "one sentence describing what the scene looks like"}
        """;

    private static final Pattern DELTA_BLOCK = Pattern.compile("```json\\s*(\\{.*?})\\s*```", Pattern.DOTALL);

    private final ChatModel chatModel;
    private final ObjectMapper objectMapper;

    public LlmNarrationGenerator(ChatModel chatModel) {
        this.chatModel = chatModel;
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public Narration generate(ContextWindow context, String playerInput) {
        List<ChatMessage> messages = new ArrayList<>(context.toChatMessages(INSTRUCTIONS));
        messages.add(UserMessage.from(playerInput));

        String reply;
        try {
            ChatResponse response = chatModel.chat(messages);
            reply = response.aiMessage() == null ? null : response.aiMessage().text();
        } catch (RuntimeException e) {
            CollaboratorFailure failure = CollaboratorFailure.classify(e);
            throw new CollaboratorException(failure, "Narration failed (" + failure + "): " + e.getMessage(), e);
        }
        if (reply == null || reply.isBlank()) {
            throw new CollaboratorException(CollaboratorFailure.MALFORMED_RESPONSE,
                "Narration model returned an empty reply", null);
        }
        return parse(reply);
    }

    Narration parse(String reply) {
        Matcher block = DELTA_BLOCK.matcher(reply);
        if (!block.find()) {
            return Narration.text(reply.strip());
        }
        String text = (reply.substring(0, block.start()) + reply.substring(block.end())).strip();
        if (text.isEmpty()) {
            throw new CollaboratorException(CollaboratorFailure.MALFORMED_RESPONSE,
                "Narration model returned changes without narration", null);
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(block.group(1));
        } catch (JsonProcessingException e) {
            throw new CollaboratorException(CollaboratorFailure.MALFORMED_RESPONSE,
                "Narration changes are not valid JSON: " + e.getOriginalMessage(), e);
        }

        List<EntityUpsert> updates = new ArrayList<>();
        for (EntityKind kind : EntityKind.values()) {
            String key = jsonKey(kind);
            for (JsonNode node : root.path(key)) {
                String name = node.path("name").asText("");
                if (name.isBlank()) {
                    log.debug("Skipping {} entry without a name", key);
                    continue;
                }
                updates.add(new EntityUpsert(kind,
                    new WorldEntity(name, node.path("description").asText(""), strings(node.path("tags")))));
            }
        }

        BeatTransition transition = null;
        JsonNode beat = root.path("beat");
        if (beat.isObject() && beat.path("order").canConvertToInt() && beat.hasNonNull("status")) {
            try {
                transition = new BeatTransition(beat.path("order").asInt(),
                    BeatStatus.fromLabel(beat.path("status").asText()));
            } catch (IllegalArgumentException e) {
                throw new CollaboratorException(CollaboratorFailure.MALFORMED_RESPONSE,
                    "Unknown beat status '" + beat.path("status").asText() + "'", e);
            }
        }

        return new Narration(
            text,
            updates,
            transition,
            strings(root.path("new_threads")),
            strings(root.path("resolved_threads")),
            root.path("scene_ended").asBoolean(false),
            root.path("scene_description").asText("")
        );
    }

    private static String jsonKey(EntityKind kind) {
        return switch (kind) {
            case NPC -> "npcs";
            case LOCATION -> "locations";
            case ITEM -> "items";
        };
    }

    private static List<String> strings(JsonNode array) {
        List<String> values = new ArrayList<>();
        for (JsonNode node : array) {
            String value = node.asText("").strip();
            if (!value.isEmpty()) {
                values.add(value);
            }
        }
        return values;
    }
}
