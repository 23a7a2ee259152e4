package com.campaignkeeper.planning;

import com.campaignkeeper.collaborator.CollaboratorFailure;
import com.campaignkeeper.exception.CollaboratorException;
import com.campaignkeeper.model.EntityKind;
import com.campaignkeeper.model.EntityUpsert;
import com.campaignkeeper.model.WorldEntity;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.memory.chat.MessageWindowChatMemory;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.service.AiServices;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Designer that interviews the player through a chat model and drafts the plan as JSON.
 */
public class LlmCampaignDesigner implements CampaignDesigner {

    private static final Logger log = LoggerFactory.getLogger(LlmCampaignDesigner.class);
    private static final int MEMORY_MESSAGES = 40;
    private static final Pattern JSON_OBJECT = Pattern.compile("\\{.*}", Pattern.DOTALL);

    static final String DRAFT_REQUEST = """
        We are done with questions. Draft the campaign now.
        Answer with a single JSON object and nothing else:
        {"title": "", "synopsis": "", "acts": ["beat 1", "beat 2"],
         "npcs": [{"name": "", "description": ""}], "locations": [{"name": "", "description": ""}],
         "opening_threads": [""], "visual_style": ""}
        """;

    /**
     * Conversation with the designer - LangChain4j will implement this.
     */
    interface Designer {
        @SystemMessage("""
            You are helping a player design a new tabletop role-playing campaign.
            Ask exactly one short question at a time about setting, tone, factions, important
            characters, the opening location and the shape of the story.
            Build on previous answers. Do not draft the campaign until asked.
            """)
        String chat(@UserMessage String message);
    }

    private final ChatModel chatModel;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private Designer designer;
    private String campaignName;

    public LlmCampaignDesigner(ChatModel chatModel) {
        this.chatModel = chatModel;
    }

    @Override
    public String openingQuestion(String campaignName) {
        this.campaignName = campaignName;
        this.designer = AiServices.builder(Designer.class)
            .chatModel(chatModel)
            .chatMemory(MessageWindowChatMemory.withMaxMessages(MEMORY_MESSAGES))
            .build();
        return ask("The campaign is called \"" + campaignName + "\". Ask your first question.");
    }

    @Override
    public String answer(String reply) {
        return ask(reply);
    }

    @Override
    public CampaignPlan draft() {
        String reply = ask(DRAFT_REQUEST);
        return parsePlan(reply, campaignName);
    }

    private String ask(String message) {
        if (designer == null) {
            throw new IllegalStateException("Planning conversation has not started");
        }
        try {
            return designer.chat(message);
        } catch (RuntimeException e) {
            CollaboratorFailure failure = CollaboratorFailure.classify(e);
            throw new CollaboratorException(failure,
                "Campaign designer failed (" + failure + "): " + e.getMessage(), e);
        }
    }

    CampaignPlan parsePlan(String reply, String fallbackTitle) {
        Matcher matcher = JSON_OBJECT.matcher(reply == null ? "" : reply);
        if (!matcher.find()) {
            throw new CollaboratorException(CollaboratorFailure.MALFORMED_RESPONSE,
                "Campaign draft did not contain a JSON object", null);
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(matcher.group());
        } catch (JsonProcessingException e) {
            throw new CollaboratorException(CollaboratorFailure.MALFORMED_RESPONSE,
                "Campaign draft is not valid JSON: " + e.getOriginalMessage(), e);
        }

        List<EntityUpsert> seeds = new ArrayList<>();
        seeds.addAll(entities(root.path("npcs"), EntityKind.NPC));
        seeds.addAll(entities(root.path("locations"), EntityKind.LOCATION));
        seeds.addAll(entities(root.path("items"), EntityKind.ITEM));

        String title = root.path("title").asText("");
        CampaignPlan plan = new CampaignPlan(
            title.isBlank() ? fallbackTitle : title,
            root.path("synopsis").asText(""),
            strings(root.path("acts")),
            seeds,
            strings(root.path("opening_threads")),
            root.path("visual_style").asText("")
        );
        log.info("Drafted campaign '{}' with {} acts and {} seeds", plan.title(), plan.acts().size(), seeds.size());
        return plan;
    }

    private static List<EntityUpsert> entities(JsonNode array, EntityKind kind) {
        List<EntityUpsert> result = new ArrayList<>();
        for (JsonNode node : array) {
            String name = node.path("name").asText("");
            if (!name.isBlank()) {
                result.add(new EntityUpsert(kind, new WorldEntity(name, node.path("description").asText(""))));
            }
        }
        return result;
    }

    private static List<String> strings(JsonNode array) {
        List<String> values = new ArrayList<>();
        for (JsonNode node : array) {
            values.add(node.isTextual() ? node.asText() : node.path("description").asText(node.toString()));
        }
        return values;
    }
}
