package com.campaignkeeper.planning;

import com.campaignkeeper.collaborator.CollaboratorFailure;
import com.campaignkeeper.exception.CollaboratorException;
import com.campaignkeeper.model.EntityKind;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LlmCampaignDesigner")
class LlmCampaignDesignerTest {

    /**
     * Chat model that answers from a script and remembers how many messages each request carried.
     */
    private static class ScriptedChatModel implements ChatModel {

        private final Deque<String> replies;
        private final List<Integer> requestSizes = new ArrayList<>();

        ScriptedChatModel(String... replies) {
            this.replies = new ArrayDeque<>(List.of(replies));
        }

        @Override
        public ChatResponse doChat(ChatRequest request) {
            requestSizes.add(request.messages().size());
            return ChatResponse.builder().aiMessage(AiMessage.from(replies.removeFirst())).build();
        }
    }

    @Nested
    @DisplayName("conversation")
    class ConversationTest {

        @Test
        @DisplayName("Should keep the conversation in memory and draft from it")
        void shouldConverseAndDraft() {
            ScriptedChatModel model = new ScriptedChatModel(
                "What kind of setting do you imagine?",
                "Who is the villain?",
                "{\"title\": \"\", \"synopsis\": \"A dragon wakes.\", \"acts\": [\"Omens\", \"The lair\"]}");
            LlmCampaignDesigner designer = new LlmCampaignDesigner(model);

            assertEquals("What kind of setting do you imagine?", designer.openingQuestion("Dragon Heist"));
            assertEquals("Who is the villain?", designer.answer("A snowy mountain range"));
            CampaignPlan plan = designer.draft();

            assertEquals("Dragon Heist", plan.title());
            assertEquals(List.of("Omens", "The lair"), plan.acts());
            assertTrue(model.requestSizes.get(2) > model.requestSizes.get(0));
        }

        @Test
        @DisplayName("Should refuse answers before the conversation started")
        void shouldRequireOpeningQuestion() {
            LlmCampaignDesigner designer = new LlmCampaignDesigner(new ScriptedChatModel());

            assertThrows(IllegalStateException.class, () -> designer.answer("hello"));
        }
    }

    @Nested
    @DisplayName("parsePlan()")
    class ParsePlanTest {

        private final LlmCampaignDesigner designer = new LlmCampaignDesigner(new ScriptedChatModel());

        @Test
        @DisplayName("Should read the JSON object even when wrapped in prose")
        void shouldReadWrappedJson() {
            CampaignPlan plan = designer.parsePlan("""
                Here is your campaign:
                ```json
                {"title": "Storm King's Thunder", "synopsis": "Giants rampage.",
                 "acts": ["Attack on Nightstone", {"description": "Journey north"}],
                 "npcs": [{"name": "Harshnag", "description": "frost giant"}, {"name": " "}],
                 "locations": [{"name": "Nightstone"}],
                 "opening_threads": ["Why did the giants attack?"],
                 "visual_style": "bold woodcut"}
                ```
                Enjoy!
                """, "Fallback");

            assertEquals("Storm King's Thunder", plan.title());
            assertEquals(List.of("Attack on Nightstone", "Journey north"), plan.acts());
            assertEquals(2, plan.seeds().size());
            assertEquals(EntityKind.NPC, plan.seeds().get(0).kind());
            assertEquals(EntityKind.LOCATION, plan.seeds().get(1).kind());
            assertEquals(List.of("Why did the giants attack?"), plan.openingThreads());
            assertEquals(List.of("Synopsis: Giants rampage.", "Visual style: bold woodcut"), plan.worldStateNotes());
        }

        @Test
        @DisplayName("Should reject a reply without JSON")
        void shouldRejectProse() {
            CollaboratorException error = assertThrows(CollaboratorException.class,
                () -> designer.parsePlan("I need more information first.", "Fallback"));

            assertEquals(CollaboratorFailure.MALFORMED_RESPONSE, error.getFailure());
        }

        @Test
        @DisplayName("Should reject broken JSON")
        void shouldRejectBrokenJson() {
            assertThrows(CollaboratorException.class, () -> designer.parsePlan("{\"title\": ", "Fallback"));
        }
    }
}
