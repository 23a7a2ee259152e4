package com.campaignkeeper.planning;

import com.campaignkeeper.model.EntityKind;
import com.campaignkeeper.model.EntityUpsert;
import com.campaignkeeper.model.WorldEntity;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Offline designer that walks through a fixed list of questions. Used when no language model
 * is configured.
 */
public class QuestionnaireCampaignDesigner implements CampaignDesigner {

    static final String DEFAULT_BEAT = "The adventure begins";

    private enum Question {
        SETTING("Describe the setting and tone of the campaign in a sentence or two."),
        LOCATION("Where does the story begin? (name: description)"),
        NPC("Who is the first important character the party meets? (name: description)"),
        BEATS("List the major story beats in order, separated by semicolons."),
        HOOK("What hook draws the party into the story?"),
        STYLE("How should scene illustrations look?");

        private final String text;

        Question(String text) {
            this.text = text;
        }
    }

    private String campaignName;
    private int asked;
    private String synopsis = "";
    private final List<EntityUpsert> seeds = new ArrayList<>();
    private final List<String> beats = new ArrayList<>();
    private final List<String> threads = new ArrayList<>();
    private String visualStyle = "";

    @Override
    public String openingQuestion(String campaignName) {
        this.campaignName = campaignName;
        this.asked = 0;
        return Question.values()[0].text;
    }

    @Override
    public String answer(String reply) {
        Question[] questions = Question.values();
        if (asked < questions.length) {
            record(questions[asked], reply.strip());
            asked++;
        }
        if (asked < questions.length) {
            return questions[asked].text;
        }
        return "That is everything I need. Type 'done' to draft the campaign.";
    }

    @Override
    public CampaignPlan draft() {
        List<String> acts = beats.isEmpty() ? List.of(DEFAULT_BEAT) : beats;
        return new CampaignPlan(campaignName, synopsis, acts, seeds, threads, visualStyle);
    }

    private void record(Question question, String reply) {
        if (reply.isEmpty()) {
            return;
        }
        switch (question) {
            case SETTING -> synopsis = reply;
            case LOCATION -> seeds.add(new EntityUpsert(EntityKind.LOCATION, entity(reply)));
            case NPC -> seeds.add(new EntityUpsert(EntityKind.NPC, entity(reply)));
            case BEATS -> Arrays.stream(reply.split(";"))
                .map(String::strip)
                .filter(beat -> !beat.isEmpty())
                .forEach(beats::add);
            case HOOK -> threads.add(reply);
            case STYLE -> visualStyle = reply;
        }
    }

    static WorldEntity entity(String reply) {
        int separator = reply.indexOf(':');
        if (separator > 0) {
            return new WorldEntity(reply.substring(0, separator), reply.substring(separator + 1));
        }
        return new WorldEntity(reply, "");
    }
}
