package com.campaignkeeper.planning;

import com.campaignkeeper.agent.MasterAgent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * The interactive planning phase: questions until the player answers {@value #DONE}, then the
 * drafted plan seeds the master agent.
 */
public class PlanningSession {

    private static final Logger log = LoggerFactory.getLogger(PlanningSession.class);

    public static final String DONE = "done";

    private final CampaignDesigner designer;
    private final MasterAgent master;
    private CampaignPlan plan;
    private CompletableFuture<Path> initialSave;

    public PlanningSession(CampaignDesigner designer, MasterAgent master) {
        this.designer = designer;
        this.master = master;
    }

    /**
     * Enters the planning phase and returns the first question.
     */
    public String start(String campaignName) {
        master.beginPlanning(campaignName);
        return designer.openingQuestion(campaignName);
    }

    /**
     * @return the next question, or empty once the player said {@value #DONE} and the campaign was seeded
     */
    public Optional<String> reply(String answer) {
        if (isComplete()) {
            throw new IllegalStateException("Planning already finished");
        }
        if (answer.strip().equalsIgnoreCase(DONE)) {
            plan = designer.draft();
            initialSave = master.completePlanning(plan);
            log.info("Planning finished for '{}'", plan.title());
            return Optional.empty();
        }
        return Optional.of(designer.answer(answer));
    }

    public boolean isComplete() {
        return plan != null;
    }

    public CampaignPlan plan() {
        return plan;
    }

    public CompletableFuture<Path> initialSave() {
        return initialSave;
    }
}
