package com.campaignkeeper.planning;

/**
 * Runs the question-and-answer conversation of the planning phase and drafts the plan from it.
 */
public interface CampaignDesigner {

    String openingQuestion(String campaignName);

    /**
     * Takes the player's answer to the last question and returns the next question.
     */
    String answer(String reply);

    /**
     * Drafts the campaign plan from everything answered so far.
     */
    CampaignPlan draft();
}
