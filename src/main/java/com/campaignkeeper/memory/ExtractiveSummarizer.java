package com.campaignkeeper.memory;

import com.campaignkeeper.model.Turn;
import com.campaignkeeper.model.TurnRole;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Deterministic summarizer that needs no model: keeps the previous summary, the opening sentence
 * of each narrator turn and the names mentioned, else the opening line of the turns. Used offline
 * and as the planning-free default.
 */
public class ExtractiveSummarizer implements Summarizer {

    @Override
    public String summarize(String previousSummary, List<Turn> turns, int maxChars) {
        List<String> sentences = new ArrayList<>();
        Set<String> names = new LinkedHashSet<>();
        for (Turn turn : turns) {
            if (turn.role() == TurnRole.NARRATOR) {
                String sentence = firstSentence(turn.content());
                if (!sentence.isEmpty()) {
                    sentences.add(sentence);
                }
            }
            for (String name : ProperNames.extract(turn.content())) {
                names.add(Character.toUpperCase(name.charAt(0)) + name.substring(1));
            }
        }

        StringBuilder fresh = new StringBuilder(String.join(" ", sentences));
        if (!names.isEmpty()) {
            if (fresh.length() > 0) {
                fresh.append(' ');
            }
            fresh.append("Names: ").append(String.join(", ", names)).append('.');
        }

        if (previousSummary == null || previousSummary.isBlank()) {
            return fresh.length() > 0 ? fresh.toString() : openingLine(turns);
        }
        if (fresh.length() == 0) {
            return previousSummary.strip();
        }
        String kept = Compressor.clip(previousSummary.strip(), maxChars / 2);
        return kept + "\n" + fresh;
    }

    // without narration or names, the first thing anyone said; never blank for a non-empty scene
    private static String openingLine(List<Turn> turns) {
        for (Turn turn : turns) {
            String sentence = firstSentence(turn.content());
            if (!sentence.isEmpty()) {
                return sentence;
            }
        }
        if (turns.isEmpty()) {
            return "";
        }
        return turns.size() == 1 ? "1 turn played." : turns.size() + " turns played.";
    }

    private static String firstSentence(String content) {
        String text = content.strip().replaceAll("\\s+", " ");
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if ((c == '.' || c == '!' || c == '?') && (i + 1 == text.length() || text.charAt(i + 1) == ' ')) {
                return text.substring(0, i + 1);
            }
        }
        return text;
    }
}
