package com.campaignkeeper.planning;

import com.campaignkeeper.model.CampaignState;
import com.campaignkeeper.model.EntityUpsert;
import com.campaignkeeper.model.Texts;
import com.campaignkeeper.repository.SaveSections;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Output of the planning phase, used to seed a new campaign.
 *
 * @param title campaign name
 * @param synopsis short pitch
 * @param acts story beats in order
 * @param seeds initial NPCs, locations and items
 * @param openingThreads hooks that are open from the start
 * @param visualStyle art direction for scene illustrations
 */
public record CampaignPlan(
    String title,
    String synopsis,
    List<String> acts,
    List<EntityUpsert> seeds,
    List<String> openingThreads,
    String visualStyle
) {

    static final String SYNOPSIS_PREFIX = "Synopsis: ";
    static final String VISUAL_STYLE_PREFIX = "Visual style: ";

    public CampaignPlan {
        title = Texts.requireName(title, "Campaign title");
        synopsis = Texts.singleLine(synopsis);
        acts = clean(acts);
        seeds = seeds == null ? List.of() : List.copyOf(seeds);
        openingThreads = clean(openingThreads);
        visualStyle = Texts.singleLine(visualStyle);
    }

    /**
     * Free-form World State lines that carry the synopsis and visual style in the save file.
     */
    public List<String> worldStateNotes() {
        List<String> notes = new ArrayList<>();
        if (!synopsis.isEmpty()) {
            notes.add(SYNOPSIS_PREFIX + synopsis);
        }
        if (!visualStyle.isEmpty()) {
            notes.add(VISUAL_STYLE_PREFIX + visualStyle);
        }
        return notes;
    }

    public static Optional<String> visualStyleOf(CampaignState state) {
        return note(state, VISUAL_STYLE_PREFIX);
    }

    public static Optional<String> synopsisOf(CampaignState state) {
        return note(state, SYNOPSIS_PREFIX);
    }

    private static Optional<String> note(CampaignState state, String prefix) {
        return state.preservedLines(SaveSections.WORLD_STATE).stream()
            .filter(line -> line.startsWith(prefix))
            .map(line -> line.substring(prefix.length()).strip())
            .findFirst();
    }

    private static List<String> clean(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream().map(Texts::singleLine).filter(value -> !value.isEmpty()).toList();
    }
}
