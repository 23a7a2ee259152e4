package com.campaignkeeper.repository;

import com.campaignkeeper.model.CampaignState;
import com.campaignkeeper.model.EntityKind;
import com.campaignkeeper.model.OpenThread;
import com.campaignkeeper.model.SceneRecord;
import com.campaignkeeper.model.StoryBeat;
import com.campaignkeeper.model.Summary;
import com.campaignkeeper.model.WorldEntity;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders a campaign state as a save document.
 *
 * <p>Five sections in fixed order, each a level-1 heading followed by a {@code ---} line, the
 * body and a closing {@code ---}. Free-form lines preserved from a loaded save are written back
 * at the top of their section, unknown trailing sections after the last known one.</p>
 */
public class SaveFileWriter {

    static final DateTimeFormatter SCENE_DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd").withZone(ZoneOffset.UTC);
    static final String SCENE_TITLE_SEPARATOR = " – ";
    static final String TAGS_OPEN = " [tags: ";

    private final Yaml yaml;

    public SaveFileWriter() {
        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        options.setSplitLines(false);
        this.yaml = new Yaml(options);
    }

    public String render(CampaignState state) {
        StringBuilder out = new StringBuilder();
        section(out, SaveSections.METADATA, metadata(state), List.of());
        section(out, SaveSections.WORLD_STATE, state.preservedLines(SaveSections.WORLD_STATE), worldState(state));
        section(out, SaveSections.STORY_PLAN, state.preservedLines(SaveSections.STORY_PLAN), storyPlan(state));
        section(out, SaveSections.SCENE_HISTORY, state.preservedLines(SaveSections.SCENE_HISTORY), sceneHistory(state));
        section(out, SaveSections.OPEN_THREADS, state.preservedLines(SaveSections.OPEN_THREADS), openThreads(state));

        state.getPreservedContent().forEach((name, lines) -> {
            if (!SaveSections.ORDER.contains(name)) {
                out.append("# ").append(name).append('\n');
                lines.forEach(line -> out.append(line).append('\n'));
                out.append('\n');
            }
        });
        return out.toString();
    }

    private void section(StringBuilder out, String name, List<String> leading, List<String> body) {
        out.append("# ").append(name).append('\n');
        out.append(SaveSections.DELIMITER).append('\n');
        leading.forEach(line -> out.append(line).append('\n'));
        body.forEach(line -> out.append(line).append('\n'));
        out.append(SaveSections.DELIMITER).append('\n');
        out.append('\n');
    }

    private List<String> metadata(CampaignState state) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("version", state.getVersion());
        meta.put("campaign", state.getName());
        meta.put("created", state.getCreatedAt().toString());
        meta.put("last_played", state.getLastPlayedAt().toString());
        List<String> lines = new ArrayList<>(yaml.dump(meta).lines().toList());
        lines.addAll(state.preservedLines(SaveSections.METADATA));
        return lines;
    }

    private List<String> worldState(CampaignState state) {
        List<String> lines = new ArrayList<>();
        for (EntityKind kind : EntityKind.values()) {
            lines.add("## " + kind.heading());
            for (WorldEntity entity : state.getWorldState().entities(kind)) {
                lines.add(entityLine(entity));
            }
        }
        return lines;
    }

    static String entityLine(WorldEntity entity) {
        StringBuilder line = new StringBuilder("- **").append(entity.name()).append("**:");
        if (!entity.description().isEmpty()) {
            line.append(' ').append(entity.description());
        }
        if (!entity.tags().isEmpty()) {
            line.append(TAGS_OPEN).append(String.join(", ", entity.tags())).append(']');
        }
        return line.toString();
    }

    private List<String> storyPlan(CampaignState state) {
        return state.getStoryPlan().beats().stream()
            .map(SaveFileWriter::beatLine)
            .toList();
    }

    static String beatLine(StoryBeat beat) {
        return beat.order() + ". [" + beat.status().label() + "] " + beat.description();
    }

    private List<String> sceneHistory(CampaignState state) {
        List<String> lines = new ArrayList<>();
        for (SceneRecord scene : state.getSceneHistory()) {
            Summary summary = scene.summary();
            lines.add("<details>");
            lines.add("<summary>" + SCENE_DATE.format(scene.endedAt()) + SCENE_TITLE_SEPARATOR
                + "\"" + scene.title() + "\"</summary>");
            lines.add("");
            lines.add("**Scene**: " + scene.sceneId());
            lines.add("**Started**: " + scene.startedAt());
            lines.add("**Ended**: " + scene.endedAt());
            lines.add("**Covers**: " + summary.describeCoverage());
            lines.add("**Summarized**: " + summary.createdAt());
            lines.add("**Forced**: " + summary.forced());
            lines.add("**Transcript**: [[" + scene.transcriptRef() + "]]");
            List<String> text = summary.text().lines().toList();
            lines.add("**Summary**: " + (text.isEmpty() ? "" : text.get(0)));
            lines.addAll(text.subList(Math.min(1, text.size()), text.size()));
            lines.add("");
            lines.add("</details>");
        }
        return lines;
    }

    private List<String> openThreads(CampaignState state) {
        return state.getOpenThreads().stream()
            .map(SaveFileWriter::threadLine)
            .toList();
    }

    static String threadLine(OpenThread thread) {
        return "- [" + (thread.resolved() ? "x" : " ") + "] " + thread.text()
            + " _(opened " + thread.createdAt() + ")_";
    }
}
