package com.campaignkeeper.repository;

import com.campaignkeeper.exception.CampaignErrorCode;
import com.campaignkeeper.exception.CampaignException;
import com.campaignkeeper.model.BeatStatus;
import com.campaignkeeper.model.CampaignState;
import com.campaignkeeper.model.EntityKind;
import com.campaignkeeper.model.OpenThread;
import com.campaignkeeper.model.SceneRecord;
import com.campaignkeeper.model.StoryBeat;
import com.campaignkeeper.model.StoryPlan;
import com.campaignkeeper.model.Summary;
import com.campaignkeeper.model.WorldEntity;
import com.campaignkeeper.model.WorldState;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.representer.Representer;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses a save document back into a campaign state.
 *
 * <p>The document is read as a fixed grammar: the five known sections in order, each heading
 * followed by a {@code ---} line and closed by another {@code ---} line outside any
 * {@code <details>} block. Lines inside a known section that the grammar does not recognize are
 * kept as preserved content, as are unknown sections after {@code # Open Threads}.</p>
 */
public class SaveFileParser {

    private static final Pattern ENTITY = Pattern.compile("^- \\*\\*(.+?)\\*\\*:\\s*(.*)$");
    private static final Pattern BEAT = Pattern.compile("^(\\d+)\\.\\s+(?:\\[(pending|active|done)]\\s+)?(.*)$",
        Pattern.CASE_INSENSITIVE);
    private static final Pattern THREAD = Pattern.compile("^- \\[([ xX])]\\s+(.*?)(?:\\s+_\\(opened ([^)]+)\\)_)?$");
    private static final Pattern LEGACY_THREAD = Pattern.compile("^[-*] (.+)$");
    private static final Pattern SCENE_SUMMARY = Pattern.compile("^<summary>\\s*(.*?)\\s+[–-]\\s+\"(.*)\"\\s*</summary>$");
    private static final Pattern SCENE_FIELD = Pattern.compile("^\\*\\*(\\w+)\\*\\*:\\s?(.*)$");
    private static final Pattern TRANSCRIPT_LINK = Pattern.compile("^\\[\\[(.*)]]$");
    private static final Pattern COVERAGE = Pattern.compile("^(\\d+)-(\\d+)$");

    // fields that end a multi-line summary; written before it, but older saves put some after it
    private static final List<String> SCENE_KEYS =
        List.of("scene", "started", "ended", "covers", "summarized", "forced", "transcript");
    private static final List<String> METADATA_KEYS = List.of("version", "campaign", "created", "last_played");

    private final Yaml yaml;

    public SaveFileParser() {
        DumperOptions dumperOptions = new DumperOptions();
        dumperOptions.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        dumperOptions.setSplitLines(false);
        this.yaml = new Yaml(new SafeConstructor(new LoaderOptions()), new Representer(dumperOptions),
            dumperOptions);
    }

    /**
     * @param source name of the document for error messages, usually the file name
     * @throws CampaignException with {@link CampaignErrorCode#SCHEMA_VERSION_MISMATCH} when the
     *     document was written by a newer schema, {@link CampaignErrorCode#MALFORMED_SAVE} on any
     *     structural error
     */
    public CampaignState parse(String document, String source) {
        List<String> lines = Arrays.asList(document.split("\\R", -1));
        Map<String, List<String>> bodies = new LinkedHashMap<>();
        Map<String, List<String>> unknownSections = new LinkedHashMap<>();
        Metadata metadata = null;

        int next = 0;
        int i = 0;
        while (i < lines.size()) {
            String line = lines.get(i);
            if (line.isBlank()) {
                i++;
                continue;
            }
            if (!line.startsWith("# ")) {
                throw malformed(source, i, "text outside of a section: '" + line.strip() + "'");
            }
            String name = line.substring(2).strip();
            if (next == SaveSections.ORDER.size()) {
                if (SaveSections.ORDER.contains(name) || unknownSections.containsKey(name)) {
                    throw malformed(source, i, "duplicate section '" + name + "'");
                }
                i = readUnknownSection(lines, i + 1, name, unknownSections);
                continue;
            }
            String expected = SaveSections.ORDER.get(next);
            if (!expected.equals(name)) {
                throw malformed(source, i, SaveSections.ORDER.contains(name)
                    ? "section '" + name + "' out of order, expected '" + expected + "'"
                    : "unexpected section '" + name + "', expected '" + expected + "'");
            }
            i = skipBlank(lines, i + 1);
            if (i >= lines.size() || !lines.get(i).strip().equals(SaveSections.DELIMITER)) {
                throw malformed(source, i, "missing '---' after '# " + name + "'");
            }
            List<String> body = new ArrayList<>();
            i = readBody(lines, i + 1, body, source, name);
            bodies.put(name, body);
            if (next == 0) {
                // version is checked before anything else so a newer layout is reported as such
                metadata = parseMetadata(body, source);
            }
            next++;
        }
        if (next < SaveSections.ORDER.size()) {
            throw malformed(source, lines.size(), "missing section '" + SaveSections.ORDER.get(next) + "'");
        }

        Map<String, List<String>> preserved = new LinkedHashMap<>();
        WorldState world = parseWorldState(bodies.get(SaveSections.WORLD_STATE), source, preserved);
        StoryPlan plan = parseStoryPlan(bodies.get(SaveSections.STORY_PLAN), source, preserved);
        List<SceneRecord> scenes = parseSceneHistory(bodies.get(SaveSections.SCENE_HISTORY), source, preserved);
        List<OpenThread> threads = parseOpenThreads(bodies.get(SaveSections.OPEN_THREADS), metadata.created(),
            source, preserved);
        if (!metadata.extra().isEmpty()) {
            preserved.put(SaveSections.METADATA, metadata.extra());
        }
        preserved.putAll(unknownSections);

        try {
            return new CampaignState(metadata.version(), metadata.campaign(), metadata.created(),
                metadata.lastPlayed(), world, plan, scenes, threads, preserved);
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new CampaignException(CampaignErrorCode.MALFORMED_SAVE, source + ": " + e.getMessage(), e);
        }
    }

    private int readBody(List<String> lines, int start, List<String> body, String source, String section) {
        boolean inDetails = false;
        for (int i = start; i < lines.size(); i++) {
            String line = lines.get(i);
            String trimmed = line.strip();
            if (!inDetails && trimmed.equals(SaveSections.DELIMITER)) {
                return i + 1;
            }
            if (trimmed.startsWith("<details")) {
                inDetails = true;
            } else if (trimmed.equals("</details>")) {
                inDetails = false;
            }
            body.add(line);
        }
        throw malformed(source, lines.size(), "section '" + section + "' is not closed with '---'");
    }

    private int readUnknownSection(List<String> lines, int start, String name, Map<String, List<String>> sink) {
        List<String> kept = new ArrayList<>();
        int i = start;
        while (i < lines.size() && !lines.get(i).startsWith("# ")) {
            if (!lines.get(i).isBlank()) {
                kept.add(lines.get(i));
            }
            i++;
        }
        sink.put(name, kept);
        return i;
    }

    private static int skipBlank(List<String> lines, int from) {
        int i = from;
        while (i < lines.size() && lines.get(i).isBlank()) {
            i++;
        }
        return i;
    }

    private Metadata parseMetadata(List<String> body, String source) {
        Object loaded;
        try {
            loaded = yaml.load(String.join("\n", body));
        } catch (YAMLException e) {
            throw new CampaignException(CampaignErrorCode.MALFORMED_SAVE,
                source + ": broken metadata block: " + e.getMessage(), e);
        }
        if (!(loaded instanceof Map<?, ?> map)) {
            throw new CampaignException(CampaignErrorCode.MALFORMED_SAVE,
                source + ": metadata is not a key-value block");
        }
        if (!(map.get("version") instanceof Integer version)) {
            throw new CampaignException(CampaignErrorCode.MALFORMED_SAVE,
                source + ": metadata has no integer version");
        }
        if (version > CampaignState.CURRENT_VERSION) {
            throw new CampaignException(CampaignErrorCode.SCHEMA_VERSION_MISMATCH,
                source + ": save version " + version + " is newer than supported version "
                    + CampaignState.CURRENT_VERSION);
        }
        if (version < 1) {
            throw new CampaignException(CampaignErrorCode.MALFORMED_SAVE, source + ": invalid version " + version);
        }
        Object campaign = map.get("campaign");
        if (campaign == null || campaign.toString().isBlank()) {
            throw new CampaignException(CampaignErrorCode.MALFORMED_SAVE,
                source + ": metadata has no campaign name");
        }
        Instant created = timestamp(map.get("created"), "created", source);
        Instant lastPlayed = map.get("last_played") == null
            ? created
            : timestamp(map.get("last_played"), "last_played", source);

        List<String> extra = new ArrayList<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            if (!METADATA_KEYS.contains(String.valueOf(entry.getKey()))) {
                Map<Object, Object> single = new LinkedHashMap<>();
                single.put(entry.getKey(), entry.getValue());
                extra.addAll(yaml.dump(single).lines().toList());
            }
        }
        return new Metadata(version, campaign.toString(), created, lastPlayed, extra);
    }

    private static Instant timestamp(Object value, String key, String source) {
        if (value instanceof Date date) {
            return date.toInstant();
        }
        if (value == null) {
            throw new CampaignException(CampaignErrorCode.MALFORMED_SAVE, source + ": metadata has no " + key);
        }
        return instant(value.toString(), key, source);
    }

    private static Instant instant(String text, String what, String source) {
        try {
            return Instant.parse(text.strip());
        } catch (DateTimeParseException e) {
            throw new CampaignException(CampaignErrorCode.MALFORMED_SAVE,
                source + ": invalid timestamp for " + what + ": '" + text + "'", e);
        }
    }

    private WorldState parseWorldState(List<String> body, String source, Map<String, List<String>> preserved) {
        WorldState world = new WorldState();
        List<String> kept = new ArrayList<>();
        EntityKind kind = null;
        for (String line : body) {
            String trimmed = line.strip();
            if (trimmed.isEmpty()) {
                continue;
            }
            if (trimmed.startsWith("## ")) {
                kind = EntityKind.fromHeading(trimmed.substring(3));
                if (kind == null) {
                    kept.add(line);
                }
                continue;
            }
            if (kind == null || !trimmed.startsWith("- **")) {
                kept.add(line);
                continue;
            }
            Matcher matcher = ENTITY.matcher(trimmed);
            if (!matcher.matches()) {
                throw new CampaignException(CampaignErrorCode.MALFORMED_SAVE,
                    source + ": broken " + kind.heading() + " entry '" + trimmed + "'");
            }
            try {
                world.upsert(kind, entity(matcher.group(1), matcher.group(2)));
            } catch (IllegalArgumentException e) {
                throw new CampaignException(CampaignErrorCode.MALFORMED_SAVE,
                    source + ": broken " + kind.heading() + " entry '" + trimmed + "': " + e.getMessage(), e);
            }
        }
        keep(preserved, SaveSections.WORLD_STATE, kept);
        return world;
    }

    private static WorldEntity entity(String name, String rest) {
        int tagsAt = rest.lastIndexOf(SaveFileWriter.TAGS_OPEN.strip());
        if (tagsAt >= 0 && rest.endsWith("]")) {
            String description = rest.substring(0, tagsAt);
            String tags = rest.substring(tagsAt + SaveFileWriter.TAGS_OPEN.strip().length(), rest.length() - 1);
            return new WorldEntity(name, description, Arrays.asList(tags.split(",")));
        }
        return new WorldEntity(name, rest);
    }

    private StoryPlan parseStoryPlan(List<String> body, String source, Map<String, List<String>> preserved) {
        List<StoryBeat> beats = new ArrayList<>();
        List<String> kept = new ArrayList<>();
        for (String line : body) {
            String trimmed = line.strip();
            if (trimmed.isEmpty()) {
                continue;
            }
            Matcher matcher = BEAT.matcher(trimmed);
            if (!matcher.matches()) {
                kept.add(line);
                continue;
            }
            BeatStatus status = matcher.group(2) == null ? BeatStatus.PENDING : BeatStatus.fromLabel(matcher.group(2));
            try {
                beats.add(new StoryBeat(Integer.parseInt(matcher.group(1)), matcher.group(3), status));
            } catch (IllegalArgumentException e) {
                throw new CampaignException(CampaignErrorCode.MALFORMED_SAVE,
                    source + ": broken story beat '" + trimmed + "': " + e.getMessage(), e);
            }
        }
        keep(preserved, SaveSections.STORY_PLAN, kept);
        try {
            return StoryPlan.restore(beats);
        } catch (IllegalArgumentException e) {
            throw new CampaignException(CampaignErrorCode.MALFORMED_SAVE, source + ": " + e.getMessage(), e);
        }
    }

    private List<SceneRecord> parseSceneHistory(List<String> body, String source,
                                                Map<String, List<String>> preserved) {
        List<SceneRecord> scenes = new ArrayList<>();
        List<String> kept = new ArrayList<>();
        List<String> block = null;
        for (String line : body) {
            String trimmed = line.strip();
            if (block == null) {
                if (trimmed.startsWith("<details")) {
                    block = new ArrayList<>();
                } else if (!trimmed.isEmpty()) {
                    kept.add(line);
                }
                continue;
            }
            if (trimmed.equals("</details>")) {
                scenes.add(parseScene(block, scenes.size() + 1, source));
                block = null;
            } else {
                block.add(line);
            }
        }
        keep(preserved, SaveSections.SCENE_HISTORY, kept);
        return scenes;
    }

    private SceneRecord parseScene(List<String> block, int position, String source) {
        Map<String, String> fields = new LinkedHashMap<>();
        String title = null;
        LocalDate date = null;
        List<String> summaryLines = null;
        boolean summaryOpen = false;
        for (String line : block) {
            String trimmed = line.strip();
            Matcher field = SCENE_FIELD.matcher(trimmed);
            String key = field.matches() ? field.group(1).toLowerCase(Locale.ROOT) : null;
            if (summaryOpen && (key == null || !SCENE_KEYS.contains(key))) {
                summaryLines.add(line);
                continue;
            }
            summaryOpen = false;
            Matcher summaryTag = SCENE_SUMMARY.matcher(trimmed);
            if (summaryTag.matches()) {
                title = summaryTag.group(2);
                date = date(summaryTag.group(1), source);
            } else if ("summary".equals(key)) {
                summaryLines = new ArrayList<>();
                summaryLines.add(field.group(2));
                summaryOpen = true;
            } else if (key != null) {
                fields.put(key, field.group(2).strip());
            }
        }
        if (summaryLines == null) {
            throw new CampaignException(CampaignErrorCode.MALFORMED_SAVE,
                source + ": scene " + position + " has no summary");
        }

        String sceneId = fields.getOrDefault("scene", String.format(Locale.ROOT, "scene-%04d", position));
        Instant fallback = date == null ? Instant.EPOCH : date.atStartOfDay(ZoneOffset.UTC).toInstant();
        Instant ended = fields.containsKey("ended") ? instant(fields.get("ended"), sceneId + " end", source) : fallback;
        Instant started = fields.containsKey("started")
            ? instant(fields.get("started"), sceneId + " start", source) : ended;
        Instant summarized = fields.containsKey("summarized")
            ? instant(fields.get("summarized"), sceneId + " summary", source) : ended;
        int[] covers = coverage(fields.getOrDefault("covers", "none"), sceneId, source);
        boolean forced = Boolean.parseBoolean(fields.getOrDefault("forced", "false"));
        String transcript = fields.getOrDefault("transcript", "");
        Matcher link = TRANSCRIPT_LINK.matcher(transcript);
        if (link.matches()) {
            transcript = link.group(1);
        }

        try {
            Summary summary = new Summary(sceneId, covers[0], covers[1], String.join("\n", summaryLines),
                summarized, forced);
            return new SceneRecord(sceneId, title == null ? "Untitled scene" : title, started, ended, summary,
                transcript);
        } catch (IllegalArgumentException e) {
            throw new CampaignException(CampaignErrorCode.MALFORMED_SAVE,
                source + ": broken scene " + sceneId + ": " + e.getMessage(), e);
        }
    }

    private static LocalDate date(String text, String source) {
        try {
            return LocalDate.parse(text.strip());
        } catch (DateTimeParseException e) {
            throw new CampaignException(CampaignErrorCode.MALFORMED_SAVE,
                source + ": invalid scene date '" + text + "'", e);
        }
    }

    private static int[] coverage(String text, String sceneId, String source) {
        if (text.equalsIgnoreCase("none")) {
            return new int[] {0, 0};
        }
        Matcher matcher = COVERAGE.matcher(text);
        if (!matcher.matches()) {
            throw new CampaignException(CampaignErrorCode.MALFORMED_SAVE,
                source + ": invalid turn range '" + text + "' in " + sceneId);
        }
        try {
            return new int[] {Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(2))};
        } catch (NumberFormatException e) {
            throw new CampaignException(CampaignErrorCode.MALFORMED_SAVE,
                source + ": turn range '" + text + "' out of bounds in " + sceneId, e);
        }
    }

    private List<OpenThread> parseOpenThreads(List<String> body, Instant created, String source,
                                              Map<String, List<String>> preserved) {
        List<OpenThread> threads = new ArrayList<>();
        List<String> kept = new ArrayList<>();
        for (String line : body) {
            String trimmed = line.strip();
            if (trimmed.isEmpty()) {
                continue;
            }
            try {
                Matcher matcher = THREAD.matcher(trimmed);
                if (matcher.matches()) {
                    Instant opened = matcher.group(3) == null ? created : instant(matcher.group(3), "thread", source);
                    threads.add(new OpenThread(matcher.group(2), opened, !matcher.group(1).isBlank()));
                    continue;
                }
                Matcher legacy = LEGACY_THREAD.matcher(trimmed);
                if (legacy.matches()) {
                    threads.add(OpenThread.open(legacy.group(1), created));
                } else {
                    kept.add(line);
                }
            } catch (IllegalArgumentException e) {
                throw new CampaignException(CampaignErrorCode.MALFORMED_SAVE,
                    source + ": broken open thread '" + trimmed + "': " + e.getMessage(), e);
            }
        }
        keep(preserved, SaveSections.OPEN_THREADS, kept);
        return threads;
    }

    private static void keep(Map<String, List<String>> preserved, String section, List<String> lines) {
        if (!lines.isEmpty()) {
            preserved.put(section, lines);
        }
    }

    private static CampaignException malformed(String source, int lineIndex, String problem) {
        return new CampaignException(CampaignErrorCode.MALFORMED_SAVE,
            source + " line " + (lineIndex + 1) + ": " + problem);
    }

    private record Metadata(int version, String campaign, Instant created, Instant lastPlayed, List<String> extra) {
    }
}
