package com.campaignkeeper.repository;

import com.campaignkeeper.exception.CampaignErrorCode;
import com.campaignkeeper.exception.CampaignException;
import com.campaignkeeper.model.Turn;
import com.campaignkeeper.model.TurnRole;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Stores each scene's full transcript as a JSON file under {@code transcripts/<slug>/<sceneId>.json},
 * next to the save files. Written transcripts are never overwritten.
 */
public class JsonTranscriptStore implements TranscriptStore {

    private static final Logger log = LoggerFactory.getLogger(JsonTranscriptStore.class);
    private static final String TRANSCRIPTS_DIR = "transcripts";

    private final Path savesDirectory;
    private final ObjectMapper objectMapper;

    public JsonTranscriptStore(Path savesDirectory) {
        this.savesDirectory = savesDirectory;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Never replaces an existing transcript: when another campaign with the same slug already
     * archived this scene id, the file name gets a {@code -2}, {@code -3}, ... suffix.
     */
    @Override
    public String write(String campaignSlug, String sceneId, List<Turn> turns) {
        List<Map<String, String>> entries = new ArrayList<>();
        for (Turn turn : turns) {
            Map<String, String> entry = new LinkedHashMap<>();
            entry.put("role", turn.role().label());
            entry.put("content", turn.content());
            entry.put("timestamp", turn.timestamp().toString());
            if (turn.sceneId() != null) {
                entry.put("sceneId", turn.sceneId());
            }
            entries.add(entry);
        }
        String base = TRANSCRIPTS_DIR + "/" + campaignSlug + "/" + sceneId;
        try {
            byte[] json = objectMapper.writeValueAsBytes(entries);
            Files.createDirectories(resolve(base).getParent());
            for (int attempt = 1; ; attempt++) {
                String ref = attempt == 1 ? base + ".json" : base + "-" + attempt + ".json";
                try {
                    Files.write(resolve(ref), json, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
                } catch (FileAlreadyExistsException e) {
                    log.debug("Transcript {} already exists, trying the next name", ref);
                    continue;
                }
                log.debug("Archived {} turns of {} to {}", turns.size(), sceneId, ref);
                return ref;
            }
        } catch (IOException e) {
            throw new CampaignException(CampaignErrorCode.PERSISTENCE_FAILED,
                "Could not write transcript " + base + ".json: " + e.getMessage(), e);
        }
    }

    @Override
    public List<Turn> read(String transcriptRef) {
        Path file = resolve(transcriptRef);
        if (!Files.exists(file)) {
            return new ArrayList<>();
        }
        try {
            List<Map<String, String>> entries = objectMapper.readValue(
                file.toFile(),
                new TypeReference<List<Map<String, String>>>() {}
            );
            List<Turn> turns = new ArrayList<>();
            for (Map<String, String> entry : entries) {
                turns.add(new Turn(
                    TurnRole.fromLabel(entry.get("role")),
                    entry.get("content"),
                    Instant.parse(entry.get("timestamp")),
                    entry.get("sceneId")
                ));
            }
            return turns;
        } catch (IOException | RuntimeException e) {
            throw new CampaignException(CampaignErrorCode.PERSISTENCE_FAILED,
                "Could not read transcript " + transcriptRef + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void delete(String transcriptRef) {
        try {
            Files.deleteIfExists(resolve(transcriptRef));
        } catch (IOException e) {
            log.warn("Could not delete transcript {}: {}", transcriptRef, e.getMessage());
        }
    }

    private Path resolve(String ref) {
        return savesDirectory.resolve(ref).normalize();
    }
}
