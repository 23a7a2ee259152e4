package com.campaignkeeper.exception;

/**
 * Error codes raised by the campaign engine.
 */
public enum CampaignErrorCode {

    // history and compression, recoverable by the owning agent
    INVALID_TURN_ORDER("MEM_001", "Turn timestamp is not after the last appended turn"),
    COMPRESSION_FAILED("MEM_002", "Summarization produced no usable summary"),

    // campaign state
    INVALID_BEAT_TRANSITION("STA_001", "Story beat transition is not allowed"),
    SCENE_ALREADY_TERMINATED("STA_002", "Scene has already terminated"),
    MERGE_CONFLICT("STA_003", "Scene delta does not match the live scene"),
    INVALID_STATE("STA_004", "Operation is not allowed in the current phase"),
    CAMPAIGN_ARCHIVED("STA_005", "Campaign is archived"),
    INVALID_THREAD("STA_006", "Open thread text must not be blank"),

    // persistence
    SCHEMA_VERSION_MISMATCH("PER_001", "Save file schema version is newer than supported"),
    MALFORMED_SAVE("PER_002", "Save file could not be parsed"),
    PERSISTENCE_FAILED("PER_003", "Save file could not be written"),

    // collaborators
    COLLABORATOR_FAILURE("EXT_001", "Collaborator call failed");

    private final String code;
    private final String message;

    CampaignErrorCode(String code, String message) {
        this.code = code;
        this.message = message;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
