package com.campaignkeeper.exception;

/**
 * Base exception for campaign engine failures.
 */
public class CampaignException extends RuntimeException {

    private final CampaignErrorCode errorCode;

    public CampaignException(CampaignErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    public CampaignException(CampaignErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public CampaignException(CampaignErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public CampaignErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * Persistence errors abort a resume and send the caller back to planning.
     */
    public boolean isResumeFailure() {
        return errorCode == CampaignErrorCode.MALFORMED_SAVE
            || errorCode == CampaignErrorCode.SCHEMA_VERSION_MISMATCH;
    }
}
