package com.campaignkeeper.exception;

import com.campaignkeeper.collaborator.CollaboratorFailure;

/**
 * Raised when an external collaborator (language model, speech, image) fails.
 * The core never retries; it only classifies the failure.
 */
public class CollaboratorException extends CampaignException {

    private final CollaboratorFailure failure;

    public CollaboratorException(CollaboratorFailure failure, String message, Throwable cause) {
        super(CampaignErrorCode.COLLABORATOR_FAILURE, message, cause);
        this.failure = failure;
    }

    public CollaboratorFailure getFailure() {
        return failure;
    }
}
