package com.campaignkeeper.collaborator;

/**
 * A finished render, tagged with the turn it was requested for.
 *
 * @param payload the media, or {@code null} when rendering failed
 * @param failure the classified failure, or {@code null} on success
 */
public record MediaResult(long turnSequence, String renderer, MediaPayload payload, CollaboratorFailure failure) {

    public boolean succeeded() {
        return failure == null;
    }
}
