package com.campaignkeeper.collaborator;

/**
 * Rendered media: an image or an audio clip.
 *
 * @param location URL, file path or data URI of the rendered media
 */
public record MediaPayload(String renderer, String contentType, String location) {
}
