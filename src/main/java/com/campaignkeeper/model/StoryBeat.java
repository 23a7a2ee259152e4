package com.campaignkeeper.model;

import java.util.Objects;

public record StoryBeat(int order, String description, BeatStatus status) {

    public StoryBeat {
        Objects.requireNonNull(status, "status");
        description = Texts.requireName(description, "Beat description");
        if (order < 1) {
            throw new IllegalArgumentException("Beat order must start at 1: " + order);
        }
    }

    public StoryBeat withStatus(BeatStatus newStatus) {
        return new StoryBeat(order, description, newStatus);
    }
}
