package com.campaignkeeper.model;

import java.util.Objects;

/**
 * Request to move the beat at {@code order} to {@code target}.
 */
public record BeatTransition(int order, BeatStatus target) {

    public BeatTransition {
        Objects.requireNonNull(target, "target");
    }
}
