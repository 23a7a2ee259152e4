package com.campaignkeeper.memory;

/**
 * Kinds of natural narrative break after which history may be compressed.
 */
public enum BreakReason {
    /** The owning agent is concluding its scene. */
    SCENE_CONCLUSION,
    /** A turn carried an explicit end-of-encounter marker. */
    ENCOUNTER_END,
    /** Several turns passed without NPC activity or newly introduced names. */
    IDLE
}
