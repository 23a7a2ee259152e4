package com.campaignkeeper.model;

/**
 * Master agent lifecycle: UNINITIALIZED, PLANNING, ACTIVE and PAUSED (alternating), ARCHIVED.
 */
public enum CampaignPhase {
    UNINITIALIZED,
    PLANNING,
    ACTIVE,
    PAUSED,
    ARCHIVED
}
