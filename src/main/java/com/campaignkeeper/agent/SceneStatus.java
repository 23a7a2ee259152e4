package com.campaignkeeper.agent;

public enum SceneStatus {
    SPAWNED,
    ACTIVE,
    CONCLUDING,
    TERMINATED
}
