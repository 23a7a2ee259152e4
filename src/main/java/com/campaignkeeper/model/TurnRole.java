package com.campaignkeeper.model;

import java.util.Locale;

public enum TurnRole {
    PLAYER,
    NARRATOR,
    NPC;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static TurnRole fromLabel(String label) {
        return valueOf(label.trim().toUpperCase(Locale.ROOT));
    }
}
