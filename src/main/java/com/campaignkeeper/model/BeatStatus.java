package com.campaignkeeper.model;

import java.util.Locale;

public enum BeatStatus {
    PENDING,
    ACTIVE,
    DONE;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static BeatStatus fromLabel(String label) {
        return valueOf(label.trim().toUpperCase(Locale.ROOT));
    }
}
