package com.campaignkeeper.model;

/**
 * World state collections. The heading is the sub-heading used in save files.
 */
public enum EntityKind {
    NPC("NPCs"),
    LOCATION("Locations"),
    ITEM("Items");

    private final String heading;

    EntityKind(String heading) {
        this.heading = heading;
    }

    public String heading() {
        return heading;
    }

    public static EntityKind fromHeading(String heading) {
        for (EntityKind kind : values()) {
            if (kind.heading.equalsIgnoreCase(heading.trim())) {
                return kind;
            }
        }
        return null;
    }
}
