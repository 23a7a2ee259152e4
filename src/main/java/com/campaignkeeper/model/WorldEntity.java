package com.campaignkeeper.model;

import java.util.List;
import java.util.Locale;

/**
 * A named NPC, location or item. Free-text and keyed by name.
 */
public record WorldEntity(String name, String description, List<String> tags) {

    public WorldEntity {
        name = Texts.requireName(name, "Entity name");
        description = Texts.singleLine(description);
        tags = tags == null ? List.of() : tags.stream()
            .map(Texts::singleLine)
            .filter(tag -> !tag.isEmpty())
            .toList();
    }

    public WorldEntity(String name, String description) {
        this(name, description, List.of());
    }

    public String key() {
        return key(name);
    }

    static String key(String name) {
        return Texts.singleLine(name).toLowerCase(Locale.ROOT);
    }
}
