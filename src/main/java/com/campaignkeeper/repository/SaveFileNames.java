package com.campaignkeeper.repository;

import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Naming of save files: {@code <campaign-slug>_<UTC timestamp>.dnd-save.md}.
 * Colons are replaced in the timestamp so the name is valid on every file system.
 */
public final class SaveFileNames {

    public static final String EXTENSION = ".dnd-save.md";

    private static final DateTimeFormatter TIMESTAMP =
        DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH-mm-ss'Z'", Locale.ROOT).withZone(ZoneOffset.UTC);

    private SaveFileNames() {
    }

    public static String slug(String campaignName) {
        String slug = campaignName.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-");
        slug = slug.replaceAll("^-+|-+$", "");
        return slug.isEmpty() ? "campaign" : slug;
    }

    public static String fileName(String campaignName, Instant savedAt) {
        return slug(campaignName) + "_" + TIMESTAMP.format(savedAt) + EXTENSION;
    }

    public static boolean isSaveFile(Path path) {
        return path.getFileName().toString().endsWith(EXTENSION);
    }

    /**
     * Slug part of a save file name, or {@code null} if the name does not follow the pattern.
     */
    public static String slugOf(Path path) {
        String name = path.getFileName().toString();
        if (!name.endsWith(EXTENSION)) {
            return null;
        }
        int separator = name.lastIndexOf('_');
        return separator <= 0 ? null : name.substring(0, separator);
    }
}
