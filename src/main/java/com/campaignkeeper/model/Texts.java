package com.campaignkeeper.model;

/**
 * Text normalization shared by the model records.
 */
public final class Texts {

    private Texts() {
    }

    /**
     * Collapses all whitespace runs (including newlines) into single spaces.
     * Entity, beat and thread text is stored single-line so it fits one save file line.
     */
    public static String singleLine(String text) {
        if (text == null) {
            return "";
        }
        return text.replaceAll("\\s+", " ").trim();
    }

    public static String requireName(String name, String what) {
        String normalized = singleLine(name);
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException(what + " must not be blank");
        }
        return normalized;
    }
}
