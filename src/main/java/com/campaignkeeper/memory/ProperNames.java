package com.campaignkeeper.memory;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Crude proper-name extraction: capitalized words that do not open a sentence.
 */
public final class ProperNames {

    private ProperNames() {
    }

    /**
     * Returns the lower-cased candidate names in order of first appearance.
     */
    public static Set<String> extract(String text) {
        Set<String> names = new LinkedHashSet<>();
        if (text == null) {
            return names;
        }
        String[] words = text.split("\\s+");
        boolean sentenceStart = true;
        for (String raw : words) {
            String word = raw.replaceAll("^[^\\p{L}]+|[^\\p{L}'-]+$", "");
            boolean opensSentence = sentenceStart || raw.startsWith("\"") || raw.startsWith("'");
            if (word.length() > 1 && Character.isUpperCase(word.charAt(0)) && !opensSentence) {
                names.add(word.toLowerCase(Locale.ROOT));
            }
            sentenceStart = raw.endsWith(".") || raw.endsWith("!") || raw.endsWith("?")
                || raw.endsWith(".\"") || raw.endsWith("!\"") || raw.endsWith("?\"") || raw.endsWith(":");
        }
        return names;
    }
}
