package com.campaignkeeper.config;

import java.util.Arrays;
import java.util.List;

/**
 * Budgets and heuristics for history compression.
 *
 * @param contextBudgetTokens cost above which compression is wanted at the next narrative break
 * @param hardCeilingTokens cost above which compression is forced even without a break
 * @param idleTurnThreshold consecutive turns without NPC activity or new names that count as a break
 * @param keepRecentTurns turns left uncompressed when the hard ceiling forces compression
 * @param summaryMaxChars upper bound on summary length, independent of input length
 * @param encounterEndMarkers case-insensitive markers that end an encounter when found in a turn
 */
public record MemoryConfig(
    int contextBudgetTokens,
    int hardCeilingTokens,
    int idleTurnThreshold,
    int keepRecentTurns,
    int summaryMaxChars,
    List<String> encounterEndMarkers
) {

    public static final int DEFAULT_CONTEXT_BUDGET = 4000;
    public static final List<String> DEFAULT_MARKERS = List.of("[end encounter]", "/endencounter", "[scene break]");

    public MemoryConfig {
        if (contextBudgetTokens <= 0) {
            throw new IllegalArgumentException("contextBudgetTokens must be positive");
        }
        if (hardCeilingTokens < contextBudgetTokens) {
            throw new IllegalArgumentException("hardCeilingTokens must not be below contextBudgetTokens");
        }
        if (idleTurnThreshold < 1 || keepRecentTurns < 0 || summaryMaxChars < 80) {
            throw new IllegalArgumentException("Invalid compression thresholds");
        }
        encounterEndMarkers = List.copyOf(encounterEndMarkers);
    }

    public static MemoryConfig defaults() {
        return new MemoryConfig(DEFAULT_CONTEXT_BUDGET, DEFAULT_CONTEXT_BUDGET * 2, 6, 2, 1200, DEFAULT_MARKERS);
    }

    /**
     * Reads overrides from CAMPAIGN_CONTEXT_BUDGET, CAMPAIGN_HARD_CEILING, CAMPAIGN_IDLE_TURNS,
     * CAMPAIGN_KEEP_RECENT, CAMPAIGN_SUMMARY_CHARS and CAMPAIGN_BREAK_MARKERS (comma separated).
     */
    public static MemoryConfig fromEnvironment() {
        MemoryConfig defaults = defaults();
        int budget = intEnv("CAMPAIGN_CONTEXT_BUDGET", defaults.contextBudgetTokens());
        String markers = System.getenv("CAMPAIGN_BREAK_MARKERS");
        return new MemoryConfig(
            budget,
            intEnv("CAMPAIGN_HARD_CEILING", budget * 2),
            intEnv("CAMPAIGN_IDLE_TURNS", defaults.idleTurnThreshold()),
            intEnv("CAMPAIGN_KEEP_RECENT", defaults.keepRecentTurns()),
            intEnv("CAMPAIGN_SUMMARY_CHARS", defaults.summaryMaxChars()),
            (markers == null || markers.isBlank())
                ? defaults.encounterEndMarkers()
                : Arrays.stream(markers.split(",")).map(String::trim).filter(m -> !m.isEmpty()).toList()
        );
    }

    private static int intEnv(String name, int fallback) {
        String value = System.getenv(name);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer: " + value, e);
        }
    }
}
