package com.campaignkeeper.config;

import com.campaignkeeper.ProviderConfig;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Configuration for available AI models. Keys come from the environment.
 */
public class ModelsConfig {

    private static final String geminiKey = System.getenv("GEMINI_API_KEY");
    private static final String openaiKey = System.getenv("OPENAI_API_KEY");
    private static final String claudeKey = System.getenv("ANTHROPIC_API_KEY");
    private static final String grokKey = System.getenv("XAI_API_KEY");

    public static final double NARRATION_TEMPERATURE = 0.8;
    public static final double SUMMARY_TEMPERATURE = 0.2;

    /**
     * Providers the CLI can switch between with {@code /setmodel}. Model names can be
     * overridden per provider, e.g. {@code CAMPAIGN_MODEL_CLAUDE}.
     */
    public static final List<ProviderConfig> PROVIDERS = List.of(
        new ProviderConfig("gemini", model("gemini", "gemini-2.0-flash"), geminiKey),
        new ProviderConfig("chatgpt", model("chatgpt", "gpt-4o"), openaiKey),
        new ProviderConfig("claude", model("claude", "claude-sonnet-4-20250514"), claudeKey),
        new ProviderConfig("grok", model("grok", "grok-4"), grokKey)
    );

    private static String model(String providerType, String fallback) {
        String value = System.getenv("CAMPAIGN_MODEL_" + providerType.toUpperCase(Locale.ROOT));
        return value == null || value.isBlank() ? fallback : value.trim();
    }

    /**
     * The provider named by {@code CAMPAIGN_PROVIDER}, else the first one with a key.
     */
    public static Optional<ProviderConfig> defaultProvider() {
        String preferred = System.getenv("CAMPAIGN_PROVIDER");
        if (preferred != null && !preferred.isBlank()) {
            Optional<ProviderConfig> match = PROVIDERS.stream()
                .filter(p -> p.providerType().equalsIgnoreCase(preferred.trim()) && p.isConfigured())
                .findFirst();
            if (match.isPresent()) {
                return match;
            }
        }
        return PROVIDERS.stream().filter(ProviderConfig::isConfigured).findFirst();
    }

    public static String getOpenAiKey() {
        return openaiKey;
    }
}
