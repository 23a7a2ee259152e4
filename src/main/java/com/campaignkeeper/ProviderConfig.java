package com.campaignkeeper;

import java.util.Locale;

/**
 * Configuration record for a language-model provider.
 *
 * @param providerType gemini, chatgpt, claude or grok
 * @param model the model identifier to use
 * @param apiKey the API key, {@code null} when the provider is not configured
 */
public record ProviderConfig(
    String providerType,
    String model,
    String apiKey
) {

    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    /**
     * Display name like "ChatGPT (gpt-4o)".
     */
    public String getDisplayName() {
        String name = switch (providerType.toLowerCase(Locale.ROOT)) {
            case "gemini" -> "Gemini";
            case "chatgpt" -> "ChatGPT";
            case "claude" -> "Claude";
            case "grok" -> "Grok";
            default -> providerType;
        };
        return name + " (" + model + ")";
    }
}
