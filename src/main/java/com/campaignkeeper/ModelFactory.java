package com.campaignkeeper;

import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import dev.langchain4j.model.image.DisabledImageModel;
import dev.langchain4j.model.image.ImageModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.openai.OpenAiImageModel;

import java.util.Locale;

/**
 * Factory for the langchain4j models used by the narrator, the summarizer and the scene illustrator.
 */
public class ModelFactory {

    private static final String GROK_BASE_URL = "https://api.x.ai/v1";
    private static final String OPENAI_IMAGE_MODEL = "dall-e-3";

    /**
     * Create a ChatModel based on the provider configuration.
     *
     * @param temperature sampling temperature; narration runs warmer than summarization
     */
    public static ChatModel createModel(ProviderConfig config, double temperature) {
        return switch (config.providerType().toLowerCase(Locale.ROOT)) {
            case "gemini" -> createGeminiModel(config, temperature);
            case "chatgpt" -> createOpenAIModel(config, temperature);
            case "claude" -> createClaudeModel(config, temperature);
            case "grok" -> createGrokModel(config, temperature);
            default -> throw new IllegalArgumentException("Unknown provider: " + config.providerType());
        };
    }

    /**
     * Create an ImageModel for scene illustrations, or a disabled one without an OpenAI key.
     */
    public static ImageModel createImageModel(String apiKey) {
        if (apiKey == null || apiKey.isBlank()) {
            return new DisabledImageModel();
        }
        return OpenAiImageModel.builder()
            .apiKey(apiKey)
            .modelName(OPENAI_IMAGE_MODEL)
            .responseFormat("url")
            .build();
    }

    public static String defaultImageModel() {
        return OPENAI_IMAGE_MODEL;
    }

    private static ChatModel createGeminiModel(ProviderConfig config, double temperature) {
        return GoogleAiGeminiChatModel.builder()
            .apiKey(config.apiKey())
            .modelName(config.model())
            .temperature(temperature)
            .build();
    }

    private static ChatModel createOpenAIModel(ProviderConfig config, double temperature) {
        return OpenAiChatModel.builder()
            .apiKey(config.apiKey())
            .modelName(config.model())
            .temperature(temperature)
            .build();
    }

    private static ChatModel createClaudeModel(ProviderConfig config, double temperature) {
        return AnthropicChatModel.builder()
            .apiKey(config.apiKey())
            .modelName(config.model())
            .temperature(temperature)
            .build();
    }

    private static ChatModel createGrokModel(ProviderConfig config, double temperature) {
        // Grok uses OpenAI-compatible API with custom base URL
        return OpenAiChatModel.builder()
            .apiKey(config.apiKey())
            .modelName(config.model())
            .baseUrl(GROK_BASE_URL)
            .temperature(temperature)
            .build();
    }
}
