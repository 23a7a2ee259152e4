package com.campaignkeeper.collaborator;

import dev.langchain4j.data.image.Image;
import dev.langchain4j.model.image.DisabledImageModel;
import dev.langchain4j.model.image.ImageModel;
import dev.langchain4j.model.output.Response;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Illustrates scenes with a langchain4j image model (OpenAI images, or Grok through the same API).
 */
public class ImageSceneRenderer implements MediaRenderer {

    public static final String NAME = "image";

    private final ImageModel imageModel;
    private final String modelName;
    private final Executor executor;
    private volatile String visualStyle = "";

    public ImageSceneRenderer(ImageModel imageModel, String modelName, Executor executor) {
        this.imageModel = imageModel;
        this.modelName = modelName;
        this.executor = executor;
    }

    @Override
    public String name() {
        return NAME;
    }

    public String getModelName() {
        return modelName;
    }

    public boolean isEnabled() {
        return !(imageModel instanceof DisabledImageModel);
    }

    /**
     * Style prefix added to every prompt, e.g. "ink and watercolour, muted palette".
     */
    public void setVisualStyle(String visualStyle) {
        this.visualStyle = visualStyle == null ? "" : visualStyle.strip();
    }

    @Override
    public CompletableFuture<MediaPayload> render(String sceneDescription) {
        if (!isEnabled()) {
            return CompletableFuture.failedFuture(
                new IllegalStateException("Image generation is disabled. Set OPENAI_API_KEY to enable it."));
        }
        String prompt = visualStyle.isEmpty() ? sceneDescription : visualStyle + ". " + sceneDescription;
        return CompletableFuture.supplyAsync(() -> toPayload(imageModel.generate(prompt)), executor);
    }

    private MediaPayload toPayload(Response<Image> response) {
        Image image = response.content();
        if (image == null) {
            throw new IllegalStateException("No image returned by " + modelName);
        }
        if (image.url() != null) {
            return new MediaPayload(NAME, image.mimeType() != null ? image.mimeType() : "image/png",
                image.url().toString());
        }
        if (image.base64Data() != null) {
            String mimeType = image.mimeType() != null ? image.mimeType() : "image/png";
            return new MediaPayload(NAME, mimeType, "data:" + mimeType + ";base64," + image.base64Data());
        }
        throw new IllegalStateException("Image response did not include a URL or base64 data");
    }
}
