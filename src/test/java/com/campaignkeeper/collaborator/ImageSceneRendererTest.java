package com.campaignkeeper.collaborator;

import dev.langchain4j.data.image.Image;
import dev.langchain4j.model.image.DisabledImageModel;
import dev.langchain4j.model.image.ImageModel;
import dev.langchain4j.model.output.Response;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("ImageSceneRenderer")
class ImageSceneRendererTest {

    @Test
    @DisplayName("Should prefix the visual style and return the image URL")
    void shouldRenderWithStyle() throws Exception {
        ImageModel model = mock(ImageModel.class);
        Image image = Image.builder().url(URI.create("https://img.example/cave.png")).build();
        when(model.generate("ink wash. A dark cave.")).thenReturn(Response.from(image));
        ImageSceneRenderer renderer = new ImageSceneRenderer(model, "dall-e-3", Runnable::run);
        renderer.setVisualStyle(" ink wash ");

        MediaPayload payload = renderer.render("A dark cave.").get(5, TimeUnit.SECONDS);

        assertEquals("image", payload.renderer());
        assertEquals("https://img.example/cave.png", payload.location());
    }

    @Test
    @DisplayName("Should return base64 images as data URIs")
    void shouldRenderBase64() throws Exception {
        ImageModel model = mock(ImageModel.class);
        Image image = Image.builder().base64Data("AAAA").mimeType("image/webp").build();
        when(model.generate("A dark cave.")).thenReturn(Response.from(image));

        MediaPayload payload = new ImageSceneRenderer(model, "grok-2-image", Runnable::run)
            .render("A dark cave.").get(5, TimeUnit.SECONDS);

        assertEquals("image/webp", payload.contentType());
        assertEquals("data:image/webp;base64,AAAA", payload.location());
    }

    @Test
    @DisplayName("Should fail without calling anything when image generation is disabled")
    void shouldFailWhenDisabled() {
        ImageSceneRenderer renderer = new ImageSceneRenderer(new DisabledImageModel(), "none", Runnable::run);

        CompletableFuture<MediaPayload> render = renderer.render("A dark cave.");

        assertFalse(renderer.isEnabled());
        assertThrows(ExecutionException.class, render::get);
    }
}
