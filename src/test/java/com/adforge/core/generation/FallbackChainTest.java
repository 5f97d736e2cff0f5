package com.adforge.core.generation;

import com.adforge.core.error.ConfigException;
import com.adforge.core.error.RequestShapeException;
import com.adforge.core.error.TransientRemoteException;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FallbackChainTest {

    private static final RequestShape SHAPE = (request, modelId) -> {
        var body = JsonNodeFactory.instance.objectNode().put("model", modelId);
        body.putObject("input").put("prompt", request.prompt());
        return body;
    };

    private static final ProviderConfig IMAGE = new ProviderConfig("image-to-video", "i2v-stable", true, SHAPE);
    private static final ProviderConfig IMAGE_ALT = new ProviderConfig("image-to-video-fallback", "i2v", true, SHAPE);
    private static final ProviderConfig TEXT = new ProviderConfig("text-to-video", "t2v-stable", false, SHAPE);
    private static final ProviderConfig TEXT_ALT = new ProviderConfig("text-to-video-fallback", "t2v", false, SHAPE);

    private final List<String> advances = new ArrayList<>();
    private final FallbackChain chain = new FallbackChain(List.of(IMAGE, IMAGE_ALT, TEXT, TEXT_ALT),
            (from, to, error) -> advances.add(from.name() + "->" + to.name()));

    private static GenerationRequest request(List<String> refs) {
        return new GenerationRequest("a runner at dawn", refs, null);
    }

    @Test
    @DisplayName("without reference images the image-conditioned configurations are never attempted")
    void skipsImageConfigsWithoutReferences() {
        List<String> attempted = new ArrayList<>();

        var result = chain.execute(request(List.of()), (config, body) -> {
            attempted.add(config.name());
            return "task-1";
        });

        assertEquals(List.of("text-to-video"), attempted);
        assertEquals(TEXT, result.config());
        assertTrue(advances.isEmpty());
    }

    @Test
    @DisplayName("a request-shape rejection advances to the next configuration")
    void advancesOnRequestShape() {
        List<String> models = new ArrayList<>();

        var result = chain.execute(request(List.of("https://img/avatar.png")), (config, body) -> {
            models.add(body.get("model").asText());
            if (config.imageConditioned()) {
                throw new RequestShapeException("kie", 422, "image_urls not supported");
            }
            return "task-7";
        });

        assertEquals(List.of("i2v-stable", "i2v", "t2v-stable"), models);
        assertEquals("task-7", result.value());
        assertEquals(2, result.rejections().size());
        assertEquals(List.of("image-to-video->image-to-video-fallback", "image-to-video-fallback->text-to-video"),
                advances);
    }

    @Test
    @DisplayName("a transient error does not advance the chain")
    void transientErrorPropagates() {
        List<String> attempted = new ArrayList<>();

        assertThrows(TransientRemoteException.class, () -> chain.execute(request(List.of()), (config, body) -> {
            attempted.add(config.name());
            throw new TransientRemoteException("kie", 503, "unavailable");
        }));

        assertEquals(List.of("text-to-video"), attempted);
    }

    @Test
    @DisplayName("when every configuration rejects, the last rejection is thrown")
    void allRejected() {
        var error = assertThrows(RequestShapeException.class, () -> chain.execute(request(List.of()),
                (config, body) -> { throw new RequestShapeException("kie", 400, "rejected " + config.modelId()); }));

        assertTrue(error.getMessage().endsWith("rejected t2v"));
    }

    @Test
    @DisplayName("a chain with only image configurations cannot serve a text-only request")
    void noCandidates() {
        var imageOnly = new FallbackChain(List.of(IMAGE, IMAGE_ALT));
        assertThrows(ConfigException.class, () -> imageOnly.execute(request(List.of()), (c, b) -> "x"));
    }
}
