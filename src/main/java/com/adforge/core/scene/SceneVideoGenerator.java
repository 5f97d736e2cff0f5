package com.adforge.core.scene;

import com.adforge.core.config.TaskCoreProperties;
import com.adforge.core.generation.FallbackChain;
import com.adforge.core.generation.GenerationRequest;
import com.adforge.core.generation.GenerationTask;
import com.adforge.core.generation.PollingOptions;
import com.adforge.core.generation.ProviderConfig;
import com.adforge.core.generation.RequestShape;
import com.adforge.core.generation.TaskPoller;
import com.adforge.core.guard.ExternalCallGuard;
import com.adforge.core.provider.PollResult;
import com.adforge.core.provider.RemoteProviderAdapter;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;

/**
 * Generates one scene's clip: submit through the image/text fallback chain, then poll the
 * accepted task to completion. Submit and each status check are separate guarded calls on the
 * video breaker key.
 */
public class SceneVideoGenerator {

    private static final Logger log = LoggerFactory.getLogger(SceneVideoGenerator.class);

    private final RemoteProviderAdapter adapter;
    private final ExternalCallGuard guard;
    private final TaskPoller poller;
    private final FallbackChain chain;
    private final TaskCoreProperties.Video video;
    private final PollingOptions polling;

    public SceneVideoGenerator(RemoteProviderAdapter adapter, ExternalCallGuard guard, TaskPoller poller,
                               TaskCoreProperties properties, FallbackChain.Listener fallbackListener) {
        this.adapter = adapter;
        this.guard = guard;
        this.poller = poller;
        this.video = properties.getVideo();
        this.polling = new PollingOptions(properties.getPolling().getIntervalMs(), properties.getPolling().getMaxWaitMs());
        this.chain = new FallbackChain(videoChain(video), fallbackListener);
    }

    /**
     * Image-to-video (stable, then alternate model) followed by text-to-video (stable, then alternate model).
     */
    static List<ProviderConfig> videoChain(TaskCoreProperties.Video video) {
        return List.of(
                new ProviderConfig("image-to-video", video.getImageToVideoModel(), true, IMAGE_TO_VIDEO),
                new ProviderConfig("image-to-video-fallback", video.getImageToVideoFallbackModel(), true, IMAGE_TO_VIDEO),
                new ProviderConfig("text-to-video", video.getTextToVideoModel(), false, TEXT_TO_VIDEO),
                new ProviderConfig("text-to-video-fallback", video.getTextToVideoFallbackModel(), false, TEXT_TO_VIDEO));
    }

    static final RequestShape TEXT_TO_VIDEO = (request, modelId) -> {
        ObjectNode body = JsonNodeFactory.instance.objectNode();
        body.put("model", modelId);
        ObjectNode input = body.putObject("input");
        input.put("prompt", request.prompt());
        input.setAll(request.parameters());
        return body;
    };

    static final RequestShape IMAGE_TO_VIDEO = (request, modelId) -> {
        ObjectNode body = TEXT_TO_VIDEO.build(request, modelId);
        var urls = ((ObjectNode) body.get("input")).putArray("image_urls");
        request.referenceImageUrls().forEach(urls::add);
        return body;
    };

    public SceneVideoResult generate(SceneTask scene) {
        ObjectNode parameters = JsonNodeFactory.instance.objectNode();
        parameters.put("aspect_ratio", video.getAspectRatio());
        parameters.put("n_frames", String.valueOf(scene.targetDurationClass().seconds()));
        parameters.put("upload_method", video.getUploadMethod());
        GenerationRequest request = new GenerationRequest(scene.prompt(), scene.referenceUrls(), parameters);

        String key = video.getBreakerKey();
        FallbackChain.Result<String> submitted = chain.execute(request, (config, body) ->
                guard.call(key, adapter.name() + " create " + config.name() + " (scene " + scene.sceneNumber() + ")",
                        token -> adapter.submit(body, token)));
        String taskId = submitted.value();
        log.info("Scene {} submitted as {} task {} via {}", scene.sceneNumber(), adapter.name(), taskId,
                submitted.config().name());

        GenerationTask task = new GenerationTask(adapter.name(), taskId);
        PollResult result = poller.await(task,
                id -> guard.call(key, adapter.name() + " status " + id, token -> adapter.poll(id, token)),
                polling);

        return new SceneVideoResult(scene.sceneId(), scene.sceneNumber(), result.resultUrls().get(0), taskId,
                provenance(scene, submitted, task));
    }

    private ObjectNode provenance(SceneTask scene, FallbackChain.Result<String> submitted, GenerationTask task) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("provider", adapter.name());
        node.put("taskId", task.taskId());
        node.put("configuration", submitted.config().name());
        node.put("model", submitted.config().modelId());
        node.put("prompt", scene.prompt());
        node.put("durationSeconds", scene.targetDurationClass().seconds());
        node.put("aspectRatio", video.getAspectRatio());
        node.put("uploadMethod", video.getUploadMethod());
        node.put("polls", task.polls());
        var frames = node.putArray("referenceFrames");
        for (ReferenceImage image : scene.referenceImages()) {
            frames.addObject()
                    .put("kind", image.kind().name().toLowerCase(Locale.ROOT))
                    .put("role", image.role())
                    .put("url", image.url());
        }
        var rejected = node.putArray("rejectedConfigurations");
        submitted.rejections().forEach(e -> rejected.add(e.getMessage()));
        return node;
    }
}
