package com.adforge.core.scene;

import com.adforge.core.error.ErrorSummaries;
import com.adforge.core.error.SceneGenerationException;
import com.adforge.core.logging.MdcContext;
import com.adforge.core.resume.ItemOutcomeListener;
import com.adforge.core.store.CompletionMarker;
import com.adforge.core.store.ItemOutcome;
import com.adforge.core.store.ItemRecord;
import com.adforge.core.store.ItemStore;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Generates a storyboard's clips one scene at a time in ascending scene number.
 * <p>
 * Scenes are not fanned out: later scenes may build on earlier ones, and a failure must not
 * drop clips already produced. Each clip is saved the moment it exists. The first failing
 * scene stops the run with a {@link SceneGenerationException}.
 */
public class SceneSequenceRunner {

    private static final Logger log = LoggerFactory.getLogger(SceneSequenceRunner.class);

    public static final String VIDEO_URL = "videoUrl";
    public static final String VIDEO_GENERATION = "videoGeneration";

    private static final CompletionMarker HAS_VIDEO = CompletionMarker.nonBlankText(VIDEO_URL);

    private final ItemStore store;
    private final SceneTaskMapper mapper;
    private final SceneVideoGenerator generator;

    public SceneSequenceRunner(ItemStore store, SceneTaskMapper mapper, SceneVideoGenerator generator) {
        this.store = store;
        this.mapper = mapper;
        this.generator = generator;
    }

    public SceneRunSummary run(String storyboardId, boolean forceReprocess, StoryboardDefaults defaults,
                               ItemOutcomeListener listener) {
        List<ItemRecord> scenes = orderedScenes(storyboardId);
        ItemOutcomeListener events = listener != null ? listener : ItemOutcomeListener.NONE;

        List<String> videoUrls = new ArrayList<>();
        List<String> taskIds = new ArrayList<>();
        int generated = 0;
        int skipped = 0;

        for (ItemRecord record : scenes) {
            int sceneNumber = mapper.sceneNumber(record);
            if (HAS_VIDEO.isPresent(record) && !forceReprocess) {
                skipped++;
                videoUrls.add(record.payload().get(VIDEO_URL).asText());
                events.onSkipped(record.id());
                continue;
            }

            MdcContext.setItem(MdcContext.currentJobId(), record.id());
            try {
                SceneVideoResult result = generator.generate(mapper.map(record, defaults));
                ObjectNode patch = JsonNodeFactory.instance.objectNode();
                patch.put(VIDEO_URL, result.videoUrl());
                patch.set(VIDEO_GENERATION, result.provenance());
                store.save(record.id(), ItemOutcome.succeeded(patch));

                generated++;
                videoUrls.add(result.videoUrl());
                taskIds.add(result.taskId());
                events.onSucceeded(record.id());
                log.info("Scene {}/{} saved: {}", sceneNumber, scenes.size(), result.videoUrl());
            } catch (RuntimeException e) {
                recordFailure(record.id(), e);
                events.onFailed(record.id(), e);
                throw new SceneGenerationException(sceneNumber, generated, e);
            } finally {
                MdcContext.clearItem();
            }
        }

        return new SceneRunSummary(scenes.size(), generated, skipped, videoUrls, taskIds);
    }

    /**
     * Scenes of the storyboard sorted by number.
     *
     * @throws IllegalArgumentException when the storyboard is empty or numbers are not 1..n
     */
    List<ItemRecord> orderedScenes(String storyboardId) {
        List<ItemRecord> scenes = new ArrayList<>(store.listByBatch(storyboardId));
        if (scenes.isEmpty()) {
            throw new IllegalArgumentException("Storyboard " + storyboardId + " has no scenes");
        }
        scenes.sort(Comparator.comparingInt(mapper::sceneNumber));
        for (int i = 0; i < scenes.size(); i++) {
            int number = mapper.sceneNumber(scenes.get(i));
            if (number != i + 1) {
                throw new IllegalArgumentException("Storyboard " + storyboardId
                        + " scene numbers must be 1.." + scenes.size() + " without gaps; found " + number
                        + " at position " + (i + 1));
            }
        }
        return scenes;
    }

    private void recordFailure(String sceneId, RuntimeException error) {
        try {
            store.save(sceneId, ItemOutcome.failed(ErrorSummaries.message(error)));
        } catch (RuntimeException saveError) {
            log.error("Could not record failure for scene {}: {}", sceneId, saveError.getMessage(), saveError);
            error.addSuppressed(saveError);
        }
    }
}
