package com.adforge.core.scene;

import java.util.List;

/**
 * One scene of a storyboard, ready for video generation.
 *
 * @param sceneId             item id of the scene
 * @param sceneNumber         1-based, dense ordering key
 * @param prompt              video prompt
 * @param referenceImages     subject references first, then product references, no duplicate URLs
 * @param targetDurationClass clip duration
 */
public record SceneTask(
        String sceneId,
        int sceneNumber,
        String prompt,
        List<ReferenceImage> referenceImages,
        DurationClass targetDurationClass
) {

    public SceneTask {
        referenceImages = List.copyOf(referenceImages);
    }

    public List<String> referenceUrls() {
        return referenceImages.stream().map(ReferenceImage::url).toList();
    }
}
