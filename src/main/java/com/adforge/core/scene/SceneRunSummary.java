package com.adforge.core.scene;

import java.util.List;

/**
 * @param sceneCount scenes in the storyboard
 * @param generated  scenes generated in this run
 * @param skipped    scenes that already had a clip
 * @param videoUrls  clip URLs of every completed scene, in scene order
 * @param taskIds    provider task ids of the scenes generated in this run
 */
public record SceneRunSummary(int sceneCount, int generated, int skipped, List<String> videoUrls, List<String> taskIds) {

    public String summary() {
        if (generated == 0 && skipped == sceneCount) {
            return "All " + sceneCount + " scene(s) already have video";
        }
        return generated + " scene(s) generated, " + skipped + " already had video (" + sceneCount + " total)";
    }
}
