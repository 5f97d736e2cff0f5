package com.adforge.core.scene;

/**
 * Reference images configured for the whole storyboard, used when a scene carries none.
 */
public record StoryboardDefaults(String subjectImageUrl, String productImageUrl) {

    public static final StoryboardDefaults NONE = new StoryboardDefaults(null, null);
}
