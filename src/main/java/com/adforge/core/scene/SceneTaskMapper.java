package com.adforge.core.scene;

import com.adforge.core.provider.JsonFieldResolver;
import com.adforge.core.store.ItemRecord;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Reads a {@link SceneTask} out of a stored scene payload.
 * <p>
 * Scene fields may sit at the top level or inside a nested {@code rawJson} object; the
 * resolvers below list where each one is looked for. A reference image comes from the scene's
 * {@code referenceFrames} first, then the scene's own URL field, then the storyboard defaults.
 */
@Component
public class SceneTaskMapper {

    static final JsonFieldResolver SCENE_NUMBER =
            JsonFieldResolver.of("sceneNumber", "sceneNumber", "rawJson.sceneNumber");
    static final JsonFieldResolver PROMPT =
            JsonFieldResolver.of("videoPrompt", "videoPrompt", "rawJson.videoPrompt", "prompt", "rawJson.prompt");
    static final JsonFieldResolver DURATION = JsonFieldResolver.of("duration",
            "clipDurationSeconds", "durationSec", "rawJson.durationSec", "duration", "rawJson.duration");
    static final JsonFieldResolver REFERENCE_FRAMES =
            JsonFieldResolver.of("referenceFrames", "referenceFrames", "rawJson.referenceFrames");
    static final JsonFieldResolver SUBJECT_IMAGE = JsonFieldResolver.of("characterAvatarImageUrl",
            "characterAvatarImageUrl", "rawJson.characterAvatarImageUrl");
    static final JsonFieldResolver PRODUCT_IMAGE = JsonFieldResolver.of("productReferenceImageUrl",
            "productReferenceImageUrl", "rawJson.productReferenceImageUrl");

    /**
     * @param record   stored scene
     * @param defaults storyboard-level reference images, may be null
     * @throws IllegalArgumentException when the scene has no number or no prompt
     */
    public SceneTask map(ItemRecord record, StoryboardDefaults defaults) {
        JsonNode payload = record.payload();
        int sceneNumber = sceneNumber(record);
        String prompt = PROMPT.text(payload)
                .orElseThrow(() -> new IllegalArgumentException("Scene " + record.id() + " missing videoPrompt"));
        DurationClass duration = DurationClass.nearest(DURATION.text(payload).map(SceneTaskMapper::toDouble).orElse(null));
        return new SceneTask(record.id(), sceneNumber, prompt, referenceImages(payload, defaults), duration);
    }

    public int sceneNumber(ItemRecord record) {
        Double number = SCENE_NUMBER.text(record.payload()).map(SceneTaskMapper::toDouble).orElse(null);
        if (number == null || number != Math.floor(number) || number < 1) {
            throw new IllegalArgumentException("Scene " + record.id() + " has no valid sceneNumber");
        }
        return number.intValue();
    }

    List<ReferenceImage> referenceImages(JsonNode payload, StoryboardDefaults defaults) {
        StoryboardDefaults fallback = defaults != null ? defaults : StoryboardDefaults.NONE;

        Optional<String> subject = frameUrl(payload, ReferenceImage.Kind.SUBJECT)
                .or(() -> SUBJECT_IMAGE.text(payload))
                .or(() -> Optional.ofNullable(blankToNull(fallback.subjectImageUrl())));
        Optional<String> product = frameUrl(payload, ReferenceImage.Kind.PRODUCT)
                .or(() -> PRODUCT_IMAGE.text(payload))
                .or(() -> Optional.ofNullable(blankToNull(fallback.productImageUrl())));

        List<ReferenceImage> images = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        subject.filter(seen::add).ifPresent(url -> images.add(ReferenceImage.subject(url)));
        product.filter(seen::add).ifPresent(url -> images.add(ReferenceImage.product(url)));
        return images;
    }

    private static Optional<String> frameUrl(JsonNode payload, ReferenceImage.Kind wanted) {
        JsonNode frames = REFERENCE_FRAMES.array(payload).orElse(null);
        if (frames == null) {
            return Optional.empty();
        }
        for (JsonNode frame : frames) {
            String url = blankToNull(frame.path("url").asText(null));
            if (url != null && kindOf(frame.path("kind").asText("")) == wanted) {
                return Optional.of(url.trim());
            }
        }
        return Optional.empty();
    }

    private static ReferenceImage.Kind kindOf(String raw) {
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "character", "subject", "avatar" -> ReferenceImage.Kind.SUBJECT;
            case "product" -> ReferenceImage.Kind.PRODUCT;
            default -> null;
        };
    }

    private static Double toDouble(String value) {
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
