package com.adforge.core.provider;

import com.fasterxml.jackson.core.JsonPointer;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Ordered-fallback lookup of one logical field across the shapes providers return it in.
 * Paths are tried in declaration order; the first usable value wins.
 */
public final class JsonFieldResolver {

    private final String field;
    private final List<JsonPointer> paths;

    private JsonFieldResolver(String field, List<JsonPointer> paths) {
        this.field = field;
        this.paths = paths;
    }

    /**
     * @param field logical field name, for messages
     * @param paths dotted paths such as {@code "data.taskId"}, highest priority first
     */
    public static JsonFieldResolver of(String field, String... paths) {
        return new JsonFieldResolver(field, Arrays.stream(paths)
                .map(p -> JsonPointer.compile("/" + p.replace('.', '/')))
                .toList());
    }

    public String field() {
        return field;
    }

    /**
     * First non-blank string or number among the paths, trimmed.
     */
    public Optional<String> text(JsonNode root) {
        if (root == null) {
            return Optional.empty();
        }
        for (JsonPointer path : paths) {
            JsonNode value = root.at(path);
            if (value.isTextual() && !value.asText().isBlank()) {
                return Optional.of(value.asText().trim());
            }
            if (value.isNumber()) {
                return Optional.of(value.asText());
            }
        }
        return Optional.empty();
    }

    /**
     * First path holding a non-null node of any type.
     */
    public Optional<JsonNode> node(JsonNode root) {
        if (root == null) {
            return Optional.empty();
        }
        for (JsonPointer path : paths) {
            JsonNode value = root.at(path);
            if (!value.isMissingNode() && !value.isNull()) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    /**
     * First path holding a JSON array.
     */
    public Optional<JsonNode> array(JsonNode root) {
        if (root == null) {
            return Optional.empty();
        }
        for (JsonPointer path : paths) {
            JsonNode value = root.at(path);
            if (value.isArray()) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    /**
     * Every non-blank string from every path, in path order; arrays contribute each element.
     */
    public List<String> allTexts(JsonNode root) {
        List<String> values = new ArrayList<>();
        if (root == null) {
            return values;
        }
        for (JsonPointer path : paths) {
            JsonNode value = root.at(path);
            if (value.isArray()) {
                value.forEach(element -> addText(values, element));
            } else {
                addText(values, value);
            }
        }
        return values;
    }

    private static void addText(List<String> values, JsonNode node) {
        if (node.isTextual() && !node.asText().isBlank()) {
            values.add(node.asText().trim());
        }
    }
}
