package com.adforge.core.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

/**
 * Documented priority lists for the fields read out of generation-provider responses.
 * A provider adding yet another field name gets a new entry here, not a new call-site chain.
 */
public final class ProviderFields {

    private static final Logger log = LoggerFactory.getLogger(ProviderFields.class);

    /** Task id returned by a create call. */
    public static final JsonFieldResolver TASK_ID =
            JsonFieldResolver.of("taskId", "taskId", "id", "data.taskId", "data.id", "result.taskId");

    /** Raw provider state of a task. */
    public static final JsonFieldResolver STATE =
            JsonFieldResolver.of("state", "data.state", "state", "status", "data.status");

    /** Result URLs carried directly in a status response. */
    public static final JsonFieldResolver RESULT_URLS = JsonFieldResolver.of("resultUrls",
            "data.resultUrls", "data.result.resultUrls", "data.result.video_url",
            "data.result.videoUrl", "data.result.url");

    /** Embedded JSON document (a string) that some providers nest their results in. */
    public static final JsonFieldResolver RESULT_JSON = JsonFieldResolver.of("resultJson", "data.resultJson");

    /** Result URLs inside the embedded {@link #RESULT_JSON} document. */
    public static final JsonFieldResolver EMBEDDED_RESULT_URLS = JsonFieldResolver.of("resultUrls",
            "resultUrls", "resultUrl", "video_url", "videoUrl", "url", "data.resultUrls");

    public static final JsonFieldResolver ERROR_CODE = JsonFieldResolver.of("code", "code", "data.code");

    public static final JsonFieldResolver ERROR_MESSAGE = JsonFieldResolver.of("message",
            "msg", "message", "error", "data.msg", "data.message", "data.error",
            "data.reason", "data.failReason", "data.fail_reason");

    /** Items of a fetched dataset. */
    public static final JsonFieldResolver DATASET_ITEMS = JsonFieldResolver.of("items", "items", "data.items", "data");

    /** Id of one dataset item. */
    public static final JsonFieldResolver ITEM_ID = JsonFieldResolver.of("itemId", "id", "itemId", "adArchiveID", "assetId");

    private ProviderFields() {}

    /**
     * Result URLs in priority order, de-duplicated, including those of an embedded result document.
     * An unparseable embedded document is ignored.
     */
    public static List<String> resultUrls(JsonNode response, ObjectMapper mapper) {
        LinkedHashSet<String> urls = new LinkedHashSet<>(RESULT_URLS.allTexts(response));
        Optional<String> embedded = RESULT_JSON.text(response);
        if (embedded.isPresent()) {
            try {
                urls.addAll(EMBEDDED_RESULT_URLS.allTexts(mapper.readTree(embedded.get())));
            } catch (JsonProcessingException e) {
                log.debug("Ignoring unparseable resultJson: {}", e.getOriginalMessage());
            }
        }
        return List.copyOf(urls);
    }

    /**
     * Provider error detail as {@code "code=<code> <message>"}, either part optional; empty when neither exists.
     */
    public static Optional<String> errorDetail(JsonNode response) {
        Optional<String> code = ERROR_CODE.text(response);
        Optional<String> message = ERROR_MESSAGE.text(response);
        if (code.isEmpty() && message.isEmpty()) {
            return Optional.empty();
        }
        StringBuilder sb = new StringBuilder();
        code.ifPresent(c -> sb.append("code=").append(c));
        message.ifPresent(m -> sb.append(sb.length() > 0 ? " " : "").append(m));
        return Optional.of(sb.toString());
    }

    /**
     * Numeric {@code code} carried in a 2xx body, when the provider reports HTTP-like failures in-band.
     */
    public static Optional<Integer> bodyStatus(JsonNode response) {
        return ERROR_CODE.text(response).flatMap(code -> {
            try {
                return Optional.of(Integer.parseInt(code));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        });
    }
}
