package com.adforge.core.provider;

import com.adforge.core.config.TaskCoreProperties;
import com.adforge.core.error.ConfigException;
import com.adforge.core.error.HttpErrors;
import com.adforge.core.error.RequestShapeException;
import com.adforge.core.error.TransientRemoteException;
import com.adforge.core.guard.CancellationToken;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.regex.Pattern;

/**
 * {@link RemoteProviderAdapter} for JSON job APIs of the create-task / record-info kind.
 * <p>
 * Requests carry a bearer token, a fresh {@code X-Request-Id} and any configured extra headers.
 * Non-2xx responses are classified with {@link HttpErrors}; an HTML body means the base URL
 * points at a website rather than the API and is reported as a configuration error. Bearer
 * tokens never appear in error messages. Cancelling the call's token aborts the exchange.
 */
public class HttpJsonProviderAdapter implements RemoteProviderAdapter {

    private static final Logger log = LoggerFactory.getLogger(HttpJsonProviderAdapter.class);

    private static final Pattern BEARER = Pattern.compile("(Bearer\\s+)[A-Za-z0-9._~+/=-]+", Pattern.CASE_INSENSITIVE);
    private static final int SNIPPET_LENGTH = 500;

    private final TaskCoreProperties.Provider settings;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final ProviderStateTable states;

    public HttpJsonProviderAdapter(TaskCoreProperties.Provider settings, ObjectMapper objectMapper,
                                   ProviderStateTable states) {
        this(settings, HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(),
                objectMapper, states);
    }

    HttpJsonProviderAdapter(TaskCoreProperties.Provider settings, HttpClient httpClient,
                            ObjectMapper objectMapper, ProviderStateTable states) {
        this.settings = settings;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.states = states;
    }

    @Override
    public String name() {
        return settings.getName();
    }

    @Override
    public String submit(JsonNode input, CancellationToken token) throws Exception {
        JsonNode response = send("POST", settings.getCreatePath(), input, token);
        var taskId = ProviderFields.TASK_ID.text(response);
        if (taskId.isPresent()) {
            log.info("{} task {} created", name(), taskId.get());
            return taskId.get();
        }

        String detail = ProviderFields.errorDetail(response).orElse(null);
        var bodyStatus = ProviderFields.bodyStatus(response);
        if (bodyStatus.isPresent() && bodyStatus.get() >= 400) {
            throw HttpErrors.fromStatus(name(), bodyStatus.get(), detail);
        }
        throw new RequestShapeException(name(), 0,
                detail != null ? detail : "create response missing taskId: " + snippet(response.toString()));
    }

    @Override
    public PollResult poll(String taskId, CancellationToken token) throws Exception {
        String path = settings.getStatusPath().replace("{taskId}", encode(taskId));
        JsonNode response = send("GET", path, null, token);

        String rawState = ProviderFields.STATE.text(response).orElse("");
        if (rawState.isEmpty()) {
            var bodyStatus = ProviderFields.bodyStatus(response);
            if (bodyStatus.isPresent() && bodyStatus.get() >= 400) {
                throw HttpErrors.fromStatus(name(), bodyStatus.get(),
                        ProviderFields.errorDetail(response).orElse(null));
            }
        }

        ProviderStatus status = states.normalize(rawState);
        List<String> urls = status == ProviderStatus.SUCCEEDED
                ? ProviderFields.resultUrls(response, objectMapper) : List.of();
        String detail = status == ProviderStatus.FAILED
                ? ProviderFields.errorDetail(response).orElse(null) : null;
        log.debug("{} task {} state='{}' ({})", name(), taskId, rawState, status);
        return new PollResult(taskId, rawState, status, urls, detail, response);
    }

    @Override
    public List<RemoteItem> fetchBatch(String datasetId, CancellationToken token) throws Exception {
        String path = settings.getDatasetPath().replace("{datasetId}", encode(datasetId));
        JsonNode response = send("GET", path, null, token);

        JsonNode array = response.isArray() ? response
                : ProviderFields.DATASET_ITEMS.array(response).orElse(null);
        if (array == null) {
            throw new RequestShapeException(name(), 0, "dataset " + datasetId + " response has no item array");
        }

        List<RemoteItem> items = new ArrayList<>();
        int index = 0;
        for (JsonNode element : array) {
            if (element.isObject()) {
                String id = ProviderFields.ITEM_ID.text(element).orElse(datasetId + ":" + index);
                items.add(new RemoteItem(id, (ObjectNode) element));
            } else {
                log.warn("Skipping non-object entry {} of dataset {}", index, datasetId);
            }
            index++;
        }
        log.info("Fetched {} item(s) from {} dataset {}", items.size(), name(), datasetId);
        return items;
    }

    // ── HTTP plumbing ────────────────────────────────────────────────────

    JsonNode send(String method, String path, JsonNode body, CancellationToken token) throws Exception {
        String apiKey = settings.getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            throw new ConfigException(name() + ": adforge.provider.api-key must be set");
        }
        token.throwIfCancelled();

        var builder = HttpRequest.newBuilder()
                .uri(URI.create(trimTrailingSlash(settings.getBaseUrl()) + (path.startsWith("/") ? "" : "/") + path))
                .timeout(Duration.ofMillis(settings.getRequestTimeoutMs()))
                .header("Authorization", "Bearer " + apiKey)
                .header("Accept", "application/json")
                .header("X-Request-Id", UUID.randomUUID().toString());
        for (Map.Entry<String, String> header : settings.getExtraHeaders().entrySet()) {
            builder.header(header.getKey(), header.getValue());
        }
        if ("POST".equals(method)) {
            builder.header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(
                            objectMapper.writeValueAsString(body != null ? body : JsonNodeFactory.instance.objectNode())));
        } else {
            builder.GET();
        }

        HttpResponse<String> response = exchange(builder.build(), method, path, token);
        String text = response.body() != null ? response.body() : "";

        if (looksLikeHtml(text)) {
            throw new ConfigException(name() + " returned HTML for " + method + " " + path
                    + " (wrong base URL?): set adforge.provider.base-url to the API host");
        }

        JsonNode json = parse(text);
        int status = response.statusCode();
        if (status >= 400) {
            String detail = json != null
                    ? ProviderFields.errorDetail(json).orElse(snippet(text))
                    : snippet(text);
            throw HttpErrors.fromStatus(name(), status, redact(detail, apiKey));
        }
        if (json == null) {
            throw new TransientRemoteException(name(), status,
                    name() + " " + method + " " + path + " returned invalid JSON: " + redact(snippet(text), apiKey));
        }
        return json;
    }

    private HttpResponse<String> exchange(HttpRequest request, String method, String path,
                                          CancellationToken token) throws Exception {
        CompletableFuture<HttpResponse<String>> future =
                httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString());
        try (var ignored = token.onCancel(() -> future.cancel(true))) {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof HttpTimeoutException) {
                throw new TransientRemoteException(name(), -1,
                        name() + " request timed out after " + settings.getRequestTimeoutMs() + "ms: " + method + " " + path);
            }
            if (cause instanceof IOException io) {
                throw new TransientRemoteException(name(), method + " " + path + " failed: "
                        + redact(String.valueOf(io.getMessage()), settings.getApiKey()), io);
            }
            if (cause instanceof Exception ex) {
                throw ex;
            }
            throw e;
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        }
    }

    private JsonNode parse(String text) {
        if (text.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    static boolean looksLikeHtml(String text) {
        String head = text.stripLeading().toLowerCase(Locale.ROOT);
        return head.startsWith("<!doctype html") || head.startsWith("<html");
    }

    static String redact(String text, String apiKey) {
        if (text == null) {
            return null;
        }
        String redacted = BEARER.matcher(text).replaceAll("$1[REDACTED]");
        if (apiKey != null && !apiKey.isBlank()) {
            redacted = redacted.replace(apiKey, "[REDACTED]");
        }
        return redacted;
    }

    private static String snippet(String text) {
        return text.length() <= SNIPPET_LENGTH ? text : text.substring(0, SNIPPET_LENGTH) + "...";
    }

    private static String trimTrailingSlash(String url) {
        return url.replaceAll("/+$", "");
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
