package com.adforge.pipeline;

import com.adforge.core.config.TaskCoreProperties;
import com.adforge.core.generation.GenerationTask;
import com.adforge.core.generation.PollingOptions;
import com.adforge.core.generation.TaskPoller;
import com.adforge.core.guard.ExternalCallGuard;
import com.adforge.core.provider.PollResult;
import com.adforge.core.provider.RemoteProviderAdapter;
import com.adforge.core.resume.ItemOperation;
import com.adforge.core.store.CompletionMarker;
import com.adforge.core.store.ItemRecord;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-item remote work of an item-batch pipeline: submit the item's input as a provider task,
 * poll it to a terminal state and return the result as a patch on {@code resultField}.
 * <p>
 * Pipelines completed by an {@link CompletionMarker.Kind#OBJECT OBJECT} marker get an object
 * ({@code url}, {@code resultUrls}, {@code taskId}); the others get the first result URL as text.
 */
public class SubmitAndPollOperation implements ItemOperation {

    private static final Logger log = LoggerFactory.getLogger(SubmitAndPollOperation.class);

    private final String pipeline;
    private final TaskCoreProperties.Pipeline settings;
    private final RemoteProviderAdapter adapter;
    private final ExternalCallGuard guard;
    private final TaskPoller poller;
    private final PollingOptions polling;

    public SubmitAndPollOperation(String pipeline, TaskCoreProperties.Pipeline settings,
                                  RemoteProviderAdapter adapter, ExternalCallGuard guard,
                                  TaskPoller poller, PollingOptions polling) {
        this.pipeline = pipeline;
        this.settings = settings;
        this.adapter = adapter;
        this.guard = guard;
        this.poller = poller;
        this.polling = polling;
    }

    @Override
    public ObjectNode apply(ItemRecord record) {
        ObjectNode body = requestBody(record);
        String key = settings.getBreakerKey();
        String taskId = guard.call(key, adapter.name() + " create " + pipeline + " (" + record.id() + ")",
                token -> adapter.submit(body, token));
        log.info("Item {} submitted as {} task {}", record.id(), adapter.name(), taskId);

        GenerationTask task = new GenerationTask(adapter.name(), taskId);
        PollResult result = poller.await(task,
                id -> guard.call(key, adapter.name() + " status " + id, token -> adapter.poll(id, token)),
                polling);
        return patch(result);
    }

    ObjectNode requestBody(ItemRecord record) {
        JsonNode input = record.payload() != null ? record.payload().get(settings.getInputField()) : null;
        if (input == null || input.isNull() || (input.isTextual() && input.asText().isBlank())) {
            throw new IllegalArgumentException("Item " + record.id() + " has no '" + settings.getInputField() + "'");
        }
        ObjectNode body = JsonNodeFactory.instance.objectNode();
        if (settings.getModel() != null) {
            body.put("model", settings.getModel());
        }
        body.putObject("input").set(settings.getInputField(), input.deepCopy());
        return body;
    }

    ObjectNode patch(PollResult result) {
        ObjectNode patch = JsonNodeFactory.instance.objectNode();
        String url = result.resultUrls().get(0);
        if (settings.getCompletionKind() == CompletionMarker.Kind.OBJECT) {
            ObjectNode value = patch.putObject(settings.getResultField());
            value.put("url", url);
            var urls = value.putArray("resultUrls");
            result.resultUrls().forEach(urls::add);
            value.put("taskId", result.taskId());
        } else {
            patch.put(settings.getResultField(), url);
        }
        return patch;
    }
}
