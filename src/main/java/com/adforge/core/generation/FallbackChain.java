package com.adforge.core.generation;

import com.adforge.core.error.ConfigException;
import com.adforge.core.error.RequestShapeException;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Tries an ordered list of provider configurations for one generation request.
 * <p>
 * Only a {@link RequestShapeException} advances to the next configuration; every other failure
 * belongs to the current configuration's retry policy and is rethrown as is. A request without
 * reference images never tries an image-conditioned configuration. The chain keeps no state
 * between calls, so each call starts at the primary. When every configuration rejected the
 * request, the last rejection is rethrown.
 */
public class FallbackChain {

    private static final Logger log = LoggerFactory.getLogger(FallbackChain.class);

    private final List<ProviderConfig> configs;
    private final Listener listener;

    public FallbackChain(List<ProviderConfig> configs, Listener listener) {
        if (configs.isEmpty()) {
            throw new IllegalArgumentException("fallback chain needs at least one configuration");
        }
        this.configs = List.copyOf(configs);
        this.listener = listener != null ? listener : Listener.NONE;
    }

    public FallbackChain(List<ProviderConfig> configs) {
        this(configs, Listener.NONE);
    }

    public List<ProviderConfig> configs() {
        return configs;
    }

    /**
     * Configurations eligible for the request, in chain order.
     */
    public List<ProviderConfig> candidatesFor(GenerationRequest request) {
        if (request.hasReferenceImages()) {
            return configs;
        }
        return configs.stream().filter(c -> !c.imageConditioned()).toList();
    }

    /**
     * @param request the semantic request
     * @param attempt submits one shaped body; expected to be a guarded call
     * @return the first accepted attempt, with the configuration that produced it
     */
    public <T> Result<T> execute(GenerationRequest request, Attempt<T> attempt) {
        List<ProviderConfig> candidates = candidatesFor(request);
        if (candidates.isEmpty()) {
            throw new ConfigException("No text-only provider configuration for a request without reference images");
        }
        if (candidates.size() < configs.size()) {
            log.info("No reference images; starting at {}", candidates.get(0).name());
        }

        List<RequestShapeException> rejections = new ArrayList<>();
        for (int i = 0; i < candidates.size(); i++) {
            ProviderConfig config = candidates.get(i);
            ObjectNode body = config.requestShape().build(request, config.modelId());
            try {
                T value = attempt.apply(config, body);
                return new Result<>(config, value, List.copyOf(rejections));
            } catch (RequestShapeException e) {
                rejections.add(e);
                boolean hasNext = i + 1 < candidates.size();
                log.warn("{} ({}) rejected request{}: {}", config.name(), config.modelId(),
                        hasNext ? "; trying " + candidates.get(i + 1).name() : "", e.getMessage());
                if (hasNext) {
                    listener.onAdvance(config, candidates.get(i + 1), e);
                }
            }
        }
        throw rejections.get(rejections.size() - 1);
    }

    @FunctionalInterface
    public interface Attempt<T> {
        T apply(ProviderConfig config, ObjectNode body);
    }

    @FunctionalInterface
    public interface Listener {
        Listener NONE = (from, to, error) -> {};

        void onAdvance(ProviderConfig from, ProviderConfig to, RequestShapeException error);
    }

    /**
     * @param config     configuration that accepted the request
     * @param value      what the attempt returned, typically a task id
     * @param rejections request-shape rejections from earlier configurations
     */
    public record Result<T>(ProviderConfig config, T value, List<RequestShapeException> rejections) {}
}
