package com.adforge.core.config;

import com.adforge.core.fanout.PartialFailurePolicy;
import com.adforge.core.store.CompletionMarker;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "adforge")
public class TaskCoreProperties {

    private Guard guard = new Guard();
    private Map<String, Dependency> dependencies = new LinkedHashMap<>();
    private Fanout fanout = new Fanout();
    private Polling polling = new Polling();
    private Provider provider = new Provider();
    private Video video = new Video();
    private Map<String, Pipeline> pipelines = new LinkedHashMap<>();

    public Guard getGuard() { return guard; }
    public void setGuard(Guard guard) { this.guard = guard; }
    public Map<String, Dependency> getDependencies() { return dependencies; }
    public void setDependencies(Map<String, Dependency> dependencies) { this.dependencies = dependencies; }
    public Fanout getFanout() { return fanout; }
    public void setFanout(Fanout fanout) { this.fanout = fanout; }
    public Polling getPolling() { return polling; }
    public void setPolling(Polling polling) { this.polling = polling; }
    public Provider getProvider() { return provider; }
    public void setProvider(Provider provider) { this.provider = provider; }
    public Video getVideo() { return video; }
    public void setVideo(Video video) { this.video = video; }
    public Map<String, Pipeline> getPipelines() { return pipelines; }
    public void setPipelines(Map<String, Pipeline> pipelines) { this.pipelines = pipelines; }

    /** Defaults applied to every guarded call. */
    public static class Guard {
        private long timeoutMs = 60_000;
        private int retries = 2;
        private long baseDelayMs = 500;
        private long maxDelayMs = 5_000;
        private int failureThreshold = 3;
        private long cooldownMs = 60_000;

        public long getTimeoutMs() { return timeoutMs; }
        public void setTimeoutMs(long timeoutMs) { this.timeoutMs = timeoutMs; }
        public int getRetries() { return retries; }
        public void setRetries(int retries) { this.retries = retries; }
        public long getBaseDelayMs() { return baseDelayMs; }
        public void setBaseDelayMs(long baseDelayMs) { this.baseDelayMs = baseDelayMs; }
        public long getMaxDelayMs() { return maxDelayMs; }
        public void setMaxDelayMs(long maxDelayMs) { this.maxDelayMs = maxDelayMs; }
        public int getFailureThreshold() { return failureThreshold; }
        public void setFailureThreshold(int failureThreshold) { this.failureThreshold = failureThreshold; }
        public long getCooldownMs() { return cooldownMs; }
        public void setCooldownMs(long cooldownMs) { this.cooldownMs = cooldownMs; }
    }

    /** Per-breaker-key overrides; unset fields fall back to {@link Guard}. */
    public static class Dependency {
        private Long timeoutMs;
        private Integer retries;
        private Long baseDelayMs;
        private Long maxDelayMs;
        private Integer failureThreshold;
        private Long cooldownMs;

        public Long getTimeoutMs() { return timeoutMs; }
        public void setTimeoutMs(Long timeoutMs) { this.timeoutMs = timeoutMs; }
        public Integer getRetries() { return retries; }
        public void setRetries(Integer retries) { this.retries = retries; }
        public Long getBaseDelayMs() { return baseDelayMs; }
        public void setBaseDelayMs(Long baseDelayMs) { this.baseDelayMs = baseDelayMs; }
        public Long getMaxDelayMs() { return maxDelayMs; }
        public void setMaxDelayMs(Long maxDelayMs) { this.maxDelayMs = maxDelayMs; }
        public Integer getFailureThreshold() { return failureThreshold; }
        public void setFailureThreshold(Integer failureThreshold) { this.failureThreshold = failureThreshold; }
        public Long getCooldownMs() { return cooldownMs; }
        public void setCooldownMs(Long cooldownMs) { this.cooldownMs = cooldownMs; }
    }

    public static class Fanout {
        private int concurrency = 5;
        private PartialFailurePolicy partialFailure = PartialFailurePolicy.AGGREGATE_AND_THROW;

        public int getConcurrency() { return concurrency; }
        public void setConcurrency(int concurrency) { this.concurrency = concurrency; }
        public PartialFailurePolicy getPartialFailure() { return partialFailure; }
        public void setPartialFailure(PartialFailurePolicy partialFailure) { this.partialFailure = partialFailure; }
    }

    public static class Polling {
        private long intervalMs = 30_000;
        private long maxWaitMs = 720_000;

        public long getIntervalMs() { return intervalMs; }
        public void setIntervalMs(long intervalMs) { this.intervalMs = intervalMs; }
        public long getMaxWaitMs() { return maxWaitMs; }
        public void setMaxWaitMs(long maxWaitMs) { this.maxWaitMs = maxWaitMs; }
    }

    /** The HTTP generation provider used by pipelines and scene video generation. */
    public static class Provider {
        private String name = "kie";
        private String baseUrl = "https://api.kie.ai/api/v1";
        private String apiKey;
        private String createPath = "/jobs/createTask";
        private String statusPath = "/jobs/recordInfo?taskId={taskId}";
        private String datasetPath = "/datasets/{datasetId}/items";
        private long requestTimeoutMs = 60_000;
        private Map<String, String> extraHeaders = new LinkedHashMap<>(Map.of("x-kie-spend-confirm", "1"));
        private Map<String, String> states = new LinkedHashMap<>();

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }
        public String getCreatePath() { return createPath; }
        public void setCreatePath(String createPath) { this.createPath = createPath; }
        public String getStatusPath() { return statusPath; }
        public void setStatusPath(String statusPath) { this.statusPath = statusPath; }
        public String getDatasetPath() { return datasetPath; }
        public void setDatasetPath(String datasetPath) { this.datasetPath = datasetPath; }
        public long getRequestTimeoutMs() { return requestTimeoutMs; }
        public void setRequestTimeoutMs(long requestTimeoutMs) { this.requestTimeoutMs = requestTimeoutMs; }
        public Map<String, String> getExtraHeaders() { return extraHeaders; }
        public void setExtraHeaders(Map<String, String> extraHeaders) { this.extraHeaders = extraHeaders; }
        /** Additional provider state strings mapped onto SUCCEEDED, FAILED or IN_PROGRESS. */
        public Map<String, String> getStates() { return states; }
        public void setStates(Map<String, String> states) { this.states = states; }
    }

    public static class Video {
        private String breakerKey = "kie:video-generation";
        private String imageToVideoModel = "sora-2-image-to-video-stable";
        private String imageToVideoFallbackModel = "sora-2-image-to-video";
        private String textToVideoModel = "sora-2-text-to-video-stable";
        private String textToVideoFallbackModel = "sora-2-text-to-video";
        private String aspectRatio = "portrait";
        private String uploadMethod = "s3";

        public String getBreakerKey() { return breakerKey; }
        public void setBreakerKey(String breakerKey) { this.breakerKey = breakerKey; }
        public String getImageToVideoModel() { return imageToVideoModel; }
        public void setImageToVideoModel(String imageToVideoModel) { this.imageToVideoModel = imageToVideoModel; }
        public String getImageToVideoFallbackModel() { return imageToVideoFallbackModel; }
        public void setImageToVideoFallbackModel(String imageToVideoFallbackModel) { this.imageToVideoFallbackModel = imageToVideoFallbackModel; }
        public String getTextToVideoModel() { return textToVideoModel; }
        public void setTextToVideoModel(String textToVideoModel) { this.textToVideoModel = textToVideoModel; }
        public String getTextToVideoFallbackModel() { return textToVideoFallbackModel; }
        public void setTextToVideoFallbackModel(String textToVideoFallbackModel) { this.textToVideoFallbackModel = textToVideoFallbackModel; }
        public String getAspectRatio() { return aspectRatio; }
        public void setAspectRatio(String aspectRatio) { this.aspectRatio = aspectRatio; }
        public String getUploadMethod() { return uploadMethod; }
        public void setUploadMethod(String uploadMethod) { this.uploadMethod = uploadMethod; }
    }

    /**
     * One item-batch pipeline (transcription, quality gate, ...), keyed by job type.
     * Unset concurrency and partial-failure values fall back to {@link Fanout}.
     */
    public static class Pipeline {
        private String breakerKey;
        private Integer concurrency;
        private PartialFailurePolicy partialFailure;
        private String model;
        private String inputField = "sourceUrl";
        private String resultField;
        private String completionField;
        private CompletionMarker.Kind completionKind = CompletionMarker.Kind.NON_BLANK_TEXT;
        private List<String> requiredEnv = new ArrayList<>();

        public String getBreakerKey() { return breakerKey; }
        public void setBreakerKey(String breakerKey) { this.breakerKey = breakerKey; }
        public Integer getConcurrency() { return concurrency; }
        public void setConcurrency(Integer concurrency) { this.concurrency = concurrency; }
        public PartialFailurePolicy getPartialFailure() { return partialFailure; }
        public void setPartialFailure(PartialFailurePolicy partialFailure) { this.partialFailure = partialFailure; }
        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }
        public String getInputField() { return inputField; }
        public void setInputField(String inputField) { this.inputField = inputField; }
        public String getResultField() { return resultField; }
        public void setResultField(String resultField) { this.resultField = resultField; }
        public String getCompletionField() { return completionField != null ? completionField : resultField; }
        public void setCompletionField(String completionField) { this.completionField = completionField; }
        public CompletionMarker.Kind getCompletionKind() { return completionKind; }
        public void setCompletionKind(CompletionMarker.Kind completionKind) { this.completionKind = completionKind; }
        public List<String> getRequiredEnv() { return requiredEnv; }
        public void setRequiredEnv(List<String> requiredEnv) { this.requiredEnv = requiredEnv; }
    }
}
