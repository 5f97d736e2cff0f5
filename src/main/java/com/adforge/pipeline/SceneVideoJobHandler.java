package com.adforge.pipeline;

import com.adforge.core.config.ConfigGuard;
import com.adforge.core.events.JobEvent;
import com.adforge.core.events.JobEventPublisher;
import com.adforge.core.job.JobHandler;
import com.adforge.core.job.JobRecord;
import com.adforge.core.job.JobResult;
import com.adforge.core.metrics.TaskCoreMetrics;
import com.adforge.core.scene.SceneRunSummary;
import com.adforge.core.scene.SceneSequenceRunner;
import com.adforge.core.scene.StoryboardDefaults;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Generates video clips for a storyboard's scenes.
 * <p>
 * Job payload: {@code {storyboardId, forceReprocess?, characterAvatarImageUrl?, productReferenceImageUrl?}}.
 */
@Component
public class SceneVideoJobHandler implements JobHandler {

    public static final String TYPE = "scene-videos";

    private final SceneSequenceRunner runner;
    private final ConfigGuard configGuard;
    private final JobEventPublisher events;
    private final TaskCoreMetrics metrics;

    public SceneVideoJobHandler(SceneSequenceRunner runner, ConfigGuard configGuard, JobEventPublisher events,
                                TaskCoreMetrics metrics) {
        this.runner = runner;
        this.configGuard = configGuard;
        this.events = events;
        this.metrics = metrics;
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public JobResult handle(JobRecord job) {
        configGuard.requireEnv(List.of("adforge.provider.api-key"), "KIE");

        String storyboardId = JobPayloads.requireText(job.payload(), "storyboardId", job.id());
        boolean force = JobPayloads.flag(job.payload(), "forceReprocess");
        var defaults = new StoryboardDefaults(
                JobPayloads.text(job.payload(), "characterAvatarImageUrl"),
                JobPayloads.text(job.payload(), "productReferenceImageUrl"));

        SceneRunSummary summary = runner.run(storyboardId, force, defaults,
                new ItemEvents(events, metrics, job.id(), TYPE, JobEvent.SCENE_SUCCEEDED));
        return new JobResult(summary.summary());
    }
}
