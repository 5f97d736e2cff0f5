package com.adforge.core.scene;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * @param provenance how the clip was produced: provider, task id, model, inputs
 */
public record SceneVideoResult(String sceneId, int sceneNumber, String videoUrl, String taskId, ObjectNode provenance) {}
