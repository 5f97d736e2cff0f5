package com.adforge.core.error;

/**
 * A scene failed while generating a storyboard's clips in order. Earlier scenes stay persisted.
 */
public class SceneGenerationException extends TaskCoreException {

    private final int sceneNumber;
    private final int succeededBefore;

    public SceneGenerationException(int sceneNumber, int succeededBefore, Throwable cause) {
        super(cause instanceof TaskCoreException tce ? tce.kind() : ErrorKind.ITEM_PROCESSING,
                "Scene " + sceneNumber + " failed after " + succeededBefore
                        + " successful scene(s): " + ErrorSummaries.message(cause), cause);
        this.sceneNumber = sceneNumber;
        this.succeededBefore = succeededBefore;
    }

    public int sceneNumber() {
        return sceneNumber;
    }

    public int succeededBefore() {
        return succeededBefore;
    }
}
