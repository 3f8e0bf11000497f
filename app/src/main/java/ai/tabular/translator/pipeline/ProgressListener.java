package ai.tabular.translator.pipeline;

/**
 * Receives progress updates from the pipeline thread after every batch.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = (completed, total, message) -> { };

    void onProgress(int completedUnits, int totalUnits, String message);
}
