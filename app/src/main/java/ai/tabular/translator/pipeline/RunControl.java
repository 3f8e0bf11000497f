package ai.tabular.translator.pipeline;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation flag for one run. Cancellation takes effect between batches; a batch that
 * has started always finishes.
 */
public class RunControl {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
