package ai.tabular.translator.engine;

/**
 * Model call failure caused by resource exhaustion; the batch may succeed when resubmitted
 * in smaller pieces.
 */
public class BackendResourceException extends BackendInferenceException {

    public BackendResourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
