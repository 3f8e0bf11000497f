package ai.tabular.translator.engine;

/**
 * Runtime exception raised when a translation model call fails.
 */
public class BackendInferenceException extends RuntimeException {

    public BackendInferenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
