package ai.tabular.translator.table;

/**
 * Reading or writing a table failed; fatal for the whole run.
 */
public class TableIoException extends RuntimeException {

    public TableIoException(String message) {
        super(message);
    }

    public TableIoException(String message, Throwable cause) {
        super(message, cause);
    }
}
