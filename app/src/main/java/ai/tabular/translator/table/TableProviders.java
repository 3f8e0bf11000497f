package ai.tabular.translator.table;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Selects a {@link TableProvider} from the file extension.
 */
public final class TableProviders {

    private TableProviders() {
    }

    public static TableProvider forPath(Path path) {
        String name = path.getFileName() == null ? "" : path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".csv")) {
            return new CsvTableProvider();
        }
        if (name.endsWith(".xlsx") || name.endsWith(".xls")) {
            return new ExcelTableProvider();
        }
        throw new TableIoException("Unsupported file format: " + path.getFileName() + ". Supported formats: .csv, .xlsx, .xls");
    }

    /**
     * Default output location: {@code <stem>_translated.<ext>} next to the input.
     */
    public static Path defaultOutputPath(Path input) {
        String name = input.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        String extension = dot > 0 ? name.substring(dot) : ".csv";
        return input.resolveSibling(stem + "_translated" + extension);
    }
}
