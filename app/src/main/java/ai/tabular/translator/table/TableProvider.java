package ai.tabular.translator.table;

import java.nio.file.Path;

/**
 * Reads and writes tables in one file format.
 */
public interface TableProvider {

    Table read(Path path);

    void write(Table table, Path path);
}
