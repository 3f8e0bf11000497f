package ai.tabular.translator.table;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * CSV provider; the first record is the header. Input encodings are tried in order
 * (UTF-8 with optional BOM, windows-1252, ISO-8859-1); output is UTF-8 with a BOM so that
 * spreadsheet applications pick the right encoding.
 */
public class CsvTableProvider implements TableProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(CsvTableProvider.class);
    private static final char BOM = '\uFEFF';
    private static final List<Charset> CANDIDATE_CHARSETS = List.of(
            StandardCharsets.UTF_8, Charset.forName("windows-1252"), StandardCharsets.ISO_8859_1);

    @Override
    public Table read(Path path) {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(path);
        } catch (NoSuchFileException ex) {
            throw new TableIoException("File not found: " + path, ex);
        } catch (IOException ex) {
            throw new TableIoException("Failed to read " + path, ex);
        }
        String content = decode(bytes, path);
        try (Reader reader = new StringReader(content);
             CSVParser parser = CSVParser.parse(reader, CSVFormat.DEFAULT)) {
            List<String> header = null;
            List<List<String>> rows = new ArrayList<>();
            for (CSVRecord record : parser) {
                List<String> values = new ArrayList<>(record.size());
                record.forEach(values::add);
                if (header == null) {
                    header = values;
                } else {
                    rows.add(values);
                }
            }
            if (header == null) {
                throw new TableIoException("CSV file has no header row: " + path);
            }
            Table table = HeaderNormalizer.toTable(header, rows);
            LOGGER.info("Loaded {} ({} rows, {} columns)", path.getFileName(), table.rowCount(), table.columnCount());
            return table;
        } catch (IOException | UncheckedIOException | IllegalStateException ex) {
            throw new TableIoException("Malformed CSV file " + path + ": " + ex.getMessage(), ex);
        } catch (IllegalArgumentException ex) {
            throw new TableIoException("Invalid table in " + path + ": " + ex.getMessage(), ex);
        }
    }

    @Override
    public void write(Table table, Path path) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
                 CSVPrinter printer = new CSVPrinter(writer, CSVFormat.DEFAULT)) {
                writer.write(BOM);
                printer.printRecord(table.columnIds());
                for (List<String> row : table.rows()) {
                    printer.printRecord(row);
                }
            }
        } catch (IOException ex) {
            throw new TableIoException("Failed to write " + path, ex);
        }
        LOGGER.info("Saved translated table to {}", path);
    }

    private String decode(byte[] bytes, Path path) {
        for (Charset charset : CANDIDATE_CHARSETS) {
            try {
                String decoded = charset.newDecoder()
                        .onMalformedInput(CodingErrorAction.REPORT)
                        .onUnmappableCharacter(CodingErrorAction.REPORT)
                        .decode(ByteBuffer.wrap(bytes))
                        .toString();
                if (!decoded.isEmpty() && decoded.charAt(0) == BOM) {
                    decoded = decoded.substring(1);
                }
                if (charset != StandardCharsets.UTF_8) {
                    LOGGER.info("Decoded {} as {}", path.getFileName(), charset.name());
                }
                return decoded;
            } catch (CharacterCodingException ex) {
                LOGGER.debug("{} is not valid {}", path.getFileName(), charset.name());
            }
        }
        throw new TableIoException("Could not decode " + path + " with any supported encoding");
    }
}
