package ai.tabular.translator.table;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns raw header and data rows into a {@link Table}. The width is the widest row once
 * trailing blank cells are dropped, so formatted but empty trailing columns disappear and
 * values past the header are kept. Blank headers become {@code Unnamed: <index>} and
 * repeated headers get {@code .1}, {@code .2}, ... suffixes.
 */
final class HeaderNormalizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(HeaderNormalizer.class);
    static final String UNNAMED_PREFIX = "Unnamed: ";

    private HeaderNormalizer() {
    }

    static Table toTable(List<String> header, List<List<String>> rows) {
        int width = usedWidth(header);
        for (List<String> row : rows) {
            width = Math.max(width, usedWidth(row));
        }
        List<String> columnIds = columnIds(header, width);
        List<List<String>> trimmed = new ArrayList<>(rows.size());
        for (List<String> row : rows) {
            trimmed.add(row.size() > width ? row.subList(0, width) : row);
        }
        return new Table(columnIds, trimmed);
    }

    static List<String> columnIds(List<String> header, int width) {
        Set<String> taken = new HashSet<>();
        for (int c = 0; c < Math.min(width, header.size()); c++) {
            String name = header.get(c) == null ? "" : header.get(c).strip();
            if (!name.isEmpty()) {
                taken.add(name);
            }
        }
        List<String> ids = new ArrayList<>(width);
        Set<String> used = new HashSet<>();
        for (int c = 0; c < width; c++) {
            String raw = c < header.size() && header.get(c) != null ? header.get(c).strip() : "";
            String id = raw.isEmpty() ? UNNAMED_PREFIX + c : raw;
            if (!used.add(id)) {
                int suffix = 1;
                String candidate = id + "." + suffix;
                while (used.contains(candidate) || taken.contains(candidate)) {
                    suffix++;
                    candidate = id + "." + suffix;
                }
                used.add(candidate);
                id = candidate;
            }
            if (!id.equals(raw)) {
                LOGGER.warn("Header cell {} ('{}') renamed to '{}'", c + 1, raw, id);
            }
            ids.add(id);
        }
        return ids;
    }

    private static int usedWidth(List<String> values) {
        int width = values.size();
        while (width > 0 && (values.get(width - 1) == null || values.get(width - 1).isBlank())) {
            width--;
        }
        return width;
    }
}
