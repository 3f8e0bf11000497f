package ai.tabular.translator.table;

import java.util.Objects;

/**
 * A single row/column intersection as read from the source table.
 */
public record Cell(CellRef ref, String text) {

    public Cell {
        Objects.requireNonNull(ref, "ref");
        text = text == null ? "" : text;
    }

    /**
     * Detects text damaged during decoding: replacement characters, unpaired surrogates and
     * control characters other than tab and line breaks.
     */
    public boolean isMalformed() {
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (ch == '\uFFFD') {
                return true;
            }
            if (Character.isHighSurrogate(ch)) {
                if (i + 1 >= text.length() || !Character.isLowSurrogate(text.charAt(i + 1))) {
                    return true;
                }
                i++;
                continue;
            }
            if (Character.isLowSurrogate(ch)) {
                return true;
            }
            if (ch < 0x20 && ch != '\t' && ch != '\n' && ch != '\r') {
                return true;
            }
        }
        return false;
    }
}
