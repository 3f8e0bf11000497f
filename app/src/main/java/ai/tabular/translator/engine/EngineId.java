package ai.tabular.translator.engine;

import java.util.Locale;

/**
 * Identifies one of the two interchangeable translation engines.
 */
public enum EngineId {
    ENGINE_A("engine-a", "nllb"),
    ENGINE_B("engine-b", "argos");

    private final String label;
    private final String alias;

    EngineId(String label, String alias) {
        this.label = label;
        this.alias = alias;
    }

    public String label() {
        return label;
    }

    public static EngineId from(String raw) {
        if (raw == null || raw.isBlank()) {
            return ENGINE_A;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (EngineId id : values()) {
            if (id.label.equals(normalized) || id.alias.equals(normalized)) {
                return id;
            }
        }
        throw new IllegalArgumentException("Unsupported engine: " + raw);
    }

    @Override
    public String toString() {
        return label;
    }
}
