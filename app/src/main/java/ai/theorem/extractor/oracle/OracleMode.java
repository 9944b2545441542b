package ai.theorem.extractor.oracle;

/**
 * Mode controlling how theorem quality is judged.
 */
public enum OracleMode {
    PRODUCTION,
    DRY_RUN;

    public static OracleMode from(String raw) {
        if (raw == null || raw.isBlank()) {
            return PRODUCTION;
        }
        String normalized = raw.trim().replace('-', '_');
        for (OracleMode mode : values()) {
            if (mode.name().equalsIgnoreCase(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unsupported oracle mode: " + raw);
    }
}
