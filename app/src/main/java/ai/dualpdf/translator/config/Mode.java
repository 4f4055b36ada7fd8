package ai.dualpdf.translator.config;

/**
 * What a run of the CLI does.
 */
public enum Mode {
    TRANSLATE,
    CLEANUP,
    BACKFILL,
    ORPHANS,
    MERGE,
    SPLIT;

    public static Mode from(String raw) {
        if (raw == null || raw.isBlank()) {
            return TRANSLATE;
        }
        for (Mode mode : values()) {
            if (mode.name().equalsIgnoreCase(raw.trim())) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unsupported mode: " + raw);
    }

    /**
     * Modes that walk a directory tree rather than operate on explicit files.
     */
    public boolean scansRoot() {
        return this == TRANSLATE || this == CLEANUP || this == BACKFILL || this == ORPHANS;
    }
}
