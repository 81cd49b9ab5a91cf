package ai.wer.aligner.text;

/**
 * Which text of a token takes part in comparisons.
 */
public enum MatchMode {
    RAW,
    NORMALIZED;

    public static MatchMode from(String raw) {
        if (raw == null || raw.isBlank()) {
            return NORMALIZED;
        }
        for (MatchMode mode : values()) {
            if (mode.name().equalsIgnoreCase(raw.trim())) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unsupported match mode: " + raw);
    }
}
