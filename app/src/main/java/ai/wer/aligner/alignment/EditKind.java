package ai.wer.aligner.alignment;

import java.util.Locale;

/**
 * Kinds an edit-distance primitive reports. Matches are never part of an edit script.
 */
public enum EditKind {
    SUBSTITUTE,
    INSERT,
    DELETE;

    /**
     * Parses the kind names used by common edit-distance libraries; {@code replace} is an alias of
     * {@code substitute}.
     *
     * @throws EditScriptException for any other value
     */
    public static EditKind from(String raw) {
        if (raw == null) {
            throw new EditScriptException("Edit kind must be provided");
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "substitute", "replace" -> SUBSTITUTE;
            case "insert" -> INSERT;
            case "delete" -> DELETE;
            default -> throw new EditScriptException("Unknown operation type: " + raw);
        };
    }
}
