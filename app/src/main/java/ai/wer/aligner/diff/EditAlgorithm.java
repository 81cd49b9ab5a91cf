package ai.wer.aligner.diff;

import org.eclipse.jgit.diff.DiffAlgorithm;

/**
 * Selectable edit-distance primitives.
 */
public enum EditAlgorithm {
    LEVENSHTEIN,
    MYERS,
    HISTOGRAM;

    public static EditAlgorithm from(String raw) {
        if (raw == null || raw.isBlank()) {
            return LEVENSHTEIN;
        }
        for (EditAlgorithm algorithm : values()) {
            if (algorithm.name().equalsIgnoreCase(raw.trim())) {
                return algorithm;
            }
        }
        throw new IllegalArgumentException("Unsupported edit algorithm: " + raw);
    }

    public EditDistance create() {
        return switch (this) {
            case LEVENSHTEIN -> new LevenshteinEditDistance();
            case MYERS -> new JGitEditDistance(DiffAlgorithm.SupportedAlgorithm.MYERS);
            case HISTOGRAM -> new JGitEditDistance(DiffAlgorithm.SupportedAlgorithm.HISTOGRAM);
        };
    }
}
