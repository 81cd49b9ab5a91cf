package ai.wer.aligner.alignment;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Sparse edit script: the substitutions, insertions and deletions turning a reference token sequence into a
 * hypothesis token sequence. Untouched positions are implicit matches.
 */
public record EditScript(List<EditStep> steps) {

    private static final EditScript EMPTY = new EditScript(List.of());

    public EditScript {
        steps = List.copyOf(Objects.requireNonNull(steps, "steps"));
    }

    public static EditScript empty() {
        return EMPTY;
    }

    public static EditScript of(EditStep... steps) {
        return new EditScript(List.of(steps));
    }

    public int size() {
        return steps.size();
    }

    public boolean isEmpty() {
        return steps.isEmpty();
    }

    public Map<EditKind, Integer> counts() {
        Map<EditKind, Integer> counts = new EnumMap<>(EditKind.class);
        for (EditKind kind : EditKind.values()) {
            counts.put(kind, 0);
        }
        for (EditStep step : steps) {
            counts.merge(step.kind(), 1, Integer::sum);
        }
        return counts;
    }
}
