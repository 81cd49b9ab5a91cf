package ai.wer.aligner.alignment;

import java.util.Objects;

/**
 * One entry of a sparse edit script.
 *
 * <p>A substitution touches {@code refIndex} and {@code hypIndex}. An insertion touches {@code hypIndex} only; its
 * {@code refIndex} is either {@link #NONE} or the reference position the inserted token precedes. A deletion
 * touches {@code refIndex} only; its {@code hypIndex} is either {@link #NONE} or the hypothesis position the
 * deleted token precedes.
 */
public record EditStep(EditKind kind, int refIndex, int hypIndex) {

    public static final int NONE = -1;

    public EditStep {
        Objects.requireNonNull(kind, "kind");
        if (refIndex < NONE || hypIndex < NONE) {
            throw new EditScriptException("Negative index in " + kind + " step (" + refIndex + ", " + hypIndex + ")");
        }
        switch (kind) {
            case SUBSTITUTE -> {
                if (refIndex == NONE || hypIndex == NONE) {
                    throw new EditScriptException("Substitution must carry both indices");
                }
            }
            case INSERT -> {
                if (hypIndex == NONE) {
                    throw new EditScriptException("Insertion must carry a hypothesis index");
                }
            }
            case DELETE -> {
                if (refIndex == NONE) {
                    throw new EditScriptException("Deletion must carry a reference index");
                }
            }
        }
    }

    public static EditStep substitute(int refIndex, int hypIndex) {
        return new EditStep(EditKind.SUBSTITUTE, refIndex, hypIndex);
    }

    public static EditStep insert(int hypIndex) {
        return new EditStep(EditKind.INSERT, NONE, hypIndex);
    }

    public static EditStep insert(int refAnchor, int hypIndex) {
        return new EditStep(EditKind.INSERT, refAnchor, hypIndex);
    }

    public static EditStep delete(int refIndex) {
        return new EditStep(EditKind.DELETE, refIndex, NONE);
    }

    public static EditStep delete(int refIndex, int hypAnchor) {
        return new EditStep(EditKind.DELETE, refIndex, hypAnchor);
    }

    /**
     * Builds a step from the loosely typed triple an external primitive emits.
     */
    public static EditStep of(String kind, Integer refIndex, Integer hypIndex) {
        return new EditStep(EditKind.from(kind),
                refIndex == null ? NONE : refIndex,
                hypIndex == null ? NONE : hypIndex);
    }

    public boolean touchesRef() {
        return kind != EditKind.INSERT;
    }

    public boolean touchesHyp() {
        return kind != EditKind.DELETE;
    }

    public boolean hasRefAnchor() {
        return kind == EditKind.INSERT && refIndex != NONE;
    }

    public boolean hasHypAnchor() {
        return kind == EditKind.DELETE && hypIndex != NONE;
    }
}
