package ai.wer.aligner.alignment;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Constant-time lookups over a frozen alignment: reference character offsets to operations and reference token
 * indices to operation positions.
 */
public final class AlignmentIndex {

    private final Alignment alignment;
    private final List<Op> ops;
    private final Map<Integer, Integer> startOffsets;
    private final Map<Integer, Integer> endOffsets;
    private final Map<Integer, Integer> refPositions;

    private AlignmentIndex(Alignment alignment) {
        this.alignment = alignment;
        this.ops = alignment.ops();
        Map<Integer, Integer> starts = new HashMap<>();
        Map<Integer, Integer> ends = new HashMap<>();
        Map<Integer, Integer> refs = new HashMap<>();
        for (int position = 0; position < ops.size(); position++) {
            if (ops.get(position) instanceof Op.RefBearing op) {
                starts.put(op.refSpan().start(), position);
                ends.put(op.refSpan().end(), position);
                refs.put(op.refIndex(), position);
            }
        }
        this.startOffsets = Collections.unmodifiableMap(starts);
        this.endOffsets = Collections.unmodifiableMap(ends);
        this.refPositions = Collections.unmodifiableMap(refs);
    }

    /**
     * Indexes {@code alignment}, which must be frozen.
     */
    public static AlignmentIndex build(Alignment alignment) {
        Objects.requireNonNull(alignment, "alignment");
        if (!alignment.isFrozen()) {
            throw new IllegalStateException("Only a frozen alignment can be indexed");
        }
        return new AlignmentIndex(alignment);
    }

    public Optional<Op> startIndexToOp(int charIndex) {
        return Optional.ofNullable(startOffsets.get(charIndex)).map(ops::get);
    }

    public Optional<Op> endIndexToOp(int charIndex) {
        return Optional.ofNullable(endOffsets.get(charIndex)).map(ops::get);
    }

    /**
     * Position of the operation carrying reference token {@code refIndex}.
     */
    public Optional<Integer> positionOfRefIndex(int refIndex) {
        return Optional.ofNullable(refPositions.get(refIndex));
    }

    public Alignment opsFromRefIndex(int refIndex) {
        return opsFromRefIndex(refIndex, refIndex);
    }

    /**
     * Contiguous operations from the one carrying reference token {@code startRefIndex} through the one carrying
     * {@code stopRefIndex}, both inclusive, together with any insertions between them.
     *
     * @throws RefIndexNotFoundException if either index is not carried by an operation of this alignment
     * @throws InvalidRefRangeException if {@code stopRefIndex < startRefIndex}
     */
    public Alignment opsFromRefIndex(int startRefIndex, int stopRefIndex) {
        Integer startPosition = refPositions.get(startRefIndex);
        if (startPosition == null) {
            throw new RefIndexNotFoundException("Start", startRefIndex);
        }
        if (stopRefIndex == startRefIndex) {
            return alignment.slice(startPosition, startPosition + 1);
        }
        Integer stopPosition = refPositions.get(stopRefIndex);
        if (stopPosition == null) {
            throw new RefIndexNotFoundException("Stop", stopRefIndex);
        }
        if (stopRefIndex < startRefIndex) {
            throw new InvalidRefRangeException(startRefIndex, stopRefIndex);
        }
        return alignment.slice(startPosition, stopPosition + 1);
    }

    public int refIndexCount() {
        return refPositions.size();
    }
}
