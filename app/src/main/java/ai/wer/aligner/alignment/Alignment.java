package ai.wer.aligner.alignment;

import ai.wer.aligner.dataset.Example;
import ai.wer.aligner.pipeline.Lazy;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Ordered operations relating a reference token sequence to a hypothesis token sequence.
 *
 * <p>An alignment accepts appends until it is frozen. Attaching it to its source example freezes it, as does the
 * first position lookup. Counts per kind are kept in step with every append.
 */
public final class Alignment implements Iterable<Op> {

    private static final int REPR_LIMIT = 60;

    private final List<Op> ops = new ArrayList<>();
    private final Map<OpKind, Integer> counts = new EnumMap<>(OpKind.class);
    private final Lazy<AlignmentIndex> index = new Lazy<>(this::buildIndex);
    private volatile boolean frozen;
    private volatile Example source;

    public Alignment() {
        for (OpKind kind : OpKind.values()) {
            counts.put(kind, 0);
        }
    }

    public Alignment(Collection<? extends Op> ops) {
        this();
        appendAll(ops);
    }

    public synchronized void append(Op op) {
        Objects.requireNonNull(op, "op");
        ensureMutable();
        ops.add(op);
        counts.merge(op.kind(), 1, Integer::sum);
    }

    public synchronized void appendAll(Collection<? extends Op> toAppend) {
        Objects.requireNonNull(toAppend, "ops");
        ensureMutable();
        for (Op op : toAppend) {
            append(op);
        }
    }

    /**
     * Binds this alignment to the example it was computed for and freezes it. The binding can be made once.
     */
    public synchronized Alignment attach(Example example) {
        Objects.requireNonNull(example, "example");
        if (source != null) {
            throw new IllegalStateException("Alignment is already attached to " + source);
        }
        source = example;
        frozen = true;
        return this;
    }

    public synchronized Alignment freeze() {
        frozen = true;
        return this;
    }

    public boolean isFrozen() {
        return frozen;
    }

    public Optional<Example> source() {
        return Optional.ofNullable(source);
    }

    public int size() {
        return ops.size();
    }

    public boolean isEmpty() {
        return ops.isEmpty();
    }

    public Op get(int position) {
        return ops.get(position);
    }

    public List<Op> ops() {
        return Collections.unmodifiableList(ops);
    }

    public Stream<Op> stream() {
        return ops.stream();
    }

    @Override
    public Iterator<Op> iterator() {
        return ops().iterator();
    }

    public int count(OpKind kind) {
        return counts.get(kind);
    }

    public int numMatches() {
        return count(OpKind.MATCH);
    }

    public int numSubstitutions() {
        return count(OpKind.SUBSTITUTE);
    }

    public int numInsertions() {
        return count(OpKind.INSERT);
    }

    public int numDeletions() {
        return count(OpKind.DELETE);
    }

    public int numEdits() {
        return numSubstitutions() + numInsertions() + numDeletions();
    }

    /**
     * Operations in {@code [fromPosition, toPosition)} as a new, unattached alignment.
     */
    public Alignment slice(int fromPosition, int toPosition) {
        return new Alignment(ops.subList(fromPosition, toPosition));
    }

    public Alignment concat(Alignment other) {
        Objects.requireNonNull(other, "other");
        if (source != null || other.source != null) {
            throw new IllegalStateException("Cannot concatenate alignments attached to a source example");
        }
        Alignment joined = new Alignment(ops);
        joined.appendAll(other.ops);
        return joined;
    }

    /**
     * Position lookups over this alignment, built on first use. Building freezes the alignment.
     */
    public AlignmentIndex index() {
        return index.get();
    }

    public Optional<Op> startIndexToOp(int charIndex) {
        return index().startIndexToOp(charIndex);
    }

    public Optional<Op> endIndexToOp(int charIndex) {
        return index().endIndexToOp(charIndex);
    }

    public Alignment opsFromRefIndex(int refIndex) {
        return index().opsFromRefIndex(refIndex);
    }

    public Alignment opsFromRefIndex(int startRefIndex, int stopRefIndex) {
        return index().opsFromRefIndex(startRefIndex, stopRefIndex);
    }

    /**
     * Whether the reference tokens {@code startRefIndex..stopRefIndex} were transcribed without any edit,
     * including insertions between them.
     */
    public boolean isCorrect(int startRefIndex, int stopRefIndex) {
        return opsFromRefIndex(startRefIndex, stopRefIndex).numEdits() == 0;
    }

    private AlignmentIndex buildIndex() {
        freeze();
        return AlignmentIndex.build(this);
    }

    private void ensureMutable() {
        if (frozen) {
            throw new IllegalStateException(source != null
                    ? "Cannot modify Alignment after source example is set"
                    : "Cannot modify a frozen Alignment");
        }
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        return other instanceof Alignment alignment && ops.equals(alignment.ops);
    }

    @Override
    public int hashCode() {
        return ops.hashCode();
    }

    @Override
    public String toString() {
        String shown = ops.stream().limit(REPR_LIMIT).map(Op::toString).collect(Collectors.joining(",\n "));
        return "Alignment([\n " + shown + (ops.size() > REPR_LIMIT ? ",\n ..." : "") + "]\n)";
    }
}
