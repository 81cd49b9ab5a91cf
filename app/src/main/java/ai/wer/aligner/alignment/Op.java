package ai.wer.aligner.alignment;

import ai.wer.aligner.text.Span;
import java.util.Objects;

/**
 * One alignment operation. Each kind is its own record carrying exactly the fields valid for it; operations that
 * touch the reference implement {@link RefBearing}, operations that touch the hypothesis implement
 * {@link HypBearing}.
 */
public sealed interface Op {

    OpKind kind();

    /**
     * Operation touching a reference token: {@link Match}, {@link Substitute} or {@link Delete}.
     */
    sealed interface RefBearing extends Op {
        String refText();

        int refIndex();

        Span refSpan();
    }

    /**
     * Operation touching a hypothesis token: {@link Match}, {@link Substitute} or {@link Insert}.
     */
    sealed interface HypBearing extends Op {
        String hypText();

        int hypIndex();

        Span hypSpan();
    }

    record Match(String refText, String hypText, int refIndex, int hypIndex, Span refSpan, Span hypSpan)
            implements RefBearing, HypBearing {

        public Match {
            Op.requireRef(refText, refIndex, refSpan);
            Op.requireHyp(hypText, hypIndex, hypSpan);
        }

        @Override
        public OpKind kind() {
            return OpKind.MATCH;
        }

        @Override
        public String toString() {
            return "Op(MATCH: \"" + hypText + "\" == \"" + refText + "\")";
        }
    }

    record Substitute(String refText, String hypText, int refIndex, int hypIndex, Span refSpan, Span hypSpan)
            implements RefBearing, HypBearing {

        public Substitute {
            Op.requireRef(refText, refIndex, refSpan);
            Op.requireHyp(hypText, hypIndex, hypSpan);
        }

        @Override
        public OpKind kind() {
            return OpKind.SUBSTITUTE;
        }

        @Override
        public String toString() {
            return "Op(SUBSTITUTE: \"" + hypText + "\" -> \"" + refText + "\")";
        }
    }

    record Insert(String hypText, int hypIndex, Span hypSpan) implements HypBearing {

        public Insert {
            Op.requireHyp(hypText, hypIndex, hypSpan);
        }

        @Override
        public OpKind kind() {
            return OpKind.INSERT;
        }

        @Override
        public String toString() {
            return "Op(INSERT: \"" + hypText + "\")";
        }
    }

    record Delete(String refText, int refIndex, Span refSpan) implements RefBearing {

        public Delete {
            Op.requireRef(refText, refIndex, refSpan);
        }

        @Override
        public OpKind kind() {
            return OpKind.DELETE;
        }

        @Override
        public String toString() {
            return "Op(DELETE: \"" + refText + "\")";
        }
    }

    private static void requireRef(String refText, int refIndex, Span refSpan) {
        Objects.requireNonNull(refText, "refText");
        Objects.requireNonNull(refSpan, "refSpan");
        if (refIndex < 0) {
            throw new IllegalArgumentException("refIndex must be greater than or equal to zero");
        }
    }

    private static void requireHyp(String hypText, int hypIndex, Span hypSpan) {
        Objects.requireNonNull(hypText, "hypText");
        Objects.requireNonNull(hypSpan, "hypSpan");
        if (hypIndex < 0) {
            throw new IllegalArgumentException("hypIndex must be greater than or equal to zero");
        }
    }
}
