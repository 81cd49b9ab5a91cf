package ai.wer.aligner.text;

import ai.wer.aligner.pipeline.Normalizer;
import ai.wer.aligner.pipeline.PipelineContext;
import ai.wer.aligner.pipeline.PipelineLineage;
import ai.wer.aligner.pipeline.PipelineRegistry;
import ai.wer.aligner.pipeline.PipelineSelection;
import ai.wer.aligner.pipeline.StageCache;
import java.util.Objects;
import java.util.Optional;

/**
 * A contiguous slice of a text. Equality covers {@code raw}, {@code start} and {@code end} but not the position
 * of the token in its list.
 */
public final class Token implements PipelineLineage {

    private static final String ELLIPSIS = "...";

    private final String raw;
    private final Span span;
    private final int index;
    private final Text source;
    private final String origin;
    private final StageCache<Normalizer, String> normalized = StageCache.normalizing();

    public Token(String raw, int start, int end, int index) {
        this(raw, new Span(start, end), index, null, null);
    }

    Token(String raw, Span span, int index, Text source, String origin) {
        this.raw = Objects.requireNonNull(raw, "raw");
        this.span = Objects.requireNonNull(span, "span");
        if (index < 0) {
            throw new IllegalArgumentException("index must be greater than or equal to zero");
        }
        if (origin != null && !span.slice(origin).equals(raw)) {
            throw new IllegalArgumentException("Token '" + raw + "' does not match its source slice " + span);
        }
        this.index = index;
        this.source = source;
        this.origin = origin;
    }

    /**
     * Cuts the token at {@code span} out of {@code origin}, the standardized form of {@code source}.
     */
    static Token slice(String origin, Span span, int index, Text source) {
        return new Token(span.slice(origin), span, index, source, origin);
    }

    public String raw() {
        return raw;
    }

    public int start() {
        return span.start();
    }

    public int end() {
        return span.end();
    }

    public Span span() {
        return span;
    }

    public int index() {
        return index;
    }

    public Optional<Text> source() {
        return Optional.ofNullable(source);
    }

    /**
     * Raw text passed through the active normalizer.
     */
    public String normalized() {
        return normalized(PipelineContext.current());
    }

    public String normalized(PipelineSelection selection) {
        return normalized.get(selection, this, normalizer -> normalizer.normalize(raw));
    }

    public String text(MatchMode mode) {
        return text(mode, PipelineContext.current());
    }

    public String text(MatchMode mode, PipelineSelection selection) {
        return mode == MatchMode.NORMALIZED ? normalized(selection) : raw;
    }

    /**
     * Returns up to {@code width} characters of the source text on each side of this token.
     */
    public String inContext(int width) {
        return inContext(width, true);
    }

    public String inContext(int width, boolean addEllipsis) {
        if (origin == null) {
            throw new IllegalStateException("Source text is not set; cannot show context for token '" + raw + "'");
        }
        if (width < 0) {
            throw new IllegalArgumentException("width must be greater than or equal to zero");
        }
        int from = Math.max(0, span.start() - width);
        int to = Math.min(origin.length(), span.end() + width);
        String window = origin.substring(from, to);
        if (!addEllipsis) {
            return window;
        }
        return (from > 0 ? ELLIPSIS : "") + window + (to < origin.length() ? ELLIPSIS : "");
    }

    @Override
    public Optional<PipelineRegistry> pipelines() {
        return source == null ? Optional.empty() : source.pipelines();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Token token)) {
            return false;
        }
        return span.equals(token.span) && raw.equals(token.raw);
    }

    @Override
    public int hashCode() {
        return Objects.hash(raw, span);
    }

    @Override
    public String toString() {
        return "Token(\"" + raw + "\")";
    }
}
