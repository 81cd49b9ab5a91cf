package ai.wer.aligner.text;

import ai.wer.aligner.pipeline.PipelineContext;
import ai.wer.aligner.pipeline.PipelineLineage;
import ai.wer.aligner.pipeline.PipelineRegistry;
import ai.wer.aligner.pipeline.PipelineSelection;
import ai.wer.aligner.pipeline.Standardizer;
import ai.wer.aligner.pipeline.StageCache;
import ai.wer.aligner.pipeline.Tokenizer;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A reference, hypothesis or keyword string with its standardized form and tokens derived lazily under the
 * active pipeline.
 */
public class Text implements PipelineLineage {

    private final String raw;
    private final TextType type;
    private final AtomicReference<PipelineLineage> parent = new AtomicReference<>();
    private final StageCache<Standardizer, String> standardized = StageCache.standardizing();
    private final StageCache<Tokenizer, TokenList> tokens = StageCache.tokenizing();

    public Text(String raw, TextType type) {
        this.raw = Objects.requireNonNull(raw, "raw");
        this.type = Objects.requireNonNull(type, "type");
    }

    public Text(String raw, TextType type, PipelineLineage parent) {
        this(raw, type);
        attach(parent);
    }

    public String raw() {
        return raw;
    }

    public TextType type() {
        return type;
    }

    public Optional<PipelineLineage> parent() {
        return Optional.ofNullable(parent.get());
    }

    /**
     * Binds this text to the owner it resolves pipelines through. A text can be attached once.
     */
    public void attach(PipelineLineage owner) {
        Objects.requireNonNull(owner, "owner");
        if (!parent.compareAndSet(null, owner)) {
            throw new IllegalStateException("Source already set for " + this);
        }
    }

    public String standardized() {
        return standardized(PipelineContext.current());
    }

    public String standardized(PipelineSelection selection) {
        return standardized.get(selection, this, standardizer -> standardizer.standardize(raw));
    }

    public TokenList tokens() {
        return tokens(PipelineContext.current());
    }

    public TokenList tokens(PipelineSelection selection) {
        return tokens.get(selection, this, tokenizer -> {
            String origin = standardized(selection);
            return TokenList.fromSpans(origin, tokenizer.tokenize(origin), this);
        });
    }

    public String joined(MatchMode mode) {
        return joined(mode, PipelineContext.current());
    }

    public String joined(MatchMode mode, PipelineSelection selection) {
        return tokens(selection).joined(mode, selection);
    }

    @Override
    public Optional<PipelineRegistry> pipelines() {
        PipelineLineage owner = parent.get();
        return owner == null ? Optional.empty() : owner.pipelines();
    }

    @Override
    public String toString() {
        String shown = raw.length() <= 46 ? raw : raw.substring(0, 46) + "...";
        return "Text(\"" + shown + "\")";
    }
}
