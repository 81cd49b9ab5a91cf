package ai.wer.aligner.pipeline;

import java.util.List;
import java.util.Objects;

/**
 * Names of the active function for every pipeline stage. The prefix key of each stage is built once, on
 * construction.
 */
public final class PipelineSelection {

    public static final String DEFAULT_NAME = "default";

    private static final PipelineSelection DEFAULTS = new PipelineSelection(DEFAULT_NAME, DEFAULT_NAME, DEFAULT_NAME);

    private final String standardizer;
    private final String tokenizer;
    private final String normalizer;
    private final StageKey[] keys;

    public PipelineSelection(String standardizer, String tokenizer, String normalizer) {
        this.standardizer = requireNonBlank(standardizer, "standardizer");
        this.tokenizer = requireNonBlank(tokenizer, "tokenizer");
        this.normalizer = requireNonBlank(normalizer, "normalizer");
        this.keys = new StageKey[] {
                new StageKey(PipelineStage.STANDARDIZE, List.of(this.standardizer)),
                new StageKey(PipelineStage.TOKENIZE, List.of(this.standardizer, this.tokenizer)),
                new StageKey(PipelineStage.NORMALIZE, List.of(this.standardizer, this.tokenizer, this.normalizer))
        };
    }

    public static PipelineSelection defaults() {
        return DEFAULTS;
    }

    public String standardizer() {
        return standardizer;
    }

    public String tokenizer() {
        return tokenizer;
    }

    public String normalizer() {
        return normalizer;
    }

    public String nameFor(PipelineStage stage) {
        return switch (stage) {
            case STANDARDIZE -> standardizer;
            case TOKENIZE -> tokenizer;
            case NORMALIZE -> normalizer;
        };
    }

    public StageKey keyFor(PipelineStage stage) {
        Objects.requireNonNull(stage, "stage");
        return keys[stage.ordinal()];
    }

    public PipelineSelection withStandardizer(String name) {
        return new PipelineSelection(name, tokenizer, normalizer);
    }

    public PipelineSelection withTokenizer(String name) {
        return new PipelineSelection(standardizer, name, normalizer);
    }

    public PipelineSelection withNormalizer(String name) {
        return new PipelineSelection(standardizer, tokenizer, name);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof PipelineSelection selection)) {
            return false;
        }
        return standardizer.equals(selection.standardizer)
                && tokenizer.equals(selection.tokenizer)
                && normalizer.equals(selection.normalizer);
    }

    @Override
    public int hashCode() {
        return Objects.hash(standardizer, tokenizer, normalizer);
    }

    @Override
    public String toString() {
        return standardizer + "/" + tokenizer + "/" + normalizer;
    }

    private static String requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value.trim();
    }
}
