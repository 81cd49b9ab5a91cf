package ai.wer.aligner.pipeline;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Read-only lookup of named preprocessing functions, one namespace per stage.
 */
public final class PipelineRegistry {

    private final Map<String, Standardizer> standardizers;
    private final Map<String, Tokenizer> tokenizers;
    private final Map<String, Normalizer> normalizers;

    private PipelineRegistry(Builder builder) {
        this.standardizers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.standardizers));
        this.tokenizers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.tokenizers));
        this.normalizers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.normalizers));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.standardizers.putAll(standardizers);
        builder.tokenizers.putAll(tokenizers);
        builder.normalizers.putAll(normalizers);
        return builder;
    }

    public Standardizer standardizer(String name) {
        return lookup(standardizers, PipelineStage.STANDARDIZE, name);
    }

    public Tokenizer tokenizer(String name) {
        return lookup(tokenizers, PipelineStage.TOKENIZE, name);
    }

    public Normalizer normalizer(String name) {
        return lookup(normalizers, PipelineStage.NORMALIZE, name);
    }

    public Set<String> names(PipelineStage stage) {
        return switch (stage) {
            case STANDARDIZE -> standardizers.keySet();
            case TOKENIZE -> tokenizers.keySet();
            case NORMALIZE -> normalizers.keySet();
        };
    }

    public boolean contains(PipelineStage stage, String name) {
        return names(stage).contains(name);
    }

    /**
     * Checks every name of {@code selection} against this registry without resolving anything lazily.
     */
    public void validate(PipelineSelection selection) {
        Objects.requireNonNull(selection, "selection");
        standardizer(selection.standardizer());
        tokenizer(selection.tokenizer());
        normalizer(selection.normalizer());
    }

    private static <T> T lookup(Map<String, T> entries, PipelineStage stage, String name) {
        T value = name == null ? null : entries.get(name);
        if (value == null) {
            throw new PipelineNotFoundException(stage, String.valueOf(name), entries.keySet());
        }
        return value;
    }

    @Override
    public String toString() {
        return "PipelineRegistry(standardizers=" + standardizers.keySet()
                + ", tokenizers=" + tokenizers.keySet()
                + ", normalizers=" + normalizers.keySet() + ")";
    }

    public static final class Builder {

        private final Map<String, Standardizer> standardizers = new LinkedHashMap<>();
        private final Map<String, Tokenizer> tokenizers = new LinkedHashMap<>();
        private final Map<String, Normalizer> normalizers = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder standardizer(String name, Standardizer standardizer) {
            standardizers.put(requireName(name), Objects.requireNonNull(standardizer, "standardizer"));
            return this;
        }

        public Builder tokenizer(String name, Tokenizer tokenizer) {
            tokenizers.put(requireName(name), Objects.requireNonNull(tokenizer, "tokenizer"));
            return this;
        }

        public Builder normalizer(String name, Normalizer normalizer) {
            normalizers.put(requireName(name), Objects.requireNonNull(normalizer, "normalizer"));
            return this;
        }

        public PipelineRegistry build() {
            return new PipelineRegistry(this);
        }

        private static String requireName(String name) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Pipeline name must not be blank");
            }
            return name.trim();
        }
    }
}
