package ai.wer.aligner.pipeline;

/**
 * Ordered preprocessing stages. Each stage consumes the output of the previous one, so a value derived at
 * stage {@code k} depends on the names active for stages {@code 1..k} only.
 */
public enum PipelineStage {
    STANDARDIZE("standardizers"),
    TOKENIZE("tokenizers"),
    NORMALIZE("normalizers");

    private final String registryLabel;

    PipelineStage(String registryLabel) {
        this.registryLabel = registryLabel;
    }

    public String registryLabel() {
        return registryLabel;
    }
}
