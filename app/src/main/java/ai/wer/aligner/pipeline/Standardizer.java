package ai.wer.aligner.pipeline;

/**
 * Stage one: rewrites a whole text before tokenization.
 */
@FunctionalInterface
public interface Standardizer {
    String standardize(String text);
}
