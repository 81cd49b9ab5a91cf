package ai.wer.aligner.pipeline;

/**
 * Stage three: maps the raw text of a single token to the form used for comparison.
 */
@FunctionalInterface
public interface Normalizer {
    String normalize(String token);

    default Normalizer andThen(Normalizer next) {
        return token -> next.normalize(normalize(token));
    }
}
