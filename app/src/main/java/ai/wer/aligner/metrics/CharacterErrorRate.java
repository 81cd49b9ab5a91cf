package ai.wer.aligner.metrics;

import ai.wer.aligner.dataset.Dataset;
import ai.wer.aligner.dataset.Example;
import ai.wer.aligner.diff.EditDistance;
import ai.wer.aligner.diff.LevenshteinEditDistance;
import ai.wer.aligner.pipeline.PipelineContext;
import ai.wer.aligner.pipeline.PipelineSelection;
import ai.wer.aligner.text.MatchMode;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Character-level edit distance between the joined reference and hypothesis tokens, divided by the number of
 * characters in the joined reference. Tokens are joined with a single space where the source text had a gap.
 */
public class CharacterErrorRate {

    private final MatchMode mode;
    private final EditDistance characters = new LevenshteinEditDistance();

    public CharacterErrorRate(MatchMode mode) {
        this.mode = Objects.requireNonNull(mode, "mode");
    }

    public ErrorRate of(Example example) {
        return of(example, PipelineContext.current());
    }

    public ErrorRate of(Example example, PipelineSelection selection) {
        Objects.requireNonNull(selection, "selection");
        List<String> ref = codePoints(example.ref().joined(mode, selection));
        List<String> hyp = codePoints(example.hyp().joined(mode, selection));
        return new ErrorRate(characters.distance(ref, hyp), ref.size());
    }

    /**
     * Scores every example under the selection active on the calling thread when this method is entered.
     */
    public ErrorRate of(Dataset dataset) {
        return of(dataset, PipelineContext.current());
    }

    public ErrorRate of(Dataset dataset, PipelineSelection selection) {
        Objects.requireNonNull(selection, "selection");
        ErrorRate rate = ErrorRate.zero();
        for (Example example : dataset) {
            rate = rate.plus(of(example, selection));
        }
        return rate;
    }

    private static List<String> codePoints(String text) {
        return text.codePoints()
                .mapToObj(codePoint -> new String(Character.toChars(codePoint)))
                .collect(Collectors.toUnmodifiableList());
    }
}
