package ai.wer.aligner.metrics;

import ai.wer.aligner.alignment.Alignment;
import ai.wer.aligner.dataset.Dataset;
import ai.wer.aligner.dataset.Example;
import ai.wer.aligner.keyword.Keyword;
import ai.wer.aligner.pipeline.PipelineContext;
import ai.wer.aligner.pipeline.PipelineSelection;
import ai.wer.aligner.text.MatchMode;
import ai.wer.aligner.text.TokenList;
import java.util.List;
import java.util.Objects;

/**
 * Share of keyword occurrences in the references that were not transcribed exactly.
 *
 * <p>Every occurrence counts once however many tokens it spans. An occurrence is an error when any operation
 * between its first and last reference token, insertions included, is not a match.
 */
public class KeywordErrorRate {

    private final String vocabulary;
    private final MatchMode mode;

    public KeywordErrorRate(String vocabulary, MatchMode mode) {
        this.vocabulary = Objects.requireNonNull(vocabulary, "vocabulary");
        this.mode = Objects.requireNonNull(mode, "mode");
    }

    public String vocabulary() {
        return vocabulary;
    }

    public ErrorRate of(Example example) {
        return of(example, PipelineContext.current());
    }

    public ErrorRate of(Example example, PipelineSelection selection) {
        Objects.requireNonNull(selection, "selection");
        List<Keyword> keywords = example.keywords(vocabulary);
        if (keywords.isEmpty()) {
            return ErrorRate.zero();
        }
        Alignment alignment = example.alignment(mode, selection);
        int occurrences = 0;
        int errors = 0;
        for (Keyword keyword : keywords) {
            for (TokenList occurrence : keyword.findInRef(mode, selection)) {
                occurrences++;
                if (!alignment.isCorrect(occurrence.first().index(), occurrence.last().index())) {
                    errors++;
                }
            }
        }
        return new ErrorRate(errors, occurrences);
    }

    /**
     * Scores every example under the selection active on the calling thread when this method is entered.
     *
     * @throws IllegalArgumentException if no example of {@code dataset} uses this vocabulary
     */
    public ErrorRate of(Dataset dataset) {
        return of(dataset, PipelineContext.current());
    }

    public ErrorRate of(Dataset dataset, PipelineSelection selection) {
        Objects.requireNonNull(selection, "selection");
        if (!dataset.vocabularies().contains(vocabulary)) {
            throw new IllegalArgumentException("Vocabulary '" + vocabulary
                    + "' not found in dataset keyword vocabularies " + dataset.vocabularies());
        }
        ErrorRate rate = ErrorRate.zero();
        for (Example example : dataset) {
            rate = rate.plus(of(example, selection));
        }
        return rate;
    }
}
