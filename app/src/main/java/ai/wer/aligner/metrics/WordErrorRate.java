package ai.wer.aligner.metrics;

import ai.wer.aligner.alignment.Alignment;
import ai.wer.aligner.dataset.Dataset;
import ai.wer.aligner.dataset.Example;
import ai.wer.aligner.pipeline.PipelineContext;
import ai.wer.aligner.pipeline.PipelineSelection;
import ai.wer.aligner.text.MatchMode;
import java.util.Objects;

/**
 * Token-level edits divided by the number of reference tokens, summed over examples before dividing.
 */
public class WordErrorRate {

    private final MatchMode mode;

    public WordErrorRate(MatchMode mode) {
        this.mode = Objects.requireNonNull(mode, "mode");
    }

    public ErrorRate of(Example example) {
        return of(example, PipelineContext.current());
    }

    public ErrorRate of(Example example, PipelineSelection selection) {
        Alignment alignment = example.alignment(mode, selection);
        return new ErrorRate(alignment.numEdits(), example.ref().tokens(selection).size());
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
}
