package ai.wer.aligner.pipeline;

import ai.wer.aligner.text.Span;
import java.util.List;

/**
 * Stage two: splits a standardized text into ordered, non-overlapping character spans.
 */
@FunctionalInterface
public interface Tokenizer {
    List<Span> tokenize(String text);
}
