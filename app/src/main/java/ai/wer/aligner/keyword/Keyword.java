package ai.wer.aligner.keyword;

import ai.wer.aligner.dataset.Example;
import ai.wer.aligner.pipeline.PipelineContext;
import ai.wer.aligner.pipeline.PipelineSelection;
import ai.wer.aligner.pipeline.PipelineStage;
import ai.wer.aligner.pipeline.StageCache;
import ai.wer.aligner.text.MatchMode;
import ai.wer.aligner.text.Text;
import ai.wer.aligner.text.TextType;
import ai.wer.aligner.text.TokenList;
import java.util.List;
import java.util.Objects;

/**
 * A term of a keyword vocabulary, tokenized with the pipeline of the example it belongs to.
 */
public class Keyword extends Text {

    private final Example example;
    private final StageCache<Void, List<TokenList>> rawMatches = StageCache.keyedOn(PipelineStage.TOKENIZE);
    private final StageCache<Void, List<TokenList>> normalizedMatches = StageCache.keyedOn(PipelineStage.NORMALIZE);

    public Keyword(String raw, Example example) {
        super(raw, TextType.KEYWORD, Objects.requireNonNull(example, "example"));
        this.example = example;
    }

    public Example example() {
        return example;
    }

    /**
     * Occurrences of this keyword in an arbitrary token sequence.
     */
    public List<TokenList> findInTokens(TokenList haystack, MatchMode mode) {
        return findInTokens(haystack, mode, PipelineContext.current());
    }

    public List<TokenList> findInTokens(TokenList haystack, MatchMode mode, PipelineSelection selection) {
        return KeywordLocator.locate(tokens(selection).texts(mode, selection), haystack, mode, selection);
    }

    /**
     * Occurrences of this keyword in the reference of its example. Raw results depend on the standardizer and
     * tokenizer only; normalized results on the normalizer too.
     */
    public List<TokenList> findInRef(MatchMode mode) {
        return findInRef(mode, PipelineContext.current());
    }

    public List<TokenList> findInRef(MatchMode mode, PipelineSelection selection) {
        Objects.requireNonNull(mode, "mode");
        StageCache<Void, List<TokenList>> cache = mode == MatchMode.RAW ? rawMatches : normalizedMatches;
        return cache.get(selection, () -> findInTokens(example.ref().tokens(selection), mode, selection));
    }
}
