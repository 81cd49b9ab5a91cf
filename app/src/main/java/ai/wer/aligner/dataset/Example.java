package ai.wer.aligner.dataset;

import ai.wer.aligner.alignment.Alignment;
import ai.wer.aligner.alignment.AlignmentBuilder;
import ai.wer.aligner.alignment.EditScript;
import ai.wer.aligner.keyword.Keyword;
import ai.wer.aligner.pipeline.PipelineContext;
import ai.wer.aligner.pipeline.PipelineLineage;
import ai.wer.aligner.pipeline.PipelineRegistry;
import ai.wer.aligner.pipeline.PipelineSelection;
import ai.wer.aligner.pipeline.PipelineStage;
import ai.wer.aligner.pipeline.StageCache;
import ai.wer.aligner.text.MatchMode;
import ai.wer.aligner.text.Text;
import ai.wer.aligner.text.TextType;
import ai.wer.aligner.text.TokenList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One reference/hypothesis pair of a {@link Dataset} with its keyword vocabularies.
 */
public class Example implements PipelineLineage {

    private static final Logger LOGGER = LoggerFactory.getLogger(Example.class);

    private final Dataset dataset;
    private final int index;
    private final Text ref;
    private final Text hyp;
    private final Map<String, List<Keyword>> keywords;
    private final StageCache<Void, Alignment> rawAlignments = StageCache.keyedOn(PipelineStage.TOKENIZE);
    private final StageCache<Void, Alignment> normalizedAlignments = StageCache.keyedOn(PipelineStage.NORMALIZE);

    Example(String ref, String hyp, Map<String, List<String>> keywords, Dataset dataset, int index) {
        this.dataset = Objects.requireNonNull(dataset, "dataset");
        this.index = index;
        this.ref = new Text(Objects.requireNonNull(ref, "ref"), TextType.REF, this);
        this.hyp = new Text(Objects.requireNonNull(hyp, "hyp"), TextType.HYP, this);
        this.keywords = prepareKeywords(keywords == null ? Map.of() : keywords);
    }

    public Dataset dataset() {
        return dataset;
    }

    public int index() {
        return index;
    }

    public Text ref() {
        return ref;
    }

    public Text hyp() {
        return hyp;
    }

    public Set<String> vocabularies() {
        return keywords.keySet();
    }

    public List<Keyword> keywords(String vocabulary) {
        return keywords.getOrDefault(vocabulary, List.of());
    }

    public Map<String, List<Keyword>> keywords() {
        return keywords;
    }

    /**
     * Alignment of reference and hypothesis tokens under the active pipeline, compared as raw or normalized
     * text. The result is built once per configuration and comes back attached to this example.
     */
    public Alignment alignment(MatchMode mode) {
        return alignment(mode, PipelineContext.current());
    }

    public Alignment alignment(MatchMode mode, PipelineSelection selection) {
        Objects.requireNonNull(mode, "mode");
        StageCache<Void, Alignment> cache = mode == MatchMode.RAW ? rawAlignments : normalizedAlignments;
        return cache.get(selection, () -> align(mode, selection));
    }

    public Alignment alignment() {
        return alignment(MatchMode.NORMALIZED);
    }

    @Override
    public Optional<PipelineRegistry> pipelines() {
        return dataset.pipelines();
    }

    private Alignment align(MatchMode mode, PipelineSelection selection) {
        TokenList refTokens = ref.tokens(selection);
        TokenList hypTokens = hyp.tokens(selection);
        EditScript script = dataset.editDistance()
                .editScript(refTokens.texts(mode, selection), hypTokens.texts(mode, selection));
        return new AlignmentBuilder(mode).build(refTokens, hypTokens, script, selection).attach(this);
    }

    private Map<String, List<Keyword>> prepareKeywords(Map<String, List<String>> raw) {
        Map<String, List<Keyword>> prepared = new LinkedHashMap<>();
        raw.forEach((vocabulary, terms) -> {
            List<Keyword> kept = new ArrayList<>();
            for (String term : terms) {
                if (!ref.raw().contains(term)) {
                    LOGGER.warn("Keyword '{}' not found in reference for example {}. Will not be included.",
                            term, index);
                    continue;
                }
                kept.add(new Keyword(term, this));
            }
            if (!kept.isEmpty()) {
                prepared.put(vocabulary, List.copyOf(kept));
            }
        });
        return Collections.unmodifiableMap(prepared);
    }

    @Override
    public String toString() {
        return "Example(ref=\"" + abbreviate(ref.raw()) + "\", hyp=\"" + abbreviate(hyp.raw()) + "\")";
    }

    private static String abbreviate(String text) {
        return text.length() <= 45 ? text : text.substring(0, 42) + "...";
    }
}
