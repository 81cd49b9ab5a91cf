package ai.wer.aligner.dataset;

import ai.wer.aligner.diff.EditDistance;
import ai.wer.aligner.diff.LevenshteinEditDistance;
import ai.wer.aligner.pipeline.DefaultPipelines;
import ai.wer.aligner.pipeline.PipelineLineage;
import ai.wer.aligner.pipeline.PipelineRegistry;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Reference/hypothesis pairs sharing one pipeline registry and one edit-distance primitive.
 */
public class Dataset implements PipelineLineage, Iterable<Example> {

    private final PipelineRegistry registry;
    private final EditDistance editDistance;
    private final List<Example> examples = new ArrayList<>();
    private final Set<String> vocabularies = new LinkedHashSet<>();

    public Dataset() {
        this(DefaultPipelines.registry(), new LevenshteinEditDistance());
    }

    public Dataset(PipelineRegistry registry, EditDistance editDistance) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.editDistance = Objects.requireNonNull(editDistance, "editDistance");
    }

    public Example add(String ref, String hyp) {
        return add(ref, hyp, Map.of());
    }

    /**
     * Adds an example.
     *
     * @param keywords vocabulary name to keyword terms; terms that do not occur in {@code ref} are dropped
     */
    public synchronized Example add(String ref, String hyp, Map<String, List<String>> keywords) {
        Example example = new Example(ref, hyp, keywords, this, examples.size());
        examples.add(example);
        vocabularies.addAll(example.vocabularies());
        return example;
    }

    public EditDistance editDistance() {
        return editDistance;
    }

    public PipelineRegistry registry() {
        return registry;
    }

    @Override
    public Optional<PipelineRegistry> pipelines() {
        return Optional.of(registry);
    }

    /**
     * Names of every keyword vocabulary used by at least one example, in first-seen order.
     */
    public synchronized Set<String> vocabularies() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(vocabularies));
    }

    public synchronized int size() {
        return examples.size();
    }

    public synchronized boolean isEmpty() {
        return examples.isEmpty();
    }

    public synchronized Example get(int index) {
        return examples.get(index);
    }

    public synchronized List<Example> examples() {
        return List.copyOf(examples);
    }

    public Stream<Example> stream() {
        return examples().stream();
    }

    @Override
    public Iterator<Example> iterator() {
        return examples().iterator();
    }

    @Override
    public String toString() {
        return "Dataset(" + size() + " examples)";
    }
}
