package ai.wer.aligner.pipeline;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-instance memo of a value derived at one pipeline stage.
 *
 * <p>Entries are keyed by the names of every stage up to and including this cache's stage, so a value computed
 * under one configuration is never served under another. Each lookup either names its {@link PipelineSelection}
 * or reads the ambient one from {@link PipelineContext}. Concurrent first reads of the same key may compute
 * twice; the first stored value wins and is returned to both callers. The entry map is allocated on first store.
 *
 * @param <H> handle type resolved for this stage
 * @param <V> cached value type
 */
public final class StageCache<H, V> {

    private static final Logger LOGGER = LoggerFactory.getLogger(StageCache.class);

    private final PipelineStage stage;
    private final BiFunction<PipelineRegistry, String, H> resolver;
    private volatile ConcurrentMap<StageKey, V> entries;

    private StageCache(PipelineStage stage, BiFunction<PipelineRegistry, String, H> resolver) {
        this.stage = Objects.requireNonNull(stage, "stage");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
    }

    public static <V> StageCache<Standardizer, V> standardizing() {
        return new StageCache<>(PipelineStage.STANDARDIZE, PipelineRegistry::standardizer);
    }

    public static <V> StageCache<Tokenizer, V> tokenizing() {
        return new StageCache<>(PipelineStage.TOKENIZE, PipelineRegistry::tokenizer);
    }

    public static <V> StageCache<Normalizer, V> normalizing() {
        return new StageCache<>(PipelineStage.NORMALIZE, PipelineRegistry::normalizer);
    }

    /**
     * Cache keyed on the ambient names up to {@code stage} that never resolves a handle itself; for values that
     * are built from other stage-cached values.
     */
    public static <V> StageCache<Void, V> keyedOn(PipelineStage stage) {
        return new StageCache<>(stage, (registry, name) -> null);
    }

    public PipelineStage stage() {
        return stage;
    }

    /**
     * Returns the value for the active configuration, resolving this stage's function from {@code lineage} and
     * applying {@code compute} to it on a miss.
     *
     * @throws NoRegistryException if {@code lineage} reaches no registry
     * @throws PipelineNotFoundException if the active name for this stage is not registered
     */
    public V get(PipelineLineage lineage, Function<? super H, ? extends V> compute) {
        return get(PipelineContext.current(), lineage, compute);
    }

    /**
     * Returns the value for {@code selection}, resolving this stage's function from {@code lineage} and applying
     * {@code compute} to it on a miss.
     *
     * @throws NoRegistryException if {@code lineage} reaches no registry
     * @throws PipelineNotFoundException if the name {@code selection} gives this stage is not registered
     */
    public V get(PipelineSelection selection, PipelineLineage lineage, Function<? super H, ? extends V> compute) {
        Objects.requireNonNull(selection, "selection");
        Objects.requireNonNull(lineage, "lineage");
        Objects.requireNonNull(compute, "compute");
        StageKey key = selection.keyFor(stage);
        V cached = lookup(key);
        if (cached != null) {
            return cached;
        }
        PipelineRegistry registry = lineage.pipelines().orElseThrow(() -> new NoRegistryException(stage));
        H handle = resolver.apply(registry, key.stageName());
        return store(key, compute.apply(handle));
    }

    /**
     * Returns the value for the active configuration, computing it with {@code compute} on a miss.
     */
    public V get(Supplier<? extends V> compute) {
        return get(PipelineContext.current(), compute);
    }

    /**
     * Returns the value for {@code selection}, computing it with {@code compute} on a miss.
     */
    public V get(PipelineSelection selection, Supplier<? extends V> compute) {
        Objects.requireNonNull(selection, "selection");
        Objects.requireNonNull(compute, "compute");
        StageKey key = selection.keyFor(stage);
        V cached = lookup(key);
        if (cached != null) {
            return cached;
        }
        return store(key, compute.get());
    }

    public boolean contains(StageKey key) {
        ConcurrentMap<StageKey, V> current = entries;
        return current != null && current.containsKey(key);
    }

    public int size() {
        ConcurrentMap<StageKey, V> current = entries;
        return current == null ? 0 : current.size();
    }

    Map<StageKey, V> snapshot() {
        ConcurrentMap<StageKey, V> current = entries;
        return current == null ? Map.of() : Map.copyOf(current);
    }

    private V lookup(StageKey key) {
        ConcurrentMap<StageKey, V> current = entries;
        return current == null ? null : current.get(key);
    }

    private ConcurrentMap<StageKey, V> entries() {
        ConcurrentMap<StageKey, V> current = entries;
        if (current == null) {
            synchronized (this) {
                current = entries;
                if (current == null) {
                    current = new ConcurrentHashMap<>(4);
                    entries = current;
                }
            }
        }
        return current;
    }

    private V store(StageKey key, V value) {
        Objects.requireNonNull(value, () -> "Computed value for " + key + " must not be null");
        V existing = entries().putIfAbsent(key, value);
        if (existing != null) {
            return existing;
        }
        LOGGER.debug("Cached {} value for {}", stage, key.names());
        return value;
    }
}
