package ai.wer.aligner.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class StageCacheTest {

    private final PipelineLineage lineage = PipelineLineage.of(DefaultPipelines.registry());

    @AfterEach
    void resetContext() {
        PipelineContext.restore(PipelineSelection.defaults());
    }

    @Test
    void repeatedReadsUnderSameSelectionComputeOnce() {
        StageCache<Normalizer, String> cache = StageCache.normalizing();
        AtomicInteger calls = new AtomicInteger();

        String first = cache.get(lineage, normalizer -> {
            calls.incrementAndGet();
            return normalizer.normalize("Hello,");
        });
        String second = cache.get(lineage, normalizer -> {
            calls.incrementAndGet();
            return normalizer.normalize("Hello,");
        });

        assertThat(first).isEqualTo("hello");
        assertThat(second).isSameAs(first);
        assertThat(calls).hasValue(1);
    }

    @Test
    void changingAnEarlierStageCreatesDistinctEntry() {
        StageCache<Normalizer, String> cache = StageCache.normalizing();
        AtomicInteger calls = new AtomicInteger();

        cache.get(lineage, normalizer -> "v" + calls.incrementAndGet());
        PipelineContext.runWith(PipelineSelection.defaults().withStandardizer(DefaultPipelines.NONE),
                () -> cache.get(lineage, normalizer -> "v" + calls.incrementAndGet()));
        PipelineContext.runWith(PipelineSelection.defaults().withTokenizer(DefaultPipelines.WHITESPACE),
                () -> cache.get(lineage, normalizer -> "v" + calls.incrementAndGet()));

        assertThat(calls).hasValue(3);
        assertThat(cache.size()).isEqualTo(3);
        assertThat(cache.snapshot()).containsKeys(
                new StageKey(PipelineStage.NORMALIZE, List.of("default", "default", "default")),
                new StageKey(PipelineStage.NORMALIZE, List.of("none", "default", "default")),
                new StageKey(PipelineStage.NORMALIZE, List.of("default", "whitespace", "default")));
    }

    @Test
    void laterStagesDoNotSplitEarlierCaches() {
        StageCache<Tokenizer, String> cache = StageCache.tokenizing();
        AtomicInteger calls = new AtomicInteger();

        cache.get(lineage, tokenizer -> "v" + calls.incrementAndGet());
        String underOtherNormalizer = PipelineContext.callWith(
                PipelineSelection.defaults().withNormalizer(DefaultPipelines.NONE),
                () -> cache.get(lineage, tokenizer -> "v" + calls.incrementAndGet()));

        assertThat(underOtherNormalizer).isEqualTo("v1");
        assertThat(calls).hasValue(1);
        assertThat(cache.contains(new StageKey(PipelineStage.TOKENIZE, List.of("default", "default")))).isTrue();
    }

    @Test
    void resolvesHandleNamedBySelection() {
        StageCache<Normalizer, String> cache = StageCache.normalizing();

        String normalized = PipelineContext.callWith(
                PipelineSelection.defaults().withNormalizer(DefaultPipelines.LOWERCASE),
                () -> cache.get(lineage, normalizer -> normalizer.normalize("Hello,")));

        assertThat(normalized).isEqualTo("hello,");
    }

    @Test
    void missingRegistryIsReportedAsItsOwnError() {
        StageCache<Standardizer, String> cache = StageCache.standardizing();

        Throwable thrown = catchThrowable(() -> cache.get(PipelineLineage.detached(), s -> s.standardize("x")));

        assertThat(thrown).isInstanceOf(NoRegistryException.class)
                .isNotInstanceOf(PipelineNotFoundException.class)
                .hasMessageContaining("standardizers");
        assertThat(((PipelineResolutionException) thrown).stage()).isEqualTo(PipelineStage.STANDARDIZE);
        assertThat(cache.size()).isZero();
    }

    @Test
    void unknownNameIsReportedAsItsOwnError() {
        StageCache<Tokenizer, String> cache = StageCache.tokenizing();

        Throwable thrown = catchThrowable(() -> PipelineContext.runWith(
                PipelineSelection.defaults().withTokenizer("sentencepiece"),
                () -> cache.get(lineage, tokenizer -> "never")));

        assertThat(thrown).isInstanceOf(PipelineNotFoundException.class)
                .hasMessageContaining("'sentencepiece' not found in tokenizers");
        assertThat(((PipelineNotFoundException) thrown).name()).isEqualTo("sentencepiece");
    }

    @Test
    void supplierVariantNeedsNoRegistry() {
        StageCache<Void, Integer> cache = StageCache.keyedOn(PipelineStage.TOKENIZE);
        AtomicInteger calls = new AtomicInteger();

        assertThat(cache.get(calls::incrementAndGet)).isEqualTo(1);
        assertThat(cache.get(calls::incrementAndGet)).isEqualTo(1);
        assertThat(cache.stage()).isEqualTo(PipelineStage.TOKENIZE);
    }

    @Test
    void explicitSelectionIgnoresAmbientContext() {
        StageCache<Normalizer, String> cache = StageCache.normalizing();
        PipelineSelection none = PipelineSelection.defaults().withNormalizer(DefaultPipelines.NONE);
        assertThat(cache.size()).isZero();
        assertThat(cache.snapshot()).isEmpty();

        String strict = cache.get(none, lineage, normalizer -> normalizer.normalize("Hello,"));

        assertThat(strict).isEqualTo("Hello,");
        assertThat(cache.contains(none.keyFor(PipelineStage.NORMALIZE))).isTrue();
        assertThat(cache.contains(PipelineSelection.defaults().keyFor(PipelineStage.NORMALIZE))).isFalse();
        assertThat(PipelineContext.callWith(none, () -> cache.get(lineage, normalizer -> "recomputed")))
                .isSameAs(strict);
    }
}
