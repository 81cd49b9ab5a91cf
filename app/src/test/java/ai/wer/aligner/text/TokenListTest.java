package ai.wer.aligner.text;

import static org.assertj.core.api.Assertions.assertThat;

import ai.wer.aligner.pipeline.DefaultPipelines;
import ai.wer.aligner.pipeline.PipelineContext;
import ai.wer.aligner.pipeline.PipelineLineage;
import ai.wer.aligner.pipeline.PipelineSelection;
import org.junit.jupiter.api.Test;

class TokenListTest {

    private final TokenList tokens = new Text("The cat saw the CAT, and the dog.", TextType.REF,
            PipelineLineage.of(DefaultPipelines.registry())).tokens();

    @Test
    void charOffsetsMapToTokens() {
        assertThat(tokens.startIndexToToken(4)).hasValueSatisfying(token -> assertThat(token.raw()).isEqualTo("cat"));
        assertThat(tokens.endIndexToToken(19)).hasValueSatisfying(token -> assertThat(token.raw()).isEqualTo("CAT"));
        assertThat(tokens.startIndexToToken(5)).isEmpty();
    }

    @Test
    void indicesDependOnMode() {
        assertThat(tokens.indices("the", MatchMode.RAW)).containsExactly(3, 6);
        assertThat(tokens.indices("the", MatchMode.NORMALIZED)).containsExactly(0, 3, 6);
        assertThat(tokens.indices("cat", MatchMode.NORMALIZED)).containsExactly(1, 4);
        assertThat(tokens.indices("cow", MatchMode.NORMALIZED)).isEmpty();
    }

    @Test
    void normalizedIndicesFollowActiveNormalizer() {
        assertThat(tokens.indices("cat", MatchMode.NORMALIZED)).containsExactly(1, 4);

        PipelineContext.runWith(PipelineSelection.defaults().withNormalizer(DefaultPipelines.NONE), () -> {
            assertThat(tokens.indices("cat", MatchMode.NORMALIZED)).containsExactly(1);
            assertThat(tokens.indices("CAT", MatchMode.NORMALIZED)).containsExactly(4);
        });
    }

    @Test
    void sliceKeepsOriginalIndices() {
        TokenList slice = tokens.slice(2, 4);

        assertThat(slice.raw()).containsExactly("saw", "the");
        assertThat(slice.first().index()).isEqualTo(2);
        assertThat(slice.last().index()).isEqualTo(3);
    }

    @Test
    void joinedAndNgramsUseModeText() {
        TokenList slice = tokens.slice(0, 3);

        assertThat(slice.joined(MatchMode.RAW)).isEqualTo("The cat saw");
        assertThat(slice.joined(MatchMode.NORMALIZED)).isEqualTo("the cat saw");
        assertThat(slice.ngrams(2, MatchMode.NORMALIZED)).containsExactly("the cat", "cat saw");
        assertThat(slice.ngrams(1, MatchMode.RAW)).containsExactly("The", "cat", "saw");
    }

    @Test
    void emptyListIsShared() {
        assertThat(TokenList.of()).isSameAs(TokenList.empty());
        assertThat(TokenList.empty().isEmpty()).isTrue();
        assertThat(TokenList.empty().joined(MatchMode.RAW)).isEmpty();
    }
}
