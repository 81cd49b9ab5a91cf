package ai.wer.aligner.alignment;

import static ai.wer.aligner.alignment.AlignmentFixtures.hypSide;
import static ai.wer.aligner.alignment.AlignmentFixtures.refSide;
import static ai.wer.aligner.alignment.AlignmentFixtures.tokens;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import ai.wer.aligner.diff.EditAlgorithm;
import ai.wer.aligner.diff.EditDistance;
import ai.wer.aligner.text.Span;
import ai.wer.aligner.text.TokenList;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;

class AlignmentBuilderTest {

    private final AlignmentBuilder builder = new AlignmentBuilder();

    @Test
    void restoresMatchesAroundSubstitution() {
        Alignment alignment = builder.build(
                tokens("the", "quick", "brown", "fox"),
                tokens("the", "quick", "brown", "dog"),
                EditScript.of(EditStep.substitute(3, 3)));

        assertThat(alignment.ops()).extracting(Op::kind)
                .containsExactly(OpKind.MATCH, OpKind.MATCH, OpKind.MATCH, OpKind.SUBSTITUTE);
        assertThat(alignment.ops().subList(0, 3)).extracting(op -> ((Op.Match) op).refIndex())
                .containsExactly(0, 1, 2);
        Op.Substitute substitute = (Op.Substitute) alignment.get(3);
        assertThat(substitute.refText()).isEqualTo("fox");
        assertThat(substitute.hypText()).isEqualTo("dog");
        assertThat(substitute.refSpan()).isEqualTo(new Span(16, 19));
        assertThat(alignment.numEdits()).isEqualTo(1);
        assertThat(alignment.numMatches()).isEqualTo(3);
    }

    @Test
    void trailingDeletionWithoutAnchor() {
        Alignment alignment = builder.build(
                tokens("testing", "one", "two", "three"),
                tokens("testing", "one", "two"),
                EditScript.of(EditStep.of("delete", 3, null)));

        assertThat(alignment.ops()).extracting(Op::kind)
                .containsExactly(OpKind.MATCH, OpKind.MATCH, OpKind.MATCH, OpKind.DELETE);
        assertThat(((Op.Delete) alignment.get(3)).refText()).isEqualTo("three");
        assertThat(alignment.numDeletions()).isEqualTo(1);
    }

    @Test
    void insertionLandsBetweenMatches() {
        Alignment alignment = builder.build(
                tokens("a", "b"),
                tokens("a", "x", "b"),
                EditScript.of(EditStep.insert(1)));

        assertThat(alignment.ops()).extracting(Op::kind)
                .containsExactly(OpKind.MATCH, OpKind.INSERT, OpKind.MATCH);
        Op.Insert insert = (Op.Insert) alignment.get(1);
        assertThat(insert.hypText()).isEqualTo("x");
        assertThat(insert.hypIndex()).isEqualTo(1);
    }

    @Test
    void unanchoredDeletionPrecedesCompetingInsertion() {
        Alignment alignment = builder.build(
                tokens("a", "b", "c"),
                tokens("a", "x", "c"),
                EditScript.of(EditStep.insert(1), EditStep.delete(1)));

        assertThat(alignment.ops()).extracting(Op::kind)
                .containsExactly(OpKind.MATCH, OpKind.DELETE, OpKind.INSERT, OpKind.MATCH);
    }

    @Test
    void insertionAnchoredAtFrontierGoesFirst() {
        Alignment alignment = builder.build(
                tokens("a", "b", "c"),
                tokens("a", "x", "c"),
                EditScript.of(EditStep.delete(1), EditStep.insert(1, 1)));

        assertThat(alignment.ops()).extracting(Op::kind)
                .containsExactly(OpKind.MATCH, OpKind.INSERT, OpKind.DELETE, OpKind.MATCH);
    }

    @Test
    void deletionAnchoredAfterFrontierLetsInsertionGoFirst() {
        Alignment alignment = builder.build(
                tokens("a", "b", "c"),
                tokens("a", "x", "c"),
                EditScript.of(EditStep.delete(1, 2), EditStep.insert(1)));

        assertThat(alignment.ops()).extracting(Op::kind)
                .containsExactly(OpKind.MATCH, OpKind.INSERT, OpKind.DELETE, OpKind.MATCH);
    }

    @Test
    void substitutionFollowedByInsertionCluster() {
        Alignment alignment = builder.build(
                tokens("a", "b"),
                tokens("x", "y", "b"),
                EditScript.of(EditStep.substitute(0, 0), EditStep.insert(1)));

        assertThat(alignment.ops()).extracting(Op::kind)
                .containsExactly(OpKind.SUBSTITUTE, OpKind.INSERT, OpKind.MATCH);
        assertThat(refSide(alignment)).containsExactly("a", "b");
        assertThat(hypSide(alignment)).containsExactly("x", "y", "b");
    }

    @Test
    void emptySidesProduceOnlyEdits() {
        assertThat(builder.build(TokenList.empty(), TokenList.empty(), EditScript.empty()).isEmpty()).isTrue();

        Alignment insertions = builder.build(TokenList.empty(), tokens("x", "y"),
                EditScript.of(EditStep.insert(0), EditStep.insert(1)));
        assertThat(insertions.numInsertions()).isEqualTo(2);

        Alignment deletions = builder.build(tokens("x"), TokenList.empty(), EditScript.of(EditStep.delete(0)));
        assertThat(deletions.numDeletions()).isEqualTo(1);
    }

    @Test
    void slicedInputsAreIndexedByPosition() {
        TokenList ref = tokens("skip", "a", "b").slice(1, 3);
        TokenList hyp = tokens("a", "c");

        Alignment alignment = builder.build(ref, hyp, EditScript.of(EditStep.substitute(1, 1)));

        assertThat(((Op.Match) alignment.get(0)).refIndex()).isZero();
        assertThat(((Op.Substitute) alignment.get(1)).refIndex()).isEqualTo(1);
    }

    @Test
    void unequalUntouchedPositionsAreFatal() {
        Throwable thrown = catchThrowable(() -> builder.build(tokens("a", "b"), tokens("a"), EditScript.empty()));

        assertThat(thrown).isInstanceOf(EditScriptException.class).hasMessageContaining("Mismatch in match indices");
    }

    @Test
    void unknownOperationKindIsFatal() {
        Throwable thrown = catchThrowable(() -> EditStep.of("transpose", 0, 1));

        assertThat(thrown).isInstanceOf(EditScriptException.class)
                .hasMessageContaining("Unknown operation type: transpose");
        assertThat(EditStep.of("replace", 0, 1).kind()).isEqualTo(EditKind.SUBSTITUTE);
    }

    @Test
    void crossingPairsAreFatal() {
        Throwable thrown = catchThrowable(() -> builder.build(tokens("a", "b"), tokens("c", "d"),
                EditScript.of(EditStep.substitute(0, 1), EditStep.substitute(1, 0))));

        assertThat(thrown).isInstanceOf(EditScriptException.class).hasMessageContaining("cross");
    }

    @Test
    void indexTouchedTwiceIsFatal() {
        Throwable thrown = catchThrowable(() -> builder.build(tokens("a"), tokens("b", "c"),
                EditScript.of(EditStep.substitute(0, 0), EditStep.delete(0))));

        assertThat(thrown).isInstanceOf(EditScriptException.class).hasMessageContaining("touched by both");
    }

    @Test
    void indexOutOfRangeIsFatal() {
        Throwable thrown = catchThrowable(() -> builder.build(tokens("a"), tokens("a"),
                EditScript.of(EditStep.delete(5))));

        assertThat(thrown).isInstanceOf(EditScriptException.class).hasMessageContaining("outside");
    }

    @Test
    void everyPrimitiveReconstructsBothSides() {
        Random random = new Random(42);
        String[] alphabet = {"a", "b", "c", "d"};
        for (EditAlgorithm algorithm : EditAlgorithm.values()) {
            EditDistance distance = algorithm.create();
            for (int round = 0; round < 200; round++) {
                List<String> ref = randomWords(random, alphabet);
                List<String> hyp = randomWords(random, alphabet);

                Alignment alignment = builder.build(tokens(ref.toArray(String[]::new)),
                        tokens(hyp.toArray(String[]::new)), distance.editScript(ref, hyp));

                assertThat(refSide(alignment)).as("%s ref side for %s / %s", algorithm, ref, hyp)
                        .isEqualTo(ref);
                assertThat(hypSide(alignment)).as("%s hyp side for %s / %s", algorithm, ref, hyp)
                        .isEqualTo(hyp);
                assertThat(alignment.numMatches() + alignment.numSubstitutions() + alignment.numInsertions()
                        + alignment.numDeletions()).isEqualTo(alignment.size());
                assertThat(alignment.stream().filter(op -> op.kind() == OpKind.MATCH)
                        .allMatch(op -> ((Op.Match) op).refText().equals(((Op.Match) op).hypText()))).isTrue();
            }
        }
    }

    private static List<String> randomWords(Random random, String[] alphabet) {
        int length = random.nextInt(7);
        List<String> words = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            words.add(alphabet[random.nextInt(alphabet.length)]);
        }
        return words;
    }
}
