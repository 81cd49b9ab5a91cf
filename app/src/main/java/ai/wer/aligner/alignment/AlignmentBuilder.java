package ai.wer.aligner.alignment;

import ai.wer.aligner.pipeline.PipelineContext;
import ai.wer.aligner.pipeline.PipelineSelection;
import ai.wer.aligner.text.MatchMode;
import ai.wer.aligner.text.Span;
import ai.wer.aligner.text.TokenList;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a sparse edit script into a total alignment by restoring the matches the script leaves implicit.
 *
 * <p>Positions untouched by any edit form the common subsequence of both sides, so there must be as many on the
 * reference side as on the hypothesis side; they are paired in increasing order. Operations are then emitted by
 * walking both sequences left to right. When a deletion and an insertion compete at the same point, the deletion
 * goes first unless the insertion is anchored at or before the current reference position (or the deletion is
 * anchored after the current hypothesis position).
 */
public class AlignmentBuilder {

    private static final Logger LOGGER = LoggerFactory.getLogger(AlignmentBuilder.class);

    private static final int UNPAIRED = -1;

    private final MatchMode mode;

    public AlignmentBuilder() {
        this(MatchMode.RAW);
    }

    /**
     * @param mode which token text the operations carry
     */
    public AlignmentBuilder(MatchMode mode) {
        this.mode = Objects.requireNonNull(mode, "mode");
    }

    public Alignment build(TokenList ref, TokenList hyp, EditScript script) {
        return build(ref, hyp, script, PipelineContext.current());
    }

    /**
     * Builds the alignment, reading normalized token text under {@code selection}.
     *
     * @throws EditScriptException if the script touches an index twice or out of range, if the untouched
     *                             positions of both sides differ in number, or if paired positions cross
     */
    public Alignment build(TokenList ref, TokenList hyp, EditScript script, PipelineSelection selection) {
        Objects.requireNonNull(ref, "ref");
        Objects.requireNonNull(hyp, "hyp");
        Objects.requireNonNull(script, "script");
        Objects.requireNonNull(selection, "selection");

        EditStep[] refOwners = new EditStep[ref.size()];
        EditStep[] hypOwners = new EditStep[hyp.size()];
        for (EditStep step : script.steps()) {
            validateAnchors(step, ref.size(), hyp.size());
            if (step.touchesRef()) {
                claim(refOwners, step.refIndex(), step, "reference");
            }
            if (step.touchesHyp()) {
                claim(hypOwners, step.hypIndex(), step, "hypothesis");
            }
        }

        int[] refPartner = new int[ref.size()];
        int[] hypPartner = new int[hyp.size()];
        Arrays.fill(refPartner, UNPAIRED);
        Arrays.fill(hypPartner, UNPAIRED);
        pairMatches(refOwners, hypOwners, refPartner, hypPartner);
        for (EditStep step : script.steps()) {
            if (step.kind() == EditKind.SUBSTITUTE) {
                refPartner[step.refIndex()] = step.hypIndex();
                hypPartner[step.hypIndex()] = step.refIndex();
            }
        }

        Sides sides = new Sides(ref, hyp, ref.texts(mode, selection), hyp.texts(mode, selection));
        List<Op> ops = merge(sides, refOwners, hypOwners, refPartner, hypPartner);
        Alignment alignment = new Alignment(ops);
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Built alignment of {} ops ({} matches) from edit steps {}",
                    alignment.size(), alignment.numMatches(), script.counts());
        }
        return alignment;
    }

    private void pairMatches(EditStep[] refOwners, EditStep[] hypOwners, int[] refPartner, int[] hypPartner) {
        List<Integer> matchRef = untouched(refOwners);
        List<Integer> matchHyp = untouched(hypOwners);
        if (matchRef.size() != matchHyp.size()) {
            throw new EditScriptException("Mismatch in match indices: " + matchRef.size()
                    + " untouched reference positions but " + matchHyp.size() + " untouched hypothesis positions");
        }
        for (int i = 0; i < matchRef.size(); i++) {
            refPartner[matchRef.get(i)] = matchHyp.get(i);
            hypPartner[matchHyp.get(i)] = matchRef.get(i);
        }
    }

    private List<Op> merge(Sides sides, EditStep[] refOwners, EditStep[] hypOwners,
                           int[] refPartner, int[] hypPartner) {
        TokenList ref = sides.ref();
        TokenList hyp = sides.hyp();
        List<Op> ops = new ArrayList<>(Math.max(ref.size(), hyp.size()));
        int i = 0;
        int j = 0;
        while (i < ref.size() || j < hyp.size()) {
            boolean deletion = i < ref.size() && refPartner[i] == UNPAIRED;
            boolean insertion = j < hyp.size() && hypPartner[j] == UNPAIRED;
            if (deletion && insertion) {
                if (insertionFirst(refOwners[i], hypOwners[j], i, j)) {
                    ops.add(sides.insert(j));
                    j++;
                } else {
                    ops.add(sides.delete(i));
                    i++;
                }
            } else if (deletion) {
                ops.add(sides.delete(i));
                i++;
            } else if (insertion) {
                ops.add(sides.insert(j));
                j++;
            } else if (i < ref.size() && j < hyp.size() && refPartner[i] == j) {
                ops.add(refOwners[i] == null ? sides.match(i, j) : sides.substitute(i, j));
                i++;
                j++;
            } else {
                throw new EditScriptException("Edit script pairs cross at reference position " + i
                        + " and hypothesis position " + j);
            }
        }
        return ops;
    }

    private boolean insertionFirst(EditStep deletion, EditStep insertion, int refPosition, int hypPosition) {
        if (insertion.hasRefAnchor()) {
            return insertion.refIndex() <= refPosition;
        }
        if (deletion.hasHypAnchor()) {
            return deletion.hypIndex() > hypPosition;
        }
        return false;
    }

    /**
     * Both token sequences with their texts already read under the requested mode.
     */
    private record Sides(TokenList ref, TokenList hyp, List<String> refTexts, List<String> hypTexts) {

        Op match(int refIndex, int hypIndex) {
            return new Op.Match(refTexts.get(refIndex), hypTexts.get(hypIndex), refIndex, hypIndex,
                    span(ref, refIndex), span(hyp, hypIndex));
        }

        Op substitute(int refIndex, int hypIndex) {
            return new Op.Substitute(refTexts.get(refIndex), hypTexts.get(hypIndex), refIndex, hypIndex,
                    span(ref, refIndex), span(hyp, hypIndex));
        }

        Op insert(int hypIndex) {
            return new Op.Insert(hypTexts.get(hypIndex), hypIndex, span(hyp, hypIndex));
        }

        Op delete(int refIndex) {
            return new Op.Delete(refTexts.get(refIndex), refIndex, span(ref, refIndex));
        }

        private static Span span(TokenList tokens, int index) {
            return tokens.get(index).span();
        }
    }

    private static void claim(EditStep[] owners, int index, EditStep step, String side) {
        if (index < 0 || index >= owners.length) {
            throw new EditScriptException(step.kind() + " step has " + side + " index " + index
                    + " outside [0, " + owners.length + ")");
        }
        if (owners[index] != null) {
            throw new EditScriptException(side + " index " + index + " is touched by both " + owners[index]
                    + " and " + step);
        }
        owners[index] = step;
    }

    private static void validateAnchors(EditStep step, int refSize, int hypSize) {
        if (step.hasRefAnchor() && step.refIndex() > refSize) {
            throw new EditScriptException("Insertion anchor " + step.refIndex() + " outside [0, " + refSize + "]");
        }
        if (step.hasHypAnchor() && step.hypIndex() > hypSize) {
            throw new EditScriptException("Deletion anchor " + step.hypIndex() + " outside [0, " + hypSize + "]");
        }
    }

    private static List<Integer> untouched(EditStep[] owners) {
        List<Integer> positions = new ArrayList<>();
        for (int i = 0; i < owners.length; i++) {
            if (owners[i] == null) {
                positions.add(i);
            }
        }
        return positions;
    }
}
