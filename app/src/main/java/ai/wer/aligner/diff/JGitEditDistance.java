package ai.wer.aligner.diff;

import ai.wer.aligner.alignment.EditScript;
import ai.wer.aligner.alignment.EditStep;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.eclipse.jgit.diff.DiffAlgorithm;
import org.eclipse.jgit.diff.Edit;
import org.eclipse.jgit.diff.EditList;

/**
 * Edit script from JGit's line-diff algorithms applied to token sequences.
 *
 * <p>JGit reports regions; a replaced region of {@code a} reference and {@code b} hypothesis tokens becomes
 * {@code min(a, b)} pairwise substitutions followed by the surplus deletions or insertions. The script is minimal
 * with respect to the longest common subsequence, which is not always a minimal Levenshtein script.
 */
public class JGitEditDistance implements EditDistance {

    private final DiffAlgorithm algorithm;

    public JGitEditDistance(DiffAlgorithm.SupportedAlgorithm algorithm) {
        this(DiffAlgorithm.getAlgorithm(Objects.requireNonNull(algorithm, "algorithm")));
    }

    public JGitEditDistance(DiffAlgorithm algorithm) {
        this.algorithm = Objects.requireNonNull(algorithm, "algorithm");
    }

    @Override
    public EditScript editScript(List<String> reference, List<String> hypothesis) {
        Objects.requireNonNull(reference, "reference");
        Objects.requireNonNull(hypothesis, "hypothesis");
        EditList edits = algorithm.diff(TokenSequence.COMPARATOR,
                new TokenSequence(reference), new TokenSequence(hypothesis));

        List<EditStep> steps = new ArrayList<>();
        for (Edit edit : edits) {
            int paired = Math.min(edit.getLengthA(), edit.getLengthB());
            for (int k = 0; k < paired; k++) {
                steps.add(EditStep.substitute(edit.getBeginA() + k, edit.getBeginB() + k));
            }
            for (int ref = edit.getBeginA() + paired; ref < edit.getEndA(); ref++) {
                steps.add(EditStep.delete(ref, edit.getEndB()));
            }
            for (int hyp = edit.getBeginB() + paired; hyp < edit.getEndB(); hyp++) {
                steps.add(EditStep.insert(edit.getEndA(), hyp));
            }
        }
        return new EditScript(steps);
    }
}
