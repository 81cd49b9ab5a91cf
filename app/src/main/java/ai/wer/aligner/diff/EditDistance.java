package ai.wer.aligner.diff;

import ai.wer.aligner.alignment.EditScript;
import java.util.List;

/**
 * Edit-distance primitive over token texts. Implementations report edits only; matches stay implicit.
 */
@FunctionalInterface
public interface EditDistance {

    EditScript editScript(List<String> reference, List<String> hypothesis);

    default int distance(List<String> reference, List<String> hypothesis) {
        return editScript(reference, hypothesis).size();
    }
}
