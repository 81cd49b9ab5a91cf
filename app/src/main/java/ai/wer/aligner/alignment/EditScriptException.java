package ai.wer.aligner.alignment;

/**
 * Raised when an edit script breaks the contract of the edit-distance primitive that produced it. This signals a
 * bug upstream, never a property of the data, and no alignment is produced.
 */
public class EditScriptException extends RuntimeException {

    public EditScriptException(String message) {
        super(message);
    }
}
