package ai.wer.aligner.alignment;

/**
 * Kind of an alignment operation.
 */
public enum OpKind {
    MATCH,
    SUBSTITUTE,
    INSERT,
    DELETE
}
