package ai.wer.aligner.text;

/**
 * Role of a text inside an example.
 */
public enum TextType {
    REF,
    HYP,
    KEYWORD
}
