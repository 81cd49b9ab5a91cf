package ai.wer.aligner.pipeline;

import java.text.Normalizer.Form;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Built-in preprocessing functions registered under stable names.
 */
public final class DefaultPipelines {

    public static final String NONE = "none";
    public static final String WHITESPACE = "whitespace";
    public static final String LOWERCASE = "lowercase";

    // Zero-width and invisible Unicode characters
    private static final Pattern INVISIBLE_CHARS = Pattern.compile("[\\u200B\\u200C\\u200D\\uFEFF\\u00AD\\u2060\\u180E]");

    // Control characters except common whitespace (\n, \r, \t)
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");

    private static final Pattern WHITESPACE_RUNS = Pattern.compile("\\s+");

    private static final Pattern EDGE_PUNCTUATION = Pattern.compile("^[\\p{P}\\p{S}]+|[\\p{P}\\p{S}]+$");

    // Letters and digits, optionally joined by inner punctuation ("don't", "e-mail", "3.14")
    private static final String WORD_PATTERN = "[\\p{L}\\p{N}\\p{M}]+(?:[\\p{P}\\p{S}]+[\\p{L}\\p{N}\\p{M}]+)*";

    private static final PipelineRegistry REGISTRY = PipelineRegistry.builder()
            .standardizer(PipelineSelection.DEFAULT_NAME, DefaultPipelines::standardize)
            .standardizer(NONE, text -> text)
            .tokenizer(PipelineSelection.DEFAULT_NAME, new RegexTokenizer(WORD_PATTERN))
            .tokenizer(WHITESPACE, new RegexTokenizer("\\S+"))
            .normalizer(PipelineSelection.DEFAULT_NAME, ((Normalizer) DefaultPipelines::lowercase)
                    .andThen(DefaultPipelines::stripPunctuation))
            .normalizer(LOWERCASE, DefaultPipelines::lowercase)
            .normalizer(NONE, token -> token)
            .build();

    private DefaultPipelines() {
    }

    public static PipelineRegistry registry() {
        return REGISTRY;
    }

    /**
     * NFC composition, removal of invisible and control characters, whitespace runs collapsed to one space.
     */
    public static String standardize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String result = java.text.Normalizer.normalize(text, Form.NFC);
        result = INVISIBLE_CHARS.matcher(result).replaceAll("");
        result = CONTROL_CHARS.matcher(result).replaceAll("");
        result = WHITESPACE_RUNS.matcher(result).replaceAll(" ");
        return result.strip();
    }

    public static String lowercase(String token) {
        return token.toLowerCase(Locale.ROOT);
    }

    public static String stripPunctuation(String token) {
        return EDGE_PUNCTUATION.matcher(token).replaceAll("");
    }
}
