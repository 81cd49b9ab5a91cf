package ai.wer.aligner.pipeline;

import ai.wer.aligner.text.Span;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tokenizer emitting one span per non-empty match of a pattern.
 */
public class RegexTokenizer implements Tokenizer {

    private final Pattern pattern;

    public RegexTokenizer(String regex) {
        this(Pattern.compile(regex));
    }

    public RegexTokenizer(Pattern pattern) {
        this.pattern = Objects.requireNonNull(pattern, "pattern");
    }

    @Override
    public List<Span> tokenize(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        List<Span> spans = new ArrayList<>();
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            if (matcher.end() > matcher.start()) {
                spans.add(new Span(matcher.start(), matcher.end()));
            }
        }
        return spans;
    }

    public Pattern pattern() {
        return pattern;
    }

    @Override
    public String toString() {
        return "RegexTokenizer(" + pattern.pattern() + ")";
    }
}
