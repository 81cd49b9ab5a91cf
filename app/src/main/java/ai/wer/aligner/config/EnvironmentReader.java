package ai.wer.aligner.config;

import java.util.Optional;

@FunctionalInterface
public interface EnvironmentReader {
    Optional<String> get(String key);

    default Optional<String> getNonBlank(String key) {
        return get(key).filter(value -> !value.isBlank()).map(String::trim);
    }
}
