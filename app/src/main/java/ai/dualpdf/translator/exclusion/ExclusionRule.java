package ai.dualpdf.translator.exclusion;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * One link of the exclusion chain. The check returns a detail string when the rule matches.
 */
public record ExclusionRule(String tag, Check check) {

    @FunctionalInterface
    public interface Check {
        Optional<String> test(DocumentCandidate candidate) throws Exception;
    }

    public ExclusionRule {
        Objects.requireNonNull(tag, "tag");
        Objects.requireNonNull(check, "check");
    }

    public static ExclusionRule when(String tag, Predicate<DocumentCandidate> predicate) {
        return new ExclusionRule(tag, candidate -> predicate.test(candidate) ? Optional.of("") : Optional.empty());
    }
}
