package ai.theorem.extractor.extract.label;

import java.util.Optional;

/**
 * One heuristic for inferring a theorem number. Returns empty when it cannot decide.
 */
@FunctionalInterface
public interface NumberResolver {

    Optional<String> resolve(ResolutionContext context);
}
