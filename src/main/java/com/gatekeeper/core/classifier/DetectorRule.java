package com.gatekeeper.core.classifier;

import java.util.Arrays;
import java.util.List;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * One registered detector: a predicate over a normalized command string and the
 * category it reports when it fires.
 *
 * @param id        short label shown in violation messages
 * @param category  category reported on a match
 * @param predicate test applied to the lower-cased, whitespace-collapsed command
 */
public record DetectorRule(
    String id,
    ThreatCategory category,
    Predicate<String> predicate
) {

    /** Detector that fires when any of the regular expressions is found in the command. */
    public static DetectorRule matching(String id, ThreatCategory category, String... regexes) {
        List<Pattern> patterns = Arrays.stream(regexes).map(Pattern::compile).toList();
        return new DetectorRule(id, category,
                command -> patterns.stream().anyMatch(p -> p.matcher(command).find()));
    }

    public boolean test(String normalizedCommand) {
        return predicate.test(normalizedCommand);
    }
}
