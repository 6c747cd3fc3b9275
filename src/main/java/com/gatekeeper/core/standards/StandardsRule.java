package com.gatekeeper.core.standards;

import com.gatekeeper.core.model.Severity;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * One registered code-standards rule.
 * <p>
 * A {@link Kind#FORBIDDEN_CONTENT} rule reports every match of {@code pattern} in the
 * file content. A {@link Kind#REQUIRED_FILE_NAME} rule reports the file when its base
 * name (without extension) does not fully match {@code pattern}.
 *
 * @param id         rule identifier reported on violations (several rules may share one)
 * @param severity   severity of the violations this rule produces
 * @param extensions lower-case file extensions the rule applies to
 * @param kind       what the pattern is matched against
 * @param pattern    compiled pattern
 * @param message    description of the finding
 * @param fix        remediation instruction
 */
public record StandardsRule(
    String id,
    Severity severity,
    Set<String> extensions,
    Kind kind,
    Pattern pattern,
    String message,
    String fix
) {

    public enum Kind { FORBIDDEN_CONTENT, REQUIRED_FILE_NAME }

    public static StandardsRule forbids(String id, Set<String> extensions, String regex, String message, String fix) {
        return new StandardsRule(id, Severity.ERROR, extensions, Kind.FORBIDDEN_CONTENT,
                Pattern.compile(regex, Pattern.MULTILINE), message, fix);
    }

    public static StandardsRule requiresName(String id, Set<String> extensions, String regex, String message, String fix) {
        return new StandardsRule(id, Severity.WARNING, extensions, Kind.REQUIRED_FILE_NAME,
                Pattern.compile(regex), message, fix);
    }

    public boolean appliesTo(String extension) {
        return extensions.contains(extension);
    }
}
