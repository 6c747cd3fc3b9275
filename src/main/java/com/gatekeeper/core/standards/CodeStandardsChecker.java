package com.gatekeeper.core.standards;

import com.gatekeeper.core.model.Violation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;

/**
 * Static code-standards checks run by the completion gate before any external tool:
 * banned types, banned keywords, empty error handling and file naming conventions.
 * <p>
 * Rules are plain data evaluated in registration order; adding a check means adding
 * a {@link StandardsRule} to {@link #DEFAULT_RULES}. Matching is textual, so a banned
 * construct inside a string literal or comment is reported too.
 */
@Service
public class CodeStandardsChecker {

    private static final Logger log = LoggerFactory.getLogger(CodeStandardsChecker.class);

    private static final Set<String> TYPESCRIPT = Set.of("ts", "tsx");
    private static final Set<String> JAVASCRIPT_FAMILY = Set.of("ts", "tsx", "js", "jsx", "mjs", "cjs");
    private static final Set<String> CATCH_BLOCK_LANGUAGES = Set.of("ts", "tsx", "js", "jsx", "mjs", "cjs", "java");
    private static final Set<String> PYTHON = Set.of("py");
    private static final Set<String> JAVA = Set.of("java");

    public static final List<StandardsRule> DEFAULT_RULES = List.of(
            StandardsRule.forbids("banned_type", TYPESCRIPT,
                    ":\\s*any\\b(?!-)|\\bas\\s+any\\b|<any>",
                    "TypeScript 'any' type used",
                    "Replace 'any' with a specific type or 'unknown' and narrow it"),
            StandardsRule.forbids("banned_type", PYTHON,
                    ":\\s*Any\\b|->\\s*Any\\b",
                    "Python 'Any' type hint used",
                    "Replace 'Any' with a concrete type, a Protocol or a TypeVar"),

            StandardsRule.forbids("banned_keyword", JAVASCRIPT_FAMILY,
                    "^\\s*(?:export\\s+)?var\\s+[A-Za-z_$]",
                    "'var' declaration used",
                    "Use 'const', or 'let' when the binding is reassigned"),
            StandardsRule.forbids("banned_keyword", TYPESCRIPT,
                    "@ts-ignore\\b",
                    "'@ts-ignore' suppresses type checking",
                    "Fix the underlying type error, or use '@ts-expect-error' with an explanation"),
            StandardsRule.forbids("banned_keyword", PYTHON,
                    "^\\s*global\\s+[A-Za-z_]",
                    "'global' statement used",
                    "Pass the value as a parameter or keep the state in an object"),

            StandardsRule.forbids("empty_error_handling", CATCH_BLOCK_LANGUAGES,
                    "\\bcatch\\s*(?:\\([^)]*\\))?\\s*\\{\\s*\\}",
                    "Empty catch block swallows the error",
                    "Handle the error, log it with context, or rethrow it"),
            StandardsRule.forbids("empty_error_handling", PYTHON,
                    "^\\s*except\\b[^:\\n]*:\\s*pass\\b",
                    "'except ...: pass' swallows the error",
                    "Handle the exception, log it with context, or re-raise it"),

            StandardsRule.requiresName("naming_convention", JAVASCRIPT_FAMILY,
                    "[a-z0-9]+(?:-[a-z0-9]+)*(?:\\.[a-z0-9]+(?:-[a-z0-9]+)*)*",
                    "File name is not kebab-case",
                    "Rename the file to kebab-case, e.g. 'user-profile.ts'"),
            StandardsRule.requiresName("naming_convention", PYTHON,
                    "_{0,2}[a-z0-9]+(?:_[a-z0-9]+)*_{0,2}",
                    "File name is not snake_case",
                    "Rename the module to snake_case, e.g. 'user_profile.py'"),
            StandardsRule.requiresName("naming_convention", JAVA,
                    "[A-Z][A-Za-z0-9]*|package-info|module-info",
                    "File name is not PascalCase",
                    "Rename the file to match its PascalCase top-level type")
    );

    private final List<StandardsRule> rules;

    public CodeStandardsChecker() {
        this(DEFAULT_RULES);
    }

    CodeStandardsChecker(List<StandardsRule> rules) {
        this.rules = List.copyOf(rules);
    }

    /**
     * Reads and checks one file.
     *
     * @param file       absolute path of the file
     * @param projectDir project root, used to report paths relative to it
     * @throws UncheckedIOException if the file cannot be read
     */
    public List<Violation> check(Path file, Path projectDir) {
        String relative = projectDir != null && file.startsWith(projectDir)
                ? projectDir.relativize(file).toString()
                : file.toString();
        try {
            return check(relative, Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
    }

    /** Checks content that is attributed to {@code path}. */
    public List<Violation> check(String path, String content) {
        String fileName = Path.of(path).getFileName().toString();
        String extension = extension(fileName);
        var violations = new ArrayList<Violation>();

        for (StandardsRule rule : rules) {
            if (!rule.appliesTo(extension)) {
                continue;
            }
            switch (rule.kind()) {
                case FORBIDDEN_CONTENT -> {
                    Matcher matcher = rule.pattern().matcher(content);
                    while (matcher.find()) {
                        violations.add(new Violation(rule.id(), rule.message(), rule.severity(),
                                path, lineOf(content, matcher.start()), rule.fix()));
                    }
                }
                case REQUIRED_FILE_NAME -> {
                    String baseName = fileName.substring(0, fileName.length() - extension.length() - 1);
                    if (!rule.pattern().matcher(baseName).matches()) {
                        violations.add(new Violation(rule.id(), rule.message() + ": " + fileName,
                                rule.severity(), path, 0, rule.fix()));
                    }
                }
            }
        }
        log.debug("{}: {} standards findings", path, violations.size());
        return violations;
    }

    /** 1-based line of a character offset, skipping the leading whitespace a match may start on. */
    static int lineOf(String content, int offset) {
        int position = offset;
        while (position < content.length() && Character.isWhitespace(content.charAt(position))) {
            position++;
        }
        int line = 1;
        for (int i = 0; i < position && i < content.length(); i++) {
            if (content.charAt(i) == '\n') {
                line++;
            }
        }
        return line;
    }

    private static String extension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(dot + 1).toLowerCase(Locale.ROOT) : "";
    }
}
