package com.gatekeeper.core.classifier;

import com.gatekeeper.core.config.GatekeeperProperties;
import com.gatekeeper.core.model.Violation;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Classifies a shell command into threat categories using surface pattern matching.
 * <p>
 * The safe-prefix allow-list is consulted first and short-circuits every detector,
 * but only for a single command: anything containing a chaining operator,
 * substitution or output redirection always goes through the detectors.
 * Detectors run in registration order and any single match is enough; there is
 * no scoring. Quoting is not parsed, so {@code rm} inside a string literal after
 * {@code ;} is still reported.
 */
@Service
public class PatternClassifier {

    /** Read-only or history-preserving commands that never need inspection. */
    static final List<String> DEFAULT_SAFE_PREFIXES = List.of(
            "git status", "git log", "git diff", "git show", "git branch", "git commit",
            "git add", "git fetch", "git blame", "git rev-parse", "git ls-files",
            "git remote", "git tag", "git stash list", "git describe",
            "ls", "pwd", "cat", "head", "tail", "wc", "grep", "rg", "which", "tree");

    /** Operators that disable the allow-list short-circuit. */
    private static final Pattern COMPOUND_COMMAND = Pattern.compile("[;&|`>\\n]|\\$\\(");

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final String SUB_COMMAND =
            "(?:sudo\\s+)?(?:rm|dd|mkfs|shred|truncate|kill|killall|pkill|chmod|chown)\\b";

    static final List<DetectorRule> DEFAULT_RULES = List.of(
            DetectorRule.matching("rm-recursive-or-force", ThreatCategory.DESTRUCTIVE_DELETE,
                    "(^|[^\\w-])rm\\s+(?:[^;&|]*\\s)?(?:-[a-z]*[rf][a-z]*|--recursive|--force)(\\s|$)"),
            DetectorRule.matching("find-delete", ThreatCategory.DESTRUCTIVE_DELETE,
                    "\\bfind\\s+[^;&|]*(?:-delete\\b|-exec\\s+rm\\b)"),
            DetectorRule.matching("shred-unlink", ThreatCategory.DESTRUCTIVE_DELETE,
                    "(^|[;&|]\\s*)(?:shred|unlink)\\s",
                    "\\bmv\\s+[^;&|]*\\s/dev/null(\\s|$)"),

            DetectorRule.matching("bare-redirect", ThreatCategory.OVERWRITE_TRUNCATE,
                    "^>\\s*\\S",
                    "(^|[;&|]\\s*)(?::|true)\\s*>\\s*\\S",
                    "\\bcat\\s+/dev/null\\s*>",
                    "\\bcp\\s+/dev/null\\s+\\S"),
            DetectorRule.matching("truncate", ThreatCategory.OVERWRITE_TRUNCATE,
                    "(^|[;&|]\\s*)truncate\\s+(?:-s|--size)",
                    "\\bdd\\s+[^;&|]*\\bof=(?!/dev/null)"),

            DetectorRule.matching("sql-drop", ThreatCategory.DESTRUCTIVE_DATA_OPERATION,
                    "\\bdrop\\s+(?:table|database|schema|view|index)\\b",
                    "\\btruncate\\s+table\\b",
                    "\\bdelete\\s+from\\s+[\\w.\"`]+\\s*(?:;|'|\"|$)"),
            DetectorRule.matching("datastore-wipe", ThreatCategory.DESTRUCTIVE_DATA_OPERATION,
                    "\\bdropdb\\b", "\\bflushall\\b", "\\bflushdb\\b"),
            DetectorRule.matching("package-removal", ThreatCategory.DESTRUCTIVE_DATA_OPERATION,
                    "\\b(?:npm|pnpm|yarn)\\s+(?:uninstall|remove|rm|un)\\b",
                    "\\b(?:pip3?|uv\\s+pip)\\s+uninstall\\b",
                    "\\bbrew\\s+(?:uninstall|remove)\\b",
                    "\\bapt(?:-get)?\\s+(?:remove|purge|autoremove)\\b"),
            DetectorRule.matching("archive-remove-sources", ThreatCategory.DESTRUCTIVE_DATA_OPERATION,
                    "\\btar\\s+[^;&|]*--remove-files\\b",
                    "\\bzip\\s+(?:[^;&|]*\\s)?-[a-z]*m[a-z]*\\s"),

            DetectorRule.matching("git-discard", ThreatCategory.DESTRUCTIVE_VCS_OPERATION,
                    "\\bgit\\s+reset\\s+[^;&|]*--hard\\b",
                    "\\bgit\\s+clean\\s+[^;&|]*-[a-z]*f",
                    "\\bgit\\s+checkout\\s+[^;&|]*--\\s+\\.(\\s|$)",
                    "\\bgit\\s+stash\\s+(?:drop|clear)\\b"),
            DetectorRule.matching("git-rewrite", ThreatCategory.DESTRUCTIVE_VCS_OPERATION,
                    "\\bgit\\s+push\\b[^;&|]*(?:--force\\b|\\s-f(\\s|$))",
                    "\\bgit\\s+filter-branch\\b"),

            DetectorRule.matching("kill", ThreatCategory.SYSTEM_KILL_FORMAT,
                    "(^|[;&|]\\s*)(?:sudo\\s+)?kill\\s+-(?:9|kill|s\\s+kill)\\b",
                    "(^|[;&|]\\s*)(?:sudo\\s+)?(?:killall|pkill)\\s"),
            DetectorRule.matching("format-disk", ThreatCategory.SYSTEM_KILL_FORMAT,
                    "\\bmkfs(?:\\.\\w+)?\\b", "\\bfdisk\\b", "\\bformat\\s+[a-z]:",
                    "\\bdd\\s+[^;&|]*\\bof=/dev/(?!null)", ">\\s*/dev/(?:sd|nvme|hd|disk)"),
            DetectorRule.matching("shutdown", ThreatCategory.SYSTEM_KILL_FORMAT,
                    "(^|[;&|]\\s*)(?:sudo\\s+)?(?:shutdown|reboot|halt|poweroff)\\b",
                    ":\\(\\)\\s*\\{\\s*:\\s*\\|\\s*:\\s*&\\s*\\}\\s*;\\s*:"),

            DetectorRule.matching("root-home-wildcard", ThreatCategory.DANGEROUS_TARGET,
                    "\\b(?:rm|chmod|chown)\\b[^;&|]*\\s(?:/|/\\*|~|~/|\\$home|\\.\\.|\\*)(?=\\s|$)"),
            DetectorRule.matching("world-writable", ThreatCategory.DANGEROUS_TARGET,
                    "\\bchmod\\s+(?:-r\\s+)?(?:0?777|a\\+rwx)\\b",
                    "\\bchown\\s+-r\\s+[^;&|]*\\s/(?=\\s|$)"),

            DetectorRule.matching("chained-destructive", ThreatCategory.COMMAND_CHAINING,
                    "(?:&&|\\|\\||;|\\||\\$\\(|`)\\s*" + SUB_COMMAND,
                    "\\bxargs\\s+(?:-\\S+\\s+)*(?:sudo\\s+)?rm\\b"),
            DetectorRule.matching("pipe-to-shell", ThreatCategory.COMMAND_CHAINING,
                    "\\|\\s*(?:sudo\\s+)?(?:sh|bash|zsh)(\\s|$)",
                    "\\beval\\s"),

            DetectorRule.matching("sudo", ThreatCategory.PRIVILEGE_ESCALATION,
                    "(^|[;&|]\\s*)sudo\\s", "(^|[;&|]\\s*)su\\s+-", "\\bchmod\\s+[^;&|]*[ug]?\\+s\\b")
    );

    private final List<String> safePrefixes;
    private final List<DetectorRule> rules;

    @Autowired
    public PatternClassifier(GatekeeperProperties properties) {
        this(properties.getGuard().getSafePrefixes(), DEFAULT_RULES);
    }

    PatternClassifier(List<String> extraSafePrefixes, List<DetectorRule> rules) {
        var prefixes = new ArrayList<>(DEFAULT_SAFE_PREFIXES);
        if (extraSafePrefixes != null) {
            extraSafePrefixes.stream().map(PatternClassifier::normalize).forEach(prefixes::add);
        }
        this.safePrefixes = Collections.unmodifiableList(prefixes);
        this.rules = List.copyOf(rules);
    }

    /**
     * Classifies the command. Returns one violation per matched category, in rule order.
     * An empty set means nothing was detected or the command is allow-listed.
     */
    public Set<Violation> classify(String commandText) {
        if (commandText == null || commandText.isBlank()) {
            return Set.of();
        }
        String command = normalize(commandText);
        if (isAllowListed(command)) {
            return Set.of();
        }

        var matched = EnumSet.noneOf(ThreatCategory.class);
        var violations = new LinkedHashSet<Violation>();
        for (DetectorRule rule : rules) {
            if (matched.contains(rule.category()) || !rule.test(command)) {
                continue;
            }
            matched.add(rule.category());
            ThreatCategory category = rule.category();
            violations.add(new Violation(category.id(),
                    category.description() + " (" + rule.id() + ")",
                    category.severity(), null, 0, category.remediation()));
        }
        return Collections.unmodifiableSet(violations);
    }

    /** True when the (raw) command is a single command starting with a safe prefix. */
    public boolean isSafe(String commandText) {
        return commandText != null && isAllowListed(normalize(commandText));
    }

    private boolean isAllowListed(String command) {
        if (COMPOUND_COMMAND.matcher(command).find()) {
            return false;
        }
        for (String prefix : safePrefixes) {
            if (matches(prefix, command)) {
                return true;
            }
        }
        return false;
    }

    private boolean matches(String pattern, String command) {
        if (pattern.endsWith("*")) {
            return command.startsWith(pattern.substring(0, pattern.length() - 1));
        }
        return command.equals(pattern) || command.startsWith(pattern + " ");
    }

    static String normalize(String command) {
        return WHITESPACE.matcher(command.trim()).replaceAll(" ").toLowerCase(Locale.ROOT);
    }
}
