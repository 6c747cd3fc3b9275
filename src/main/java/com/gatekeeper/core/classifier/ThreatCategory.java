package com.gatekeeper.core.classifier;

import com.gatekeeper.core.model.Severity;

import java.util.Arrays;
import java.util.Optional;

/**
 * Categories the {@link PatternClassifier} can assign to a command.
 * <p>
 * Hard-block categories always stop the pre-action gate; the rest surface
 * as warnings and let the command run.
 */
public enum ThreatCategory {

    DESTRUCTIVE_DELETE("destructive_delete", Severity.ERROR, true,
            "Recursive or forced file deletion",
            "Delete specific files by name, or ask the user to remove them manually."),
    OVERWRITE_TRUNCATE("overwrite_truncate", Severity.ERROR, true,
            "In-place overwrite or truncation of a file",
            "Edit the file with the Edit tool instead of truncating it from the shell."),
    DESTRUCTIVE_DATA_OPERATION("destructive_data_operation", Severity.ERROR, true,
            "Destructive archive, package or database operation",
            "Ask the user to run destructive data or package operations themselves."),
    DESTRUCTIVE_VCS_OPERATION("destructive_vcs_operation", Severity.ERROR, true,
            "History-rewriting or work-discarding version control operation",
            "Use non-destructive git commands (git stash, git revert) or ask the user."),
    SYSTEM_KILL_FORMAT("system_kill_format", Severity.ERROR, true,
            "Process kill, disk format or system shutdown",
            "Stop processes through the tool that started them; never format or shut down the host."),
    DANGEROUS_TARGET("dangerous_target", Severity.ERROR, true,
            "Destructive operation against a root, home or wildcard target",
            "Target an explicit path inside the project instead of /, ~ or a wildcard."),
    COMMAND_CHAINING("command_chaining", Severity.ERROR, true,
            "Command chain hides a destructive sub-command",
            "Run each command separately so every step can be reviewed."),
    PRIVILEGE_ESCALATION("privilege_escalation", Severity.WARNING, false,
            "Command requests elevated privileges",
            "Avoid sudo; project tasks should not need root.");

    private final String id;
    private final Severity severity;
    private final boolean hardBlock;
    private final String description;
    private final String remediation;

    ThreatCategory(String id, Severity severity, boolean hardBlock, String description, String remediation) {
        this.id = id;
        this.severity = severity;
        this.hardBlock = hardBlock;
        this.description = description;
        this.remediation = remediation;
    }

    public String id() { return id; }
    public Severity severity() { return severity; }
    public boolean isHardBlock() { return hardBlock; }
    public String description() { return description; }
    public String remediation() { return remediation; }

    public static Optional<ThreatCategory> fromRuleId(String ruleId) {
        return Arrays.stream(values()).filter(c -> c.id.equals(ruleId)).findFirst();
    }
}
