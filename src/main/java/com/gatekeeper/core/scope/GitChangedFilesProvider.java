package com.gatekeeper.core.scope;

import com.gatekeeper.core.invoker.ToolCommand;
import com.gatekeeper.core.invoker.ToolInvoker;
import com.gatekeeper.core.invoker.ToolResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

/**
 * {@link ChangedFilesProvider} that shells out to the {@code git} CLI through the
 * {@link ToolInvoker}: tracked changes against {@code HEAD} plus untracked files
 * that are not ignored. Deleted files are dropped.
 * <p>
 * Both listings are taken relative to the project directory, which may sit below
 * the repository root. {@code --relative} limits the diff to that directory and
 * prints paths from it, matching what {@code ls-files} does by default.
 */
@Component
public class GitChangedFilesProvider implements ChangedFilesProvider {

    private static final Logger log = LoggerFactory.getLogger(GitChangedFilesProvider.class);

    private static final Duration GIT_TIMEOUT = Duration.ofSeconds(15);

    private final ToolInvoker invoker;

    public GitChangedFilesProvider(ToolInvoker invoker) {
        this.invoker = invoker;
    }

    @Override
    public Optional<List<Path>> changedFiles(Path projectDir) {
        ToolResult tracked = runGit(projectDir, "diff", "--name-only", "--relative", "HEAD");
        if (!tracked.success()) {
            log.warn("git diff failed ({}): {}", tracked.status(), tracked.stderr().strip());
            return Optional.empty();
        }
        ToolResult untracked = runGit(projectDir, "ls-files", "--others", "--exclude-standard");
        if (!untracked.success()) {
            log.warn("git ls-files failed ({}): {}", untracked.status(), untracked.stderr().strip());
            return Optional.empty();
        }

        var files = new LinkedHashSet<Path>();
        collect(projectDir, tracked.stdout(), files);
        collect(projectDir, untracked.stdout(), files);
        log.debug("git reports {} changed files in {}", files.size(), projectDir);
        return Optional.of(List.copyOf(files));
    }

    private ToolResult runGit(Path projectDir, String... args) {
        var command = new ArrayList<String>();
        command.add("git");
        command.addAll(List.of(args));
        return invoker.run(new ToolCommand("git", command, projectDir, GIT_TIMEOUT));
    }

    private static void collect(Path projectDir, String output, LinkedHashSet<Path> into) {
        for (String line : output.split("\n")) {
            String relative = line.strip();
            if (relative.isEmpty()) {
                continue;
            }
            Path file = projectDir.resolve(relative).normalize();
            if (Files.isRegularFile(file)) {
                into.add(file);
            }
        }
    }
}
