package com.gatekeeper.core.scope;

import com.gatekeeper.core.config.GatekeeperProperties;
import com.gatekeeper.core.model.ActionRequest;
import com.gatekeeper.core.model.HookPhase;
import com.gatekeeper.core.model.ValidationMode;
import com.gatekeeper.core.model.ValidationScope;
import com.gatekeeper.core.security.PathSafetyResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Chooses how broadly the completion gate validates.
 * <p>
 * Strict priority, first match wins:
 * <ol>
 *   <li>completion-check phase: {@link ValidationMode#FULL}</li>
 *   <li>request names a single resource: {@link ValidationMode#FILE_SPECIFIC}</li>
 *   <li>otherwise: {@link ValidationMode#INCREMENTAL} over files changed since the last commit</li>
 * </ol>
 * If the version-control collaborator is unavailable, an incremental scope is
 * widened to a full one rather than silently validating nothing.
 */
@Service
public class ScopeSelector {

    private static final Logger log = LoggerFactory.getLogger(ScopeSelector.class);

    private final ChangedFilesProvider changedFilesProvider;
    private final SourceFileScanner scanner;
    private final PathSafetyResolver pathSafetyResolver;

    public ScopeSelector(ChangedFilesProvider changedFilesProvider,
                         SourceFileScanner scanner,
                         PathSafetyResolver pathSafetyResolver) {
        this.changedFilesProvider = changedFilesProvider;
        this.scanner = scanner;
        this.pathSafetyResolver = pathSafetyResolver;
    }

    public ValidationMode selectMode(ActionRequest request) {
        if (request.phase() == HookPhase.COMPLETION_CHECK) {
            return ValidationMode.FULL;
        }
        if (request.hasResource()) {
            return ValidationMode.FILE_SPECIFIC;
        }
        return ValidationMode.INCREMENTAL;
    }

    /**
     * The request's project directory as a real path. Scope files are real paths,
     * so ignore checks and relative tool arguments must start from the same form.
     */
    public Path projectRoot(ActionRequest request) {
        return GatekeeperProperties.realDirectory(request.projectDir());
    }

    /** Selects the mode and materialises the files it covers. */
    public ValidationScope select(ActionRequest request) {
        Path projectDir = projectRoot(request);
        ValidationMode mode = selectMode(request);
        return switch (mode) {
            case FULL -> new ValidationScope(mode, scanner.scan(projectDir), "completion check");
            case FILE_SPECIFIC -> fileScope(request, projectDir);
            case INCREMENTAL -> incrementalScope(projectDir);
        };
    }

    private ValidationScope fileScope(ActionRequest request, Path projectDir) {
        Optional<Path> resolved = pathSafetyResolver.resolve(request.resourcePath(), projectDir);
        if (resolved.isEmpty()) {
            return new ValidationScope(ValidationMode.FILE_SPECIFIC, List.of(),
                    "resource is outside the project: " + request.resourcePath());
        }
        Path file = resolved.get();
        if (!Files.isRegularFile(file) || !scanner.isSourceFile(file)
                || scanner.isIgnored(projectDir, file)) {
            return new ValidationScope(ValidationMode.FILE_SPECIFIC, List.of(),
                    "not a source file: " + request.resourcePath());
        }
        return new ValidationScope(ValidationMode.FILE_SPECIFIC, List.of(file), "single resource");
    }

    private ValidationScope incrementalScope(Path projectDir) {
        Optional<List<Path>> changed = changedFilesProvider.changedFiles(projectDir);
        if (changed.isEmpty()) {
            log.warn("Changed files unavailable for {}, widening to full validation", projectDir);
            return new ValidationScope(ValidationMode.FULL, scanner.scan(projectDir),
                    "version control unavailable, widened from incremental");
        }
        List<Path> files = changed.get().stream()
                .filter(scanner::isSourceFile)
                .filter(f -> !scanner.isIgnored(projectDir, f))
                .toList();
        return new ValidationScope(ValidationMode.INCREMENTAL, files, "changed since last commit");
    }
}
