package com.gatekeeper.core.scope;

import com.gatekeeper.core.config.GatekeeperProperties;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Walks a project directory and lists the source files subject to validation.
 * <p>
 * Build-tool, dependency and IDE directories (e.g. {@code .git}, {@code node_modules},
 * {@code target}) are excluded; see {@code gatekeeper.standards.ignore-dirs}.
 */
@Service
public class SourceFileScanner {

    private final Set<String> ignoreDirs;
    private final Set<String> sourceExtensions;

    public SourceFileScanner(GatekeeperProperties properties) {
        this.ignoreDirs = properties.getStandards().getIgnoreDirs();
        this.sourceExtensions = properties.getStandards().getSourceExtensions();
    }

    /**
     * @return absolute paths of every source file under {@code projectRoot}, sorted
     * @throws UncheckedIOException if the directory walk fails
     */
    public List<Path> scan(Path projectRoot) {
        try (var stream = Files.walk(projectRoot)) {
            return stream.filter(Files::isRegularFile)
                    .filter(p -> !shouldIgnore(projectRoot, p))
                    .filter(this::isSourceFile)
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to scan " + projectRoot, e);
        }
    }

    public boolean isSourceFile(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot >= 0 && sourceExtensions.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    public boolean isIgnored(Path projectRoot, Path file) {
        return file.startsWith(projectRoot) && shouldIgnore(projectRoot, file);
    }

    /**
     * Returns {@code true} if any component of the path relative to the root is
     * an ignored directory name.
     */
    private boolean shouldIgnore(Path root, Path path) {
        for (Path component : root.relativize(path)) {
            if (ignoreDirs.contains(component.toString())) {
                return true;
            }
        }
        return false;
    }
}
