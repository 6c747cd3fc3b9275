package com.gatekeeper.core.security;

import com.gatekeeper.core.config.GatekeeperProperties;
import org.springframework.stereotype.Service;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Glob- and name-based rules for sensitive files: environment files, protected
 * paths, slash-command files and the allow-list of files permitted directly in
 * the project root. Paths passed in are relative to the project root.
 */
@Service
public class FileAccessPolicy {

    private static final Pattern COMMAND_TOKEN_SPLIT = Pattern.compile("[\\s;&|<>()'\"`=,]+");

    private static final List<String> EXEMPT_ENV_SUFFIXES = List.of(".sample", ".example", ".template");

    private final GatekeeperProperties.Guard guard;

    public FileAccessPolicy(GatekeeperProperties properties) {
        this.guard = properties.getGuard();
    }

    /**
     * True for {@code .env}, {@code .env.local}, {@code credentials.env} and similar;
     * false for sample, example and template files.
     */
    public boolean isEnvFile(String path) {
        if (path == null || path.isBlank()) {
            return false;
        }
        String name = fileName(path).toLowerCase(Locale.ROOT);
        boolean envLike = name.equals(".env") || name.startsWith(".env.") || name.endsWith(".env");
        if (!envLike) {
            return false;
        }
        if (guard.getEnvFileExemptions().contains(name)) {
            return false;
        }
        return EXEMPT_ENV_SUFFIXES.stream().noneMatch(name::endsWith);
    }

    /** True when any token of a shell command names an environment file. */
    public boolean commandTouchesEnvFile(String command) {
        if (command == null || command.isBlank()) {
            return false;
        }
        for (String token : COMMAND_TOKEN_SPLIT.split(command)) {
            if (!token.isEmpty() && isEnvFile(token)) {
                return true;
            }
        }
        return false;
    }

    public boolean isProtected(String relativePath) {
        return matchesAny(guard.getProtectedPaths(), relativePath);
    }

    public boolean isCommandFile(String relativePath) {
        return matchesAny(guard.getCommandFileGlobs(), relativePath);
    }

    public boolean isAllowedInRoot(String fileName) {
        return matchesAny(guard.getAllowedRootFiles(), fileName);
    }

    public boolean enforcesRootStructure() {
        return guard.isEnforceRootStructure();
    }

    public Set<String> envFileExemptions() {
        return guard.getEnvFileExemptions();
    }

    private boolean matchesAny(List<String> globs, String relativePath) {
        if (globs == null || globs.isEmpty() || relativePath == null || relativePath.isBlank()) {
            return false;
        }
        Path candidate = Paths.get(relativePath.replace('\\', '/'));
        for (String glob : globs) {
            PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + glob);
            if (matcher.matches(candidate)) {
                return true;
            }
        }
        return false;
    }

    private static String fileName(String path) {
        String normalized = path.replace('\\', '/');
        while (normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        int slash = normalized.lastIndexOf('/');
        return slash >= 0 ? normalized.substring(slash + 1) : normalized;
    }
}
