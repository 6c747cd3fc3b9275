package com.gatekeeper.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Externalised configuration bound from {@code gatekeeper.*}.
 * <p>
 * The two runtime switches are normally set from the environment through
 * relaxed binding: {@code GATEKEEPER_DEBUG=true} and {@code GATEKEEPER_FAST=true}.
 */
@Component
@ConfigurationProperties(prefix = "gatekeeper")
public class GatekeeperProperties {

    private boolean debug = false;
    private boolean fast = false;
    private String projectDir = "";
    private Cache cache = new Cache();
    private Audit audit = new Audit();
    private Guard guard = new Guard();
    private Tools tools = new Tools();
    private Standards standards = new Standards();

    public boolean isDebug() { return debug; }
    public void setDebug(boolean debug) { this.debug = debug; }
    public boolean isFast() { return fast; }
    public void setFast(boolean fast) { this.fast = fast; }
    public String getProjectDir() { return projectDir; }
    public void setProjectDir(String projectDir) { this.projectDir = projectDir; }
    public Cache getCache() { return cache; }
    public void setCache(Cache cache) { this.cache = cache; }
    public Audit getAudit() { return audit; }
    public void setAudit(Audit audit) { this.audit = audit; }
    public Guard getGuard() { return guard; }
    public void setGuard(Guard guard) { this.guard = guard; }
    public Tools getTools() { return tools; }
    public void setTools(Tools tools) { this.tools = tools; }
    public Standards getStandards() { return standards; }
    public void setStandards(Standards standards) { this.standards = standards; }

    /**
     * Project root used when an event carries no {@code cwd}. Falls back to the
     * host's {@code CLAUDE_PROJECT_DIR} and then to the working directory.
     */
    public Path resolveProjectDir() {
        return resolveProjectDir(null);
    }

    /**
     * Project root for one event: the configured directory, then the host's
     * {@code CLAUDE_PROJECT_DIR}, then the event's {@code cwd}, then the working directory.
     * An existing directory is returned as its real path, symlinks resolved.
     */
    public Path resolveProjectDir(String eventCwd) {
        if (projectDir != null && !projectDir.isBlank()) {
            return realDirectory(Path.of(projectDir));
        }
        String hostDir = System.getenv("CLAUDE_PROJECT_DIR");
        if (hostDir != null && !hostDir.isBlank()) {
            return realDirectory(Path.of(hostDir));
        }
        if (eventCwd != null && !eventCwd.isBlank()) {
            return realDirectory(Path.of(eventCwd));
        }
        return realDirectory(Path.of(""));
    }

    /** Real path of an existing directory; other paths are only made absolute and normalised. */
    public static Path realDirectory(Path dir) {
        Path absolute = dir.toAbsolutePath().normalize();
        if (!Files.isDirectory(absolute)) {
            return absolute;
        }
        try {
            return absolute.toRealPath();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot resolve project directory " + absolute, e);
        }
    }

    public static class Cache {
        private int capacity = 256;
        private long ttlSeconds = 300;
        private double purgeThreshold = 0.8;
        private long maxFingerprintBytes = 5L * 1024 * 1024;

        public int getCapacity() { return capacity; }
        public void setCapacity(int capacity) { this.capacity = capacity; }
        public long getTtlSeconds() { return ttlSeconds; }
        public void setTtlSeconds(long ttlSeconds) { this.ttlSeconds = ttlSeconds; }
        public double getPurgeThreshold() { return purgeThreshold; }
        public void setPurgeThreshold(double purgeThreshold) { this.purgeThreshold = purgeThreshold; }
        public long getMaxFingerprintBytes() { return maxFingerprintBytes; }
        public void setMaxFingerprintBytes(long maxFingerprintBytes) { this.maxFingerprintBytes = maxFingerprintBytes; }
    }

    public static class Audit {
        private String directory = "logs/gatekeeper";

        public String getDirectory() { return directory; }
        public void setDirectory(String directory) { this.directory = directory; }
    }

    public static class Guard {
        private List<String> protectedPaths = List.of();
        private List<String> allowedRootFiles = List.of();
        private List<String> commandFileGlobs = List.of();
        private Set<String> envFileExemptions = Set.of(".env.sample", ".env.example", ".env.template");
        private List<String> safePrefixes = List.of();
        private boolean enforceRootStructure = true;

        public List<String> getProtectedPaths() { return protectedPaths; }
        public void setProtectedPaths(List<String> protectedPaths) { this.protectedPaths = protectedPaths; }
        public List<String> getAllowedRootFiles() { return allowedRootFiles; }
        public void setAllowedRootFiles(List<String> allowedRootFiles) { this.allowedRootFiles = allowedRootFiles; }
        public List<String> getCommandFileGlobs() { return commandFileGlobs; }
        public void setCommandFileGlobs(List<String> commandFileGlobs) { this.commandFileGlobs = commandFileGlobs; }
        public Set<String> getEnvFileExemptions() { return envFileExemptions; }
        public void setEnvFileExemptions(Set<String> envFileExemptions) { this.envFileExemptions = envFileExemptions; }
        public List<String> getSafePrefixes() { return safePrefixes; }
        public void setSafePrefixes(List<String> safePrefixes) { this.safePrefixes = safePrefixes; }
        public boolean isEnforceRootStructure() { return enforceRootStructure; }
        public void setEnforceRootStructure(boolean enforceRootStructure) { this.enforceRootStructure = enforceRootStructure; }
    }

    public static class Tools {
        private int timeoutSeconds = 120;
        private int maxOutputChars = 4000;
        private List<ToolDefinition> definitions = new ArrayList<>();

        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
        public int getMaxOutputChars() { return maxOutputChars; }
        public void setMaxOutputChars(int maxOutputChars) { this.maxOutputChars = maxOutputChars; }
        public List<ToolDefinition> getDefinitions() { return definitions; }
        public void setDefinitions(List<ToolDefinition> definitions) { this.definitions = definitions; }
    }

    /**
     * One external validation tool. {@code kind} is informational
     * ("lint", "type-check", "test") and shows up in rule ids.
     */
    public static class ToolDefinition {
        private String name;
        private String kind = "lint";
        private List<String> command = List.of();
        private Set<String> extensions = Set.of();
        private Set<String> modes = Set.of("FULL", "INCREMENTAL", "FILE_SPECIFIC");
        private boolean appendFiles = false;

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public String getKind() { return kind; }
        public void setKind(String kind) { this.kind = kind; }
        public List<String> getCommand() { return command; }
        public void setCommand(List<String> command) { this.command = command; }
        public Set<String> getExtensions() { return extensions; }
        public void setExtensions(Set<String> extensions) { this.extensions = extensions; }
        public Set<String> getModes() { return modes; }
        public void setModes(Set<String> modes) { this.modes = modes; }
        public boolean isAppendFiles() { return appendFiles; }
        public void setAppendFiles(boolean appendFiles) { this.appendFiles = appendFiles; }
    }

    public static class Standards {
        private Set<String> ignoreDirs = Set.of(
                ".git", "node_modules", "target", "build", ".idea", ".vscode",
                "__pycache__", ".gradle", "dist", "out", ".mvn", ".next", ".venv", "venv");
        private Set<String> sourceExtensions = Set.of("ts", "tsx", "js", "jsx", "py", "java");

        public Set<String> getIgnoreDirs() { return ignoreDirs; }
        public void setIgnoreDirs(Set<String> ignoreDirs) { this.ignoreDirs = ignoreDirs; }
        public Set<String> getSourceExtensions() { return sourceExtensions; }
        public void setSourceExtensions(Set<String> sourceExtensions) { this.sourceExtensions = sourceExtensions; }
    }
}
