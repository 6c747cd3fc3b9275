package com.gatekeeper.core.scope;

import com.gatekeeper.core.config.GatekeeperProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link SourceFileScanner}, run against {@code @TempDir} trees.
 */
class SourceFileScannerTest {

    @TempDir
    Path tempDir;

    SourceFileScanner scanner = new SourceFileScanner(new GatekeeperProperties());

    private void touch(String relative) throws IOException {
        Path file = tempDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, "");
    }

    @Test
    @DisplayName("scans empty directory and returns zero files")
    void emptyDirectory() {
        assertTrue(scanner.scan(tempDir).isEmpty());
    }

    @Test
    @DisplayName("returns source files sorted, skipping other files")
    void sourceFilesOnly() throws IOException {
        touch("src/b.ts");
        touch("src/a.py");
        touch("README.md");
        touch("package.json");

        assertEquals(List.of(tempDir.resolve("src/a.py"), tempDir.resolve("src/b.ts")), scanner.scan(tempDir));
    }

    @Test
    @DisplayName("ignores dependency, build and VCS directories")
    void ignoredDirectories() throws IOException {
        touch("node_modules/left-pad/index.js");
        touch(".git/hooks/pre-commit.py");
        touch("target/classes/App.java");
        touch("src/main/java/App.java");

        assertEquals(List.of(tempDir.resolve("src/main/java/App.java")), scanner.scan(tempDir));
        assertTrue(scanner.isIgnored(tempDir, tempDir.resolve("node_modules/left-pad/index.js")));
        assertFalse(scanner.isIgnored(tempDir, tempDir.resolve("src/main/java/App.java")));
    }

    @Test
    @DisplayName("source extensions come from configuration")
    void configuredExtensions() throws IOException {
        var props = new GatekeeperProperties();
        props.getStandards().setSourceExtensions(Set.of("go"));
        touch("main.go");
        touch("app.ts");

        assertEquals(List.of(tempDir.resolve("main.go")), new SourceFileScanner(props).scan(tempDir));
        assertTrue(scanner.isSourceFile(Path.of("x/App.TSX")));
        assertFalse(scanner.isSourceFile(Path.of("Makefile")));
    }

    @Test
    @DisplayName("missing root raises UncheckedIOException")
    void missingRoot() {
        assertThrows(UncheckedIOException.class, () -> scanner.scan(tempDir.resolve("absent")));
    }
}
