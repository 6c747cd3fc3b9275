package com.gatekeeper.core.model;

import java.nio.file.Path;
import java.util.List;

/**
 * A selected {@link ValidationMode} together with the files it covers.
 * Files are absolute and sorted so fingerprints over the scope are stable.
 */
public record ValidationScope(
    ValidationMode mode,
    List<Path> files,
    String reason
) {

    public ValidationScope {
        files = files == null ? List.of() : files.stream().sorted().toList();
    }

    public boolean isEmpty() {
        return files.isEmpty();
    }
}
