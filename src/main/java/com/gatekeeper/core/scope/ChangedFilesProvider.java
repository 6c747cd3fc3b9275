package com.gatekeeper.core.scope;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Lists files that differ from the last committed state.
 */
public interface ChangedFilesProvider {

    /**
     * @return absolute paths of changed and untracked files, or empty when the
     *         version-control collaborator is unavailable
     */
    Optional<List<Path>> changedFiles(Path projectDir);
}
