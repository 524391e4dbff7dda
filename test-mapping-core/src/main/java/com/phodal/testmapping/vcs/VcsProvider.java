package com.phodal.testmapping.vcs;

import com.phodal.testmapping.util.ProjectPaths;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Interface for version control system providers.
 * The mapping store only needs the project root and the revision it was recorded against.
 */
public interface VcsProvider {

    /**
     * Check if this VCS is present in the workspace.
     *
     * @param workspacePath Path to the workspace root
     * @return true if this VCS is detected
     */
    boolean isPresent(Path workspacePath);

    /**
     * Get the current revision identifier.
     *
     * @param workspacePath Path to the workspace root
     * @return Revision identifier (commit SHA, change ID, etc.)
     */
    Optional<String> getCurrentRevision(Path workspacePath);

    /**
     * Get the repository root path.
     *
     * @param workspacePath Path within the workspace
     * @return Repository root path
     */
    Optional<Path> getRepositoryRoot(Path workspacePath);

    /**
     * Convert an absolute path to the root-relative form used in spectra.
     *
     * @param workspacePath Workspace or file path
     * @param absolutePath Absolute path to convert
     * @return Relative path starting with {@code /}, empty if the file is outside the repository
     */
    default Optional<String> toRelativePath(Path workspacePath, Path absolutePath) {
        return getRepositoryRoot(workspacePath)
            .filter(root -> ProjectPaths.isProjectFile(root, absolutePath))
            .map(root -> ProjectPaths.normalize(root, absolutePath));
    }
}
