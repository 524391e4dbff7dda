package com.phodal.testmapping.vcs;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Factory for detecting VCS providers.
 * Tries each provider in order until one is found.
 */
public final class VcsProviderFactory {

    private static final List<VcsProvider> PROVIDERS = List.of(
        new GitVcsProvider()
    );

    private VcsProviderFactory() {
    }

    /**
     * Detect the VCS in use for a workspace.
     *
     * @param workspacePath Path to the workspace
     * @return The detected VCS provider, or empty if none found
     */
    public static Optional<VcsProvider> detect(Path workspacePath) {
        return detect(workspacePath, PROVIDERS);
    }

    static Optional<VcsProvider> detect(Path workspacePath, List<? extends VcsProvider> providers) {
        for (VcsProvider provider : providers) {
            if (provider.isPresent(workspacePath)) {
                return Optional.of(provider);
            }
        }
        return Optional.empty();
    }
}
