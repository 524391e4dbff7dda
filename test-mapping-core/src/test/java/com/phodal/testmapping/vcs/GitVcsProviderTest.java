package com.phodal.testmapping.vcs;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs against a git executable that does not exist or a shell script standing in for git,
 * so no real repository is needed.
 */
class GitVcsProviderTest {

    @TempDir
    Path repo;

    private GitVcsProvider provider;

    @BeforeEach
    void setUp() throws Exception {
        Files.createDirectories(repo.resolve(".git"));
        Files.createDirectories(repo.resolve("lib").resolve("nested"));
        provider = new GitVcsProvider("git-executable-that-does-not-exist");
    }

    @Test
    void shouldFindWorkTreeFromNestedDirectory() {
        Path nested = repo.resolve("lib").resolve("nested");

        assertTrue(provider.isPresent(nested));
        assertEquals(Optional.of(repo.toAbsolutePath().normalize()), provider.findWorkTree(nested));
    }

    @Test
    void shouldFallBackToWorkTreeWhenGitIsUnavailable() {
        Optional<Path> root = provider.getRepositoryRoot(repo.resolve("lib"));

        assertEquals(Optional.of(repo.toAbsolutePath().normalize()), root);
    }

    @Test
    void shouldReturnNoRevisionWhenGitIsUnavailable() {
        assertEquals(Optional.empty(), provider.getCurrentRevision(repo));
    }

    @Test
    void shouldConvertToRootRelativePath() {
        Path file = repo.resolve("lib").resolve("nested").resolve("foo.rb");

        assertEquals(Optional.of("/lib/nested/foo.rb"), provider.toRelativePath(repo, file));
        assertEquals(Optional.empty(), provider.toRelativePath(repo, repo.getParent().resolve("elsewhere.rb")));
    }

    @Test
    void shouldDetectFirstPresentProvider() {
        VcsProvider absent = new GitVcsProvider("git-executable-that-does-not-exist") {
            @Override
            public boolean isPresent(Path workspacePath) {
                return false;
            }
        };

        assertSame(provider, VcsProviderFactory.detect(repo, List.of(absent, provider)).orElseThrow());
        assertEquals(Optional.empty(), VcsProviderFactory.detect(repo, List.of(absent)));
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void shouldReadRevisionFromGitOutput(@TempDir Path bin) throws Exception {
        String sha = "0123456789abcdef0123456789abcdef01234567";
        Path git = script(bin, "echo " + sha);

        assertEquals(Optional.of(sha), new GitVcsProvider(git.toString()).getCurrentRevision(repo));
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void shouldGiveUpOnHungGitWithinTimeout(@TempDir Path bin) throws Exception {
        Path git = script(bin, "sleep 30");
        GitVcsProvider hanging = new GitVcsProvider(git.toString(), 1);

        long start = System.nanoTime();
        Optional<String> revision = hanging.getCurrentRevision(repo);
        long elapsedSeconds = (System.nanoTime() - start) / 1_000_000_000L;

        assertEquals(Optional.empty(), revision);
        assertTrue(elapsedSeconds < 10, "Timed out after " + elapsedSeconds + "s");
    }

    private static Path script(Path dir, String body) throws Exception {
        Path file = dir.resolve("fake-git");
        Files.writeString(file, "#!/bin/sh\n" + body + "\n", StandardCharsets.UTF_8);
        assertTrue(file.toFile().setExecutable(true));
        return file;
    }
}
