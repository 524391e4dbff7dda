package com.phodal.testmapping.vcs;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;

/**
 * Git VCS provider implementation.
 * Locates the working tree by its {@code .git} entry and asks the git CLI for the HEAD commit.
 */
public class GitVcsProvider implements VcsProvider {
    private static final Logger log = LoggerFactory.getLogger(GitVcsProvider.class);

    private static final String GIT_DIR = ".git";
    private static final long DEFAULT_TIMEOUT_SECONDS = 5;
    private static final Pattern COMMIT_SHA = Pattern.compile("[0-9a-f]{40}|[0-9a-f]{64}");

    private final String gitExecutable;
    private final long timeoutSeconds;

    public GitVcsProvider() {
        this("git");
    }

    public GitVcsProvider(String gitExecutable) {
        this(gitExecutable, DEFAULT_TIMEOUT_SECONDS);
    }

    /**
     * @param gitExecutable Name or path of the git binary
     * @param timeoutSeconds How long a single git invocation may run
     */
    public GitVcsProvider(String gitExecutable, long timeoutSeconds) {
        this.gitExecutable = gitExecutable;
        this.timeoutSeconds = timeoutSeconds;
    }

    @Override
    public boolean isPresent(Path workspacePath) {
        return findWorkTree(workspacePath).isPresent();
    }

    @Override
    public Optional<String> getCurrentRevision(Path workspacePath) {
        return runGitCommand(workspacePath, "rev-parse", "HEAD")
            .map(String::trim)
            .filter(sha -> COMMIT_SHA.matcher(sha).matches());
    }

    /**
     * Ask git for the top-level directory, falling back to the nearest directory holding {@code .git}
     * when the git binary is unavailable.
     */
    @Override
    public Optional<Path> getRepositoryRoot(Path workspacePath) {
        Optional<Path> topLevel = runGitCommand(workspacePath, "rev-parse", "--show-toplevel")
            .map(String::trim)
            .filter(output -> !output.isEmpty())
            .map(Path::of);
        if (topLevel.isPresent()) {
            return topLevel;
        }
        return findWorkTree(workspacePath);
    }

    /**
     * Find the directory containing {@code .git}, searching up the directory tree.
     */
    Optional<Path> findWorkTree(Path startPath) {
        Path current = startPath.toAbsolutePath().normalize();
        while (current != null) {
            if (Files.exists(current.resolve(GIT_DIR))) {
                return Optional.of(current);
            }
            current = current.getParent();
        }
        return Optional.empty();
    }

    /**
     * Run git in the workspace and return its stripped stdout, or empty on any failure.
     * Output goes to a scratch file so a hung git process cannot block the timeout.
     */
    private Optional<String> runGitCommand(Path workspacePath, String... args) {
        if (!Files.isDirectory(workspacePath)) {
            log.debug("Workspace is not a directory: {}", workspacePath);
            return Optional.empty();
        }

        List<String> command = new ArrayList<>(args.length + 1);
        command.add(gitExecutable);
        command.addAll(List.of(args));
        String commandLine = String.join(" ", command);

        Path output = null;
        try {
            output = Files.createTempFile("git-", ".out");
            Process process = new ProcessBuilder(command)
                .directory(workspacePath.toFile())
                .redirectOutput(output.toFile())
                .redirectError(ProcessBuilder.Redirect.DISCARD)
                .start();

            if (!process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                log.warn("Git command timed out after {}s: {}", timeoutSeconds, commandLine);
                return Optional.empty();
            }
            if (process.exitValue() != 0) {
                log.debug("Git command failed with exit code {}: {}", process.exitValue(), commandLine);
                return Optional.empty();
            }
            return Optional.of(Files.readString(output, StandardCharsets.UTF_8).strip());
        } catch (IOException e) {
            log.debug("Failed to run {}: {}", commandLine, e.getMessage());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Interrupted while running {}", commandLine);
            return Optional.empty();
        } finally {
            deleteQuietly(output);
        }
    }

    private static void deleteQuietly(Path scratch) {
        if (scratch == null) {
            return;
        }
        try {
            Files.deleteIfExists(scratch);
        } catch (IOException e) {
            log.debug("Could not delete git output file {}: {}", scratch, e.getMessage());
        }
    }
}
