package com.phodal.testmapping.util;

import java.nio.file.Path;

/**
 * Maps absolute file paths onto the project-relative form stored in spectra:
 * {@code <root>/lib/foo.rb} becomes {@code /lib/foo.rb}.
 */
public final class ProjectPaths {

    private static final char SEPARATOR = '/';

    private ProjectPaths() {
        // Utility class
    }

    /**
     * Check whether a file lies inside the project root.
     * Paths are compared by component, so {@code /work/app-old/x.rb} is not inside {@code /work/app}.
     * Relative paths such as {@code lib/x.rb} or {@code (eval)} never count as project files.
     *
     * @param projectRoot Absolute project root
     * @param file Absolute path of a covered file
     * @return true for absolute files strictly below the root
     */
    public static boolean isProjectFile(Path projectRoot, Path file) {
        if (!file.isAbsolute()) {
            return false;
        }
        Path root = canonical(projectRoot);
        Path candidate = canonical(file);
        return candidate.startsWith(root) && !candidate.equals(root);
    }

    public static boolean isProjectFile(Path projectRoot, String file) {
        return isProjectFile(projectRoot, Path.of(file));
    }

    /**
     * Convert an absolute path inside the project to its root-relative form.
     *
     * @param projectRoot Absolute project root
     * @param file Absolute path inside the root
     * @return Path with the root prefix stripped, starting with {@code /}
     * @throws IllegalArgumentException if the file is outside the project
     */
    public static String normalize(Path projectRoot, Path file) {
        if (!isProjectFile(projectRoot, file)) {
            throw new IllegalArgumentException("Not a project file: " + file + " (root " + projectRoot + ")");
        }
        String relative = canonical(projectRoot).relativize(canonical(file)).toString();
        return SEPARATOR + relative.replace('\\', SEPARATOR);
    }

    public static String normalize(Path projectRoot, String file) {
        return normalize(projectRoot, Path.of(file));
    }

    private static Path canonical(Path path) {
        return path.toAbsolutePath().normalize();
    }
}
