package com.phodal.testmapping.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ProjectPathsTest {

    @Test
    void shouldStripRootPrefix(@TempDir Path root) {
        Path file = root.resolve("lib").resolve("foo.rb");

        assertTrue(ProjectPaths.isProjectFile(root, file));
        assertEquals("/lib/foo.rb", ProjectPaths.normalize(root, file));
        assertEquals("/lib/foo.rb", ProjectPaths.normalize(root, file.toString()));
    }

    @Test
    void shouldResolveDotSegmentsBeforeComparing(@TempDir Path root) {
        String file = root + "/lib/../app/models/user.rb";

        assertTrue(ProjectPaths.isProjectFile(root, file));
        assertEquals("/app/models/user.rb", ProjectPaths.normalize(root, file));
    }

    @Test
    void shouldRejectFilesOutsideRoot(@TempDir Path tmp) {
        Path root = tmp.resolve("app");
        Path sibling = tmp.resolve("app-old").resolve("x.rb");
        Path escaping = root.resolve("..").resolve("gems").resolve("y.rb");

        assertFalse(ProjectPaths.isProjectFile(root, sibling), "Shared string prefix is not containment");
        assertFalse(ProjectPaths.isProjectFile(root, escaping));
        assertFalse(ProjectPaths.isProjectFile(root, root), "Root itself is not a file of the project");
        assertThrows(IllegalArgumentException.class, () -> ProjectPaths.normalize(root, sibling));
    }

    @Test
    void shouldRejectRelativePaths() {
        Path cwd = Path.of("").toAbsolutePath();

        assertFalse(ProjectPaths.isProjectFile(cwd, "lib/x.rb"));
        assertFalse(ProjectPaths.isProjectFile(cwd, Path.of("(eval)")));
        assertThrows(IllegalArgumentException.class, () -> ProjectPaths.normalize(cwd, "lib/x.rb"));
    }
}
