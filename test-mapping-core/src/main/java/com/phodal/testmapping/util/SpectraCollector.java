package com.phodal.testmapping.util;

import com.phodal.testmapping.model.Spectra;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Derives {@link Spectra} from raw line coverage.
 *
 * <p>Raw coverage maps an absolute file path to per-line execution markers indexed from 0.
 * A {@code null} marker is a line that is not executable, {@code 0} an executable line that
 * did not run, and any other value a hit count.</p>
 */
public final class SpectraCollector {

    private SpectraCollector() {
        // Utility class
    }

    /**
     * Collect executed project lines from raw coverage.
     * Files outside the project root and files without a single hit are dropped.
     *
     * @param projectRoot Absolute project root
     * @param rawCoverage Execution markers keyed by absolute file path
     * @return Spectra keyed by root-relative path
     */
    public static Spectra collect(Path projectRoot, Map<String, ? extends List<Integer>> rawCoverage) {
        Objects.requireNonNull(projectRoot, "projectRoot");
        Objects.requireNonNull(rawCoverage, "rawCoverage");

        Map<String, List<Integer>> lines = new LinkedHashMap<>();
        rawCoverage.forEach((file, markers) -> {
            if (file == null || markers == null || !ProjectPaths.isProjectFile(projectRoot, file)) {
                return;
            }
            List<Integer> executed = executedLines(markers);
            if (executed.isEmpty()) {
                return;
            }
            // Two spellings of the same file (e.g. "lib/../lib/x.rb") share one entry
            lines.merge(ProjectPaths.normalize(projectRoot, file), executed, SpectraCollector::union);
        });
        return Spectra.of(lines);
    }

    /**
     * 1-based numbers of the lines with a non-zero marker, in ascending order.
     */
    public static List<Integer> executedLines(List<Integer> markers) {
        List<Integer> executed = new ArrayList<>();
        for (int i = 0; i < markers.size(); i++) {
            Integer marker = markers.get(i);
            if (marker == null || marker == 0) {
                continue;
            }
            executed.add(i + 1);
        }
        return executed;
    }

    private static List<Integer> union(List<Integer> a, List<Integer> b) {
        TreeSet<Integer> merged = new TreeSet<>(a);
        merged.addAll(b);
        return new ArrayList<>(merged);
    }
}
