package com.phodal.testmapping.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Lines executed by a single test, grouped by file.
 * File paths are relative to the project root and start with {@code /}.
 * Line numbers are 1-indexed, distinct and strictly ascending within each file.
 *
 * <p>Serialized as a plain JSON object: {@code {"/lib/x.rb": [1, 4]}}</p>
 *
 * @param lines Executed line numbers keyed by root-relative file path
 */
public record Spectra(Map<String, List<Integer>> lines) {

    private static final Spectra EMPTY = new Spectra(Map.of());

    public Spectra {
        Objects.requireNonNull(lines, "lines");
        Map<String, List<Integer>> copy = new LinkedHashMap<>();
        lines.forEach((file, fileLines) -> {
            Objects.requireNonNull(file, "file");
            copy.put(file, checkAscending(file, fileLines));
        });
        lines = Collections.unmodifiableMap(copy);
    }

    /**
     * Create spectra from a file-to-lines map.
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Spectra of(Map<String, List<Integer>> lines) {
        return new Spectra(lines);
    }

    /**
     * Spectra of a test that executed no project lines.
     */
    public static Spectra empty() {
        return EMPTY;
    }

    @Override
    @JsonValue
    public Map<String, List<Integer>> lines() {
        return lines;
    }

    /**
     * Executed lines of a file, or an empty list when the file was not touched.
     */
    public List<Integer> lines(String file) {
        return lines.getOrDefault(file, List.of());
    }

    /**
     * Whether {@code lineno} of {@code file} was executed.
     * Exact membership: a file with lines {@code [10, 20, 30]} covers 20 but not 15.
     */
    public boolean covers(String file, int lineno) {
        List<Integer> fileLines = lines.get(file);
        if (fileLines == null) {
            return false;
        }
        return Collections.binarySearch(fileLines, lineno) >= 0;
    }

    public Set<String> files() {
        return lines.keySet();
    }

    public int fileCount() {
        return lines.size();
    }

    /**
     * Total number of executed lines across all files.
     */
    public int lineCount() {
        return lines.values().stream()
            .mapToInt(List::size)
            .sum();
    }

    public boolean isEmpty() {
        return lines.isEmpty();
    }

    private static List<Integer> checkAscending(String file, List<Integer> fileLines) {
        Objects.requireNonNull(fileLines, () -> "lines of " + file);
        int previous = 0;
        for (Integer line : fileLines) {
            if (line == null || line <= previous) {
                throw new IllegalArgumentException(
                    "Line numbers of " + file + " must be positive and strictly ascending: " + fileLines);
            }
            previous = line;
        }
        return List.copyOf(fileLines);
    }
}
