package com.phodal.testmapping.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Test-to-code mapping: the spectra recorded for each test file.
 * Holds at most one entry per test; recording a test again replaces its entry.
 *
 * <p>Serialized as {@code {"spec/a_spec": {"/lib/x.rb": [1, 4]}}}</p>
 *
 * @param entries Spectra keyed by test identifier
 */
public record CoverageMapping(Map<String, Spectra> entries) {

    private static final CoverageMapping EMPTY = new CoverageMapping(Map.of());

    public CoverageMapping {
        Objects.requireNonNull(entries, "entries");
        Map<String, Spectra> copy = new LinkedHashMap<>();
        entries.forEach((test, spectra) -> copy.put(
            Objects.requireNonNull(test, "test"),
            Objects.requireNonNull(spectra, () -> "spectra of " + test)));
        entries = Collections.unmodifiableMap(copy);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static CoverageMapping of(Map<String, Spectra> entries) {
        return new CoverageMapping(entries);
    }

    public static CoverageMapping empty() {
        return EMPTY;
    }

    @Override
    @JsonValue
    public Map<String, Spectra> entries() {
        return entries;
    }

    /**
     * Return a copy of this mapping with the entry for {@code test} set to {@code spectra}.
     * Any previous entry for the test is dropped, not merged.
     */
    public CoverageMapping with(String test, Spectra spectra) {
        Map<String, Spectra> updated = new LinkedHashMap<>(entries);
        updated.put(Objects.requireNonNull(test, "test"), Objects.requireNonNull(spectra, "spectra"));
        return new CoverageMapping(updated);
    }

    public Optional<Spectra> spectraFor(String test) {
        return Optional.ofNullable(entries.get(test));
    }

    /**
     * Tests whose recorded spectra contain exactly line {@code lineno} of {@code file}.
     */
    public Set<String> affectedTests(String file, int lineno) {
        Set<String> tests = new HashSet<>();
        entries.forEach((test, spectra) -> {
            if (spectra.covers(file, lineno)) {
                tests.add(test);
            }
        });
        return tests;
    }

    public Set<String> tests() {
        return entries.keySet();
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
