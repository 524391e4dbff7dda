package com.phodal.testmapping.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.type.LogicalType;
import com.phodal.testmapping.model.CoverageMapping;
import com.phodal.testmapping.model.Spectra;
import com.phodal.testmapping.util.SpectraCollector;
import com.phodal.testmapping.vcs.GitVcsProvider;
import com.phodal.testmapping.vcs.VcsProvider;
import com.phodal.testmapping.vcs.VcsProviderFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Persistent test-to-code mapping of a project.
 * Records which lines each test executed and answers which tests touch a given line.
 *
 * <p>Files live under {@code <project root>/.ttnt/}:</p>
 * <ul>
 *   <li>{@code test_to_code_mapping.json}: the mapping, {@code {test: {file: [lines]}}}</li>
 *   <li>{@code commit_obj.txt}: the commit the mapping was recorded against</li>
 * </ul>
 *
 * <p>Writes are serialized within one store instance only. Separate processes recording at the
 * same time race on the mapping file and the last writer wins.</p>
 */
public class MappingStore {
    private static final Logger log = LoggerFactory.getLogger(MappingStore.class);

    public static final String DEFAULT_MAPPING_DIR = ".ttnt";
    public static final String MAPPING_FILE = "test_to_code_mapping.json";
    public static final String COMMIT_FILE = "commit_obj.txt";

    /**
     * System property naming the workspace used by {@link #fromSystemProperties()}.
     */
    public static final String WORKSPACE_PROPERTY = "ttnt.workspace-path";

    private final Path projectRoot;
    private final Path mappingPath;
    private final Path commitPath;
    private final VcsProvider vcsProvider;
    private final ObjectMapper objectMapper;
    private final Object writeLock = new Object();

    /**
     * Create a store for a git project root.
     */
    public MappingStore(Path projectRoot) {
        this(projectRoot, new GitVcsProvider());
    }

    /**
     * Create a store for a project root.
     *
     * @param projectRoot Existing project root directory
     * @param vcsProvider Provider used to resolve the current revision when anchoring
     * @throws IllegalArgumentException if the root is not a directory
     */
    public MappingStore(Path projectRoot, VcsProvider vcsProvider) {
        Objects.requireNonNull(projectRoot, "projectRoot");
        this.vcsProvider = Objects.requireNonNull(vcsProvider, "vcsProvider");
        if (!Files.isDirectory(projectRoot)) {
            throw new IllegalArgumentException("Project root is not a directory: " + projectRoot);
        }
        this.projectRoot = projectRoot.toAbsolutePath().normalize();
        Path baseDir = this.projectRoot.resolve(DEFAULT_MAPPING_DIR);
        this.mappingPath = baseDir.resolve(MAPPING_FILE);
        this.commitPath = baseDir.resolve(COMMIT_FILE);
        this.objectMapper = createObjectMapper();
    }

    private ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.disable(SerializationFeature.INDENT_OUTPUT);
        // Only well-formed integer line numbers and a single root object are accepted
        mapper.enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        mapper.disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT);
        mapper.coercionConfigFor(LogicalType.Integer)
            .setCoercion(CoercionInputShape.String, CoercionAction.Fail)
            .setCoercion(CoercionInputShape.Float, CoercionAction.Fail)
            .setCoercion(CoercionInputShape.Boolean, CoercionAction.Fail);
        return mapper;
    }

    public Path getProjectRoot() {
        return projectRoot;
    }

    public Path getMappingPath() {
        return mappingPath;
    }

    public Path getCommitMarkerPath() {
        return commitPath;
    }

    /**
     * Record the coverage of a test run, replacing any entry previously recorded for the test.
     *
     * @param test Identifier of the test file that was executed
     * @param rawCoverage Per-line execution markers keyed by absolute file path,
     *                    see {@link SpectraCollector} for the marker format
     * @return The spectra stored for the test
     * @throws MappingFormatException if the existing mapping file cannot be parsed
     * @throws IOException if the mapping cannot be written
     */
    public Spectra recordCoverage(String test, Map<String, ? extends List<Integer>> rawCoverage) throws IOException {
        requireTest(test);
        Spectra spectra = SpectraCollector.collect(projectRoot, rawCoverage);
        synchronized (writeLock) {
            CoverageMapping mapping = readMapping().with(test, spectra);
            writeMapping(mapping);
        }
        log.debug("Recorded {} lines in {} files for test {}", spectra.lineCount(), spectra.fileCount(), test);
        return spectra;
    }

    /**
     * Read the whole mapping. A missing mapping file reads as an empty mapping.
     *
     * @throws MappingFormatException if the file exists but does not hold a valid mapping
     */
    public CoverageMapping readMapping() throws IOException {
        if (!Files.exists(mappingPath)) {
            return CoverageMapping.empty();
        }
        CoverageMapping mapping;
        try {
            mapping = objectMapper.readValue(mappingPath.toFile(), CoverageMapping.class);
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse test-to-code mapping {}: {}", mappingPath, e.getOriginalMessage());
            throw new MappingFormatException(mappingPath, e);
        }
        if (mapping == null) {
            throw new MappingFormatException(mappingPath, "document is null");
        }
        return mapping;
    }

    /**
     * Get tests affected by a change of {@code file} at line {@code lineno}.
     *
     * @param file Root-relative path as stored in spectra, e.g. {@code /lib/foo.rb}
     * @param lineno 1-based line number
     * @return Tests that executed exactly that line; empty when nothing is recorded
     * @throws MappingFormatException if the mapping file cannot be parsed
     */
    public Set<String> getAffectedTests(String file, int lineno) throws IOException {
        Objects.requireNonNull(file, "file");
        if (lineno < 1) {
            throw new IllegalArgumentException("Line numbers start at 1: " + lineno);
        }
        Set<String> tests = readMapping().affectedTests(file, lineno);
        log.debug("{} tests affected by {}:{}", tests.size(), file, lineno);
        return tests;
    }

    /**
     * Save the commit the mapping was recorded against, overwriting any previous marker.
     *
     * @param commitId Opaque revision identifier
     */
    public void saveCommitMarker(String commitId) throws IOException {
        Objects.requireNonNull(commitId, "commitId");
        if (commitId.isBlank()) {
            throw new IllegalArgumentException("Commit id must not be blank");
        }
        synchronized (writeLock) {
            ensureDirectoryExists();
            Files.writeString(commitPath, commitId, StandardCharsets.UTF_8);
        }
        log.debug("Saved commit marker {}", commitId);
    }

    /**
     * Read the commit marker exactly as it was saved, if one has been saved.
     */
    public Optional<String> readCommitMarker() throws IOException {
        if (!Files.exists(commitPath)) {
            return Optional.empty();
        }
        String commitId = Files.readString(commitPath, StandardCharsets.UTF_8);
        return commitId.isEmpty() ? Optional.empty() : Optional.of(commitId);
    }

    /**
     * Save the current revision of the project as the commit marker.
     *
     * @return The saved revision, or empty if the VCS could not resolve one
     */
    public Optional<String> anchorCurrentCommit() throws IOException {
        Optional<String> revision = vcsProvider.getCurrentRevision(projectRoot);
        if (revision.isEmpty()) {
            log.warn("Could not resolve the current revision of {}", projectRoot);
            return Optional.empty();
        }
        saveCommitMarker(revision.get());
        return revision;
    }

    /**
     * Check whether a mapping has been recorded.
     */
    public boolean hasMapping() {
        return Files.exists(mappingPath);
    }

    private void writeMapping(CoverageMapping mapping) throws IOException {
        ensureDirectoryExists();
        byte[] json = objectMapper.writeValueAsBytes(mapping);
        Path tmp = Files.createTempFile(mappingPath.getParent(), MAPPING_FILE, ".tmp");
        try {
            Files.write(tmp, json);
            moveIntoPlace(tmp);
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }
    }

    private void moveIntoPlace(Path tmp) throws IOException {
        try {
            Files.move(tmp, mappingPath, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, mappingPath, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void ensureDirectoryExists() throws IOException {
        Path dir = mappingPath.getParent();
        if (!Files.isDirectory(dir)) {
            Files.createDirectories(dir);
            log.info("Created mapping directory: {}", dir);
        }
    }

    private static void requireTest(String test) {
        Objects.requireNonNull(test, "test");
        if (test.isBlank()) {
            throw new IllegalArgumentException("Test identifier must not be blank");
        }
    }

    /**
     * Create a store for the repository containing {@code workspacePath}.
     *
     * @throws IllegalStateException if the workspace is not inside a repository
     */
    public static MappingStore forRepository(Path workspacePath) {
        VcsProvider provider = VcsProviderFactory.detect(workspacePath)
            .orElseThrow(() -> new IllegalStateException("Not in a git repository: " + workspacePath));
        return forRepository(workspacePath, provider);
    }

    /**
     * Create a store for the repository root reported by {@code vcsProvider}.
     *
     * @throws IllegalStateException if the provider cannot resolve a repository root
     */
    public static MappingStore forRepository(Path workspacePath, VcsProvider vcsProvider) {
        Path root = vcsProvider.getRepositoryRoot(workspacePath)
            .orElseThrow(() -> new IllegalStateException("Not in a git repository: " + workspacePath));
        return new MappingStore(root, vcsProvider);
    }

    /**
     * Create a store for the workspace named by the {@value #WORKSPACE_PROPERTY} system property,
     * or the current directory when it is unset.
     */
    public static MappingStore fromSystemProperties() {
        String workspace = System.getProperty(WORKSPACE_PROPERTY, System.getProperty("user.dir"));
        return forRepository(Path.of(workspace));
    }
}
