package com.phodal.testmapping.store;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Thrown when the persisted test-to-code mapping cannot be parsed.
 * The file is left untouched; callers decide whether to discard it and record again.
 */
public class MappingFormatException extends IOException {

    private final Path mappingPath;

    public MappingFormatException(Path mappingPath, String message) {
        super("Malformed test-to-code mapping " + mappingPath + ": " + message);
        this.mappingPath = mappingPath;
    }

    public MappingFormatException(Path mappingPath, Throwable cause) {
        super("Malformed test-to-code mapping " + mappingPath + ": " + cause.getMessage(), cause);
        this.mappingPath = mappingPath;
    }

    public Path getMappingPath() {
        return mappingPath;
    }
}
