package com.sysdiagram.core.io;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads model sources from the filesystem.
 */
public final class ModelSourceLoader {

    private static final Logger log = LoggerFactory.getLogger(ModelSourceLoader.class);

    private ModelSourceLoader() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Reads all lines of a UTF-8 model source.
     *
     * @param source path to the model file
     * @return lines without terminators
     * @throws ModelIoException if the file is missing or unreadable
     */
    public static List<String> readLines(Path source) {
        Objects.requireNonNull(source, "source must not be null");

        if (!Files.isRegularFile(source)) {
            throw new ModelIoException("Model source not found: " + source);
        }

        try {
            List<String> lines = Files.readAllLines(source, StandardCharsets.UTF_8);
            log.debug("Read {} lines from {}", lines.size(), source);
            return lines;
        } catch (IOException e) {
            throw new ModelIoException("Failed to read model source: " + source, e);
        }
    }
}
