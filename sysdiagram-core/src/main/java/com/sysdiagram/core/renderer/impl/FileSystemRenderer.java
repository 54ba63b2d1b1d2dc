package com.sysdiagram.core.renderer.impl;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.sysdiagram.core.renderer.GeneratedFile;
import com.sysdiagram.core.renderer.GeneratedOutput;
import com.sysdiagram.core.renderer.OutputRenderer;
import com.sysdiagram.core.renderer.RenderContext;

/**
 * Writes generated diagrams and the model IR below an output directory.
 *
 * <p>Missing directories are created. Files are written as UTF-8. A relative path that would
 * land outside the output directory is rejected before anything is written for it.
 *
 * <p><b>Flags:</b>
 * <ul>
 *   <li>{@code filesystem.overwrite} - replace existing files ("true"/"false", default: "true").
 *       When false, existing files are left untouched and logged.</li>
 * </ul>
 *
 * <pre>{@code
 * new FileSystemRenderer().render(output, RenderContext.of("diagrams"));
 * // diagrams/drone.mmd, diagrams/drone.puml, diagrams/drone.dot, diagrams/drone.json
 * }</pre>
 */
public class FileSystemRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(FileSystemRenderer.class);

    public static final String SETTING_OVERWRITE = "filesystem.overwrite";

    @Override
    public String getId() {
        return "filesystem";
    }

    @Override
    public void render(GeneratedOutput output, RenderContext context) {
        Path base = context.outputPath().toAbsolutePath().normalize();
        boolean overwrite = context.isEnabled(SETTING_OVERWRITE, true);

        try {
            Files.createDirectories(base);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot create output directory " + base, e);
        }

        int skipped = 0;
        for (GeneratedFile file : output.files()) {
            Path target = resolveInside(base, file);
            if (!overwrite && Files.exists(target)) {
                logger.warn("Keeping existing {} (overwrite disabled)", target);
                skipped++;
                continue;
            }
            write(target, file);
        }

        logger.info("Wrote {} diagram files to {} ({} kept)", output.files().size() - skipped, base, skipped);
    }

    /**
     * Resolves a file below the output directory.
     *
     * @throws IllegalStateException if the path escapes the output directory
     */
    private static Path resolveInside(Path base, GeneratedFile file) {
        Path target = base.resolve(file.relativePath()).normalize();
        if (!target.startsWith(base)) {
            throw new IllegalStateException("File escapes output directory: " + file.relativePath());
        }
        return target;
    }

    private static void write(Path target, GeneratedFile file) {
        try {
            Files.createDirectories(target.getParent());
            Files.writeString(target, file.content(), StandardCharsets.UTF_8);
            logger.debug("{} -> {} ({} chars)", file.contentType(), target, file.content().length());
        } catch (IOException e) {
            throw new IllegalStateException("Cannot write " + file.relativePath(), e);
        }
    }
}
