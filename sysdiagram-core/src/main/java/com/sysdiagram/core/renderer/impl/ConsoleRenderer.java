package com.sysdiagram.core.renderer.impl;

import java.io.PrintStream;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.sysdiagram.core.renderer.GeneratedFile;
import com.sysdiagram.core.renderer.GeneratedOutput;
import com.sysdiagram.core.renderer.OutputRenderer;
import com.sysdiagram.core.renderer.RenderContext;

/**
 * Renderer that prints generated diagrams to a console stream.
 *
 * <p><b>Configuration Settings:</b>
 * <ul>
 *   <li>{@code console.showHeaders} - print a {@code File i/n: path} header before each
 *       file ("true"/"false", default: "true")</li>
 *   <li>{@code console.separator} - separator printed between files (default: "---")</li>
 * </ul>
 *
 * <p>With headers disabled and a single file, the output is exactly the diagram source,
 * suitable for piping into a layout tool.
 */
public class ConsoleRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(ConsoleRenderer.class);

    public static final String SETTING_SHOW_HEADERS = "console.showHeaders";
    public static final String SETTING_SEPARATOR = "console.separator";

    private static final String DEFAULT_SEPARATOR = "---";

    private final PrintStream out;

    /**
     * Creates a renderer printing to {@link System#out}.
     */
    public ConsoleRenderer() {
        this(System.out);
    }

    /**
     * Creates a renderer printing to the given stream.
     *
     * @param out target stream
     */
    public ConsoleRenderer(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out must not be null");
    }

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public void render(GeneratedOutput output, RenderContext context) {
        boolean showHeaders = context.isEnabled(SETTING_SHOW_HEADERS, true);
        String separator = context.getSettingOrDefault(SETTING_SEPARATOR, DEFAULT_SEPARATOR);

        logger.debug("Rendering {} files to console (headers: {})", output.files().size(), showHeaders);

        int total = output.files().size();
        for (int i = 0; i < total; i++) {
            GeneratedFile file = output.files().get(i);
            if (showHeaders) {
                out.println("File " + (i + 1) + "/" + total + ": " + file.relativePath());
                out.println();
            }
            out.println(file.content());
            if (i < total - 1) {
                out.println(separator);
            }
        }
        out.flush();
    }
}
