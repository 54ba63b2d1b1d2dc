package com.sysdiagram.cli;

import java.io.PrintWriter;
import java.util.ServiceLoader;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.sysdiagram.core.generator.DiagramGenerator;
import com.sysdiagram.core.generator.GeneratorRegistry;
import com.sysdiagram.core.renderer.OutputRenderer;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/**
 * Command to list available generators or renderers.
 *
 * <p>Discovers plugins via Java Service Provider Interface (SPI).
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * sysdiagram list
 * sysdiagram list renderers
 * }</pre>
 */
@Command(
    name = "list",
    description = "List available generators or renderers",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(
        index = "0",
        description = "Type to list: generators or renderers (default: ${DEFAULT-VALUE})",
        defaultValue = "generators"
    )
    private String type;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        return switch (type.toLowerCase()) {
            case "generators", "generator" -> listGenerators(out);
            case "renderers", "renderer" -> listRenderers(out);
            default -> {
                log.error("Unknown type: {}. Use: generators or renderers", type);
                spec.commandLine().getErr().println("Unknown type: " + type + ". Use: generators or renderers");
                yield 1;
            }
        };
    }

    private int listGenerators(PrintWriter out) {
        out.println("Available Generators:");
        out.println();

        for (DiagramGenerator generator : GeneratorRegistry.load().all()) {
            out.printf("  • %s (ID: %s)%n", generator.getDisplayName(), generator.getId());
            out.printf("    Diagram Type: %s%n", generator.getDiagramType());
            out.printf("    File Extension: .%s%n", generator.getFileExtension());
            out.println();
        }
        return 0;
    }

    private int listRenderers(PrintWriter out) {
        out.println("Available Renderers:");
        out.println();

        for (OutputRenderer renderer : ServiceLoader.load(OutputRenderer.class)) {
            out.printf("  • %s%n", renderer.getId());
        }
        return 0;
    }
}
