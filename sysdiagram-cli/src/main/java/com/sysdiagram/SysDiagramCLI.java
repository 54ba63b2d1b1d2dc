package com.sysdiagram;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.sysdiagram.cli.ConvertCommand;
import com.sysdiagram.cli.GenerateCommand;
import com.sysdiagram.cli.ListCommand;
import com.sysdiagram.cli.ValidateCommand;

import ch.qos.logback.classic.Level;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParseResult;
import picocli.CommandLine.Spec;

/**
 * Main CLI entry point for SysDiagram.
 *
 * <p>SysDiagram reads an indentation-based system model (packages, typed parts, actors,
 * descriptions) and produces Mermaid, PlantUML and Graphviz diagrams of its containment
 * structure.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code convert} - Parse a model and write all enabled diagrams plus the JSON IR</li>
 *   <li>{@code generate} - Render one diagram from a saved JSON IR</li>
 *   <li>{@code validate} - Parse a model and report unhandled lines</li>
 *   <li>{@code list} - List available generators or renderers</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Convert a model with all generators
 * sysdiagram convert model.sysml -o diagrams
 *
 * # Only PlantUML, verbose
 * sysdiagram -v convert model.sysml -g plantuml
 *
 * # Re-render a saved IR
 * sysdiagram generate -g graphviz -i diagrams/model.json
 * }</pre>
 */
@Command(
    name = "sysdiagram",
    mixinStandardHelpOptions = true,
    version = "SysDiagram 1.0.0-SNAPSHOT",
    description = "Render indentation-based system models as Mermaid, PlantUML and Graphviz diagrams",
    subcommands = {
        ConvertCommand.class,
        GenerateCommand.class,
        ValidateCommand.class,
        ListCommand.class
    }
)
public class SysDiagramCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(SysDiagramCLI.class);

    @Spec
    private CommandSpec spec;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        spec.commandLine().getOut().println("SysDiagram - System model to diagram converter");
        spec.commandLine().getOut().println();
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    /**
     * Applies the global logging options before the selected subcommand runs.
     *
     * @param parseResult parsed command line
     * @return exit code of the executed command
     */
    private int executionStrategy(ParseResult parseResult) {
        configureLogging();
        return new CommandLine.RunLast().execute(parseResult);
    }

    /**
     * Configures logging level based on global options.
     */
    private void configureLogging() {
        if (!(LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME) instanceof ch.qos.logback.classic.Logger root)) {
            log.debug("Logback not bound, leaving log levels unchanged");
            return;
        }

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
    }

    /**
     * Returns whether verbose mode is enabled.
     *
     * @return true if verbose mode is enabled
     */
    public boolean isVerbose() {
        return verbose;
    }

    /**
     * Returns whether quiet mode is enabled.
     *
     * @return true if quiet mode is enabled
     */
    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the configured command line, shared by {@link #main} and tests.
     *
     * @return command line ready to execute
     */
    public static CommandLine commandLine() {
        SysDiagramCLI cli = new SysDiagramCLI();
        return new CommandLine(cli)
            .setCaseInsensitiveEnumValuesAllowed(true)
            .setExecutionStrategy(cli::executionStrategy);
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
