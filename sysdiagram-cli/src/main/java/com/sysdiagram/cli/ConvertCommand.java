package com.sysdiagram.cli;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.sysdiagram.core.config.ConfigLoader;
import com.sysdiagram.core.config.ProjectConfig;
import com.sysdiagram.core.generator.DiagramGenerator;
import com.sysdiagram.core.generator.GeneratedDiagram;
import com.sysdiagram.core.generator.GeneratorConfig;
import com.sysdiagram.core.generator.GeneratorRegistry;
import com.sysdiagram.core.io.ModelJsonWriter;
import com.sysdiagram.core.io.ModelSourceLoader;
import com.sysdiagram.core.model.ParsedModel;
import com.sysdiagram.core.parser.ModelParser;
import com.sysdiagram.core.parser.ScopePolicy;
import com.sysdiagram.core.renderer.GeneratedFile;
import com.sysdiagram.core.renderer.GeneratedOutput;
import com.sysdiagram.core.renderer.OutputRenderer;
import com.sysdiagram.core.renderer.RenderContext;
import com.sysdiagram.core.renderer.impl.ConsoleRenderer;
import com.sysdiagram.core.renderer.impl.FileSystemRenderer;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/**
 * Command to convert a model source into diagrams.
 *
 * <p>Runs the full pipeline:
 * <ol>
 *   <li>Load configuration ({@code sysdiagram.yaml}, command-line overrides win)</li>
 *   <li>Read and parse the model source, reporting unhandled lines</li>
 *   <li>Run every enabled generator on the parsed tree</li>
 *   <li>Write the diagrams, and the JSON model IR, to the output directory or console</li>
 * </ol>
 *
 * <p>Output files are named after the model source: {@code model.sysml} produces
 * {@code model.mmd}, {@code model.puml}, {@code model.dot} and {@code model.json}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * sysdiagram convert model.sysml
 * sysdiagram convert model.sysml -o diagrams -g mermaid -g graphviz
 * sysdiagram convert model.sysml --policy explicit_brace --stdout
 * }</pre>
 */
@Command(
    name = "convert",
    description = "Parse a model and write diagrams for all enabled generators",
    mixinStandardHelpOptions = true
)
public class ConvertCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ConvertCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Model source file")
    private Path input;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: ${DEFAULT-VALUE})")
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Option(names = {"-o", "--output"}, description = "Output directory (overrides config)")
    private Path outputDir;

    @Option(names = {"-g", "--generator"}, description = "Generator ID to run, repeatable (overrides config)")
    private List<String> generatorIds;

    @Option(names = {"-p", "--policy"}, description = "Scope policy: ${COMPLETION-CANDIDATES} (overrides config)")
    private ScopePolicy policy;

    @Option(names = {"-n", "--name"}, description = "Base name of output files (default: input file name)")
    private String baseName;

    @Option(names = {"--no-model"}, description = "Do not write the JSON model IR")
    private boolean noModel;

    @Option(names = {"--stdout"}, description = "Print diagrams to the console instead of writing files")
    private boolean stdout;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        try {
            ProjectConfig config = ConfigLoader.load(configPath);
            ScopePolicy effectivePolicy = policy != null ? policy : config.scopePolicy();

            log.info("Converting {} (policy {})", input, effectivePolicy);
            ParsedModel parsed = new ModelParser(effectivePolicy).parse(ModelSourceLoader.readLines(input));
            WarningPrinter.print(err, parsed.warnings());

            List<DiagramGenerator> generators = selectGenerators(config);
            String name = baseName != null ? baseName : baseNameOf(input);

            List<GeneratedFile> files = new ArrayList<>();
            GeneratorConfig generatorConfig = config.generatorConfig();
            for (DiagramGenerator generator : generators) {
                GeneratedDiagram diagram = generator.generate(parsed.root(), generatorConfig);
                files.add(GeneratedFile.of(name, diagram));
            }

            if (stdout) {
                render(new ConsoleRenderer(System.out), new GeneratedOutput(files), ".");
                return 0;
            }

            if (config.writeModel() && !noModel) {
                files.add(new GeneratedFile(name + ".json", new ModelJsonWriter().write(parsed.root()), "model"));
            }

            String directory = outputDir != null ? outputDir.toString() : config.outputDirectory();
            render(new FileSystemRenderer(), new GeneratedOutput(files), directory);

            out.println("✓ Parsed " + parsed.root().descendantCount() + " elements ("
                + parsed.warnings().size() + " warnings)");
            for (GeneratedFile file : files) {
                out.println("✓ Wrote " + Paths.get(directory).resolve(file.relativePath()));
            }
            return 0;

        } catch (Exception e) {
            log.error("Conversion failed", e);
            err.println("✗ Conversion failed: " + e.getMessage());
            return 1;
        }
    }

    /**
     * Resolves the generators to run: explicit {@code -g} IDs, or every generator the
     * configuration enables.
     *
     * @param config project configuration
     * @return generators in execution order
     * @throws IllegalArgumentException if an explicit ID is unknown or nothing is enabled
     */
    private List<DiagramGenerator> selectGenerators(ProjectConfig config) {
        GeneratorRegistry registry = GeneratorRegistry.load();

        if (generatorIds != null && !generatorIds.isEmpty()) {
            return generatorIds.stream().map(registry::require).toList();
        }

        List<DiagramGenerator> enabled = registry.all().stream()
            .filter(g -> config.isGeneratorEnabled(g.getId()))
            .toList();
        if (enabled.isEmpty()) {
            throw new IllegalArgumentException("No generators enabled. Available: " + registry.ids());
        }
        log.debug("Enabled generators: {}", enabled.stream().map(DiagramGenerator::getId).toList());
        return enabled;
    }

    private void render(OutputRenderer renderer, GeneratedOutput output, String directory) {
        Map<String, String> settings = stdout
            ? Map.of(ConsoleRenderer.SETTING_SHOW_HEADERS, String.valueOf(output.files().size() > 1))
            : Map.of();
        renderer.render(output, new RenderContext(directory, settings));
    }

    /**
     * Returns the file name of a path without its last extension.
     *
     * @param path file path
     * @return base name
     */
    static String baseNameOf(Path path) {
        String fileName = path.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
