package com.sysdiagram.cli;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.sysdiagram.core.config.ConfigLoader;
import com.sysdiagram.core.config.ProjectConfig;
import com.sysdiagram.core.generator.DiagramGenerator;
import com.sysdiagram.core.generator.GeneratedDiagram;
import com.sysdiagram.core.generator.GeneratorRegistry;
import com.sysdiagram.core.io.ModelJsonReader;
import com.sysdiagram.core.model.ModelNode;
import com.sysdiagram.core.renderer.GeneratedFile;
import com.sysdiagram.core.renderer.GeneratedOutput;
import com.sysdiagram.core.renderer.RenderContext;
import com.sysdiagram.core.renderer.impl.FileSystemRenderer;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/**
 * Command to render one diagram from a saved JSON model IR.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * sysdiagram generate -g plantuml -i diagrams/model.json -o diagrams
 * }</pre>
 */
@Command(
    name = "generate",
    description = "Render a diagram from a saved JSON model IR",
    mixinStandardHelpOptions = true
)
public class GenerateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

    @Spec
    private CommandSpec spec;

    @Option(names = {"-g", "--generator"}, description = "Generator ID", required = true)
    private String generatorId;

    @Option(names = {"-i", "--input"}, description = "Input model IR file", required = true)
    private Path inputModel;

    @Option(names = {"-o", "--output"}, description = "Output directory (default: ${DEFAULT-VALUE})")
    private Path outputDir = Paths.get(".");

    @Option(names = {"-c", "--config"}, description = "Configuration file for generator settings (default: ${DEFAULT-VALUE})")
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        try {
            log.info("Generate command - generator: {}, model: {}", generatorId, inputModel);
            DiagramGenerator generator = GeneratorRegistry.load().require(generatorId);
            ProjectConfig config = ConfigLoader.load(configPath);

            ModelNode root = new ModelJsonReader().read(inputModel);
            GeneratedDiagram diagram = generator.generate(root, config.generatorConfig());

            GeneratedFile file = GeneratedFile.of(ConvertCommand.baseNameOf(inputModel), diagram);
            new FileSystemRenderer().render(
                new GeneratedOutput(List.of(file)),
                new RenderContext(outputDir.toString(), Map.of()));

            out.println("✓ Wrote " + outputDir.resolve(file.relativePath()));
            return 0;
        } catch (Exception e) {
            log.error("Generation failed", e);
            err.println("✗ Generation failed: " + e.getMessage());
            return 1;
        }
    }
}
