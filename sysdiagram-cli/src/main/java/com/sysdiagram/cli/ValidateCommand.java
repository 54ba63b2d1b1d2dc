package com.sysdiagram.cli;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.sysdiagram.core.io.ModelSourceLoader;
import com.sysdiagram.core.model.ParsedModel;
import com.sysdiagram.core.parser.ModelParser;
import com.sysdiagram.core.parser.ScopePolicy;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/**
 * Command to parse a model source and report unhandled lines.
 *
 * <p>Exit code is 0 unless the source cannot be read, or {@code --strict} is given and at
 * least one line was unhandled.
 */
@Command(
    name = "validate",
    description = "Parse a model source and report unhandled lines",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Model source file")
    private Path input;

    @Option(names = {"-p", "--policy"}, description = "Scope policy: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    private ScopePolicy policy = ScopePolicy.INDENTATION;

    @Option(names = {"--strict"}, description = "Fail when any line is unhandled")
    private boolean strict;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        try {
            log.info("Validating model: {}", input);
            ParsedModel parsed = new ModelParser(policy).parse(ModelSourceLoader.readLines(input));
            WarningPrinter.print(err, parsed.warnings());

            out.println((parsed.hasWarnings() ? "⚠ " : "✓ ") + parsed.root().descendantCount()
                + " elements, " + parsed.warnings().size() + " unhandled lines");
            return strict && parsed.hasWarnings() ? 1 : 0;
        } catch (Exception e) {
            log.error("Validation failed", e);
            err.println("✗ Validation failed: " + e.getMessage());
            return 1;
        }
    }
}
