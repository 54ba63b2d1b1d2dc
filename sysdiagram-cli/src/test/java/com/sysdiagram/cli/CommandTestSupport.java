package com.sysdiagram.cli;

import com.sysdiagram.SysDiagramCLI;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;

/**
 * Runs the CLI with captured output streams.
 */
final class CommandTestSupport {

    static final String DRONE_MODEL = """
        package DroneFunctions
          part Sense as S : LogicalFunction
            description = "Detect obstacles"
        package DroneLogicalArchitecture
          part Lidar : LogicalComponent
        """;

    private CommandTestSupport() {
    }

    static Result run(String... args) {
        StringWriter out = new StringWriter();
        StringWriter err = new StringWriter();
        CommandLine cmd = SysDiagramCLI.commandLine();
        cmd.setOut(new PrintWriter(out, true));
        cmd.setErr(new PrintWriter(err, true));
        int exitCode = cmd.execute(args);
        return new Result(exitCode, out.toString(), err.toString());
    }

    record Result(int exitCode, String out, String err) {}
}
