package com.sysdiagram.cli;

import com.sysdiagram.cli.CommandTestSupport.Result;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static com.sysdiagram.cli.CommandTestSupport.DRONE_MODEL;
import static com.sysdiagram.cli.CommandTestSupport.run;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ValidateCommand}.
 */
class ValidateCommandTest {

    @TempDir
    Path tempDir;

    @Test
    void validate_cleanModel_reportsElementCount() throws IOException {
        Path model = tempDir.resolve("drone.sysml");
        Files.writeString(model, DRONE_MODEL);

        Result result = run("validate", model.toString());

        assertThat(result.exitCode()).isZero();
        assertThat(result.out()).contains("✓ 4 elements, 0 unhandled lines");
    }

    @Test
    void validate_withUnhandledLines_listsThem() throws IOException {
        Path model = tempDir.resolve("drone.sysml");
        Files.writeString(model, "package A\n  flow x\n  flow y\n");

        Result result = run("validate", model.toString());

        assertThat(result.exitCode()).isZero();
        assertThat(result.err()).contains("Unhandled line:   flow x").contains("Unhandled line:   flow y");
        assertThat(result.out()).contains("1 elements, 2 unhandled lines");
    }

    @Test
    void validate_strictWithWarnings_fails() throws IOException {
        Path model = tempDir.resolve("drone.sysml");
        Files.writeString(model, "package A {\n}\n");

        assertThat(run("validate", model.toString(), "--strict").exitCode()).isEqualTo(1);
        assertThat(run("validate", model.toString(), "--strict", "-p", "EXPLICIT_BRACE").exitCode()).isZero();
    }

    @Test
    void validate_missingFile_fails() {
        Result result = run("validate", tempDir.resolve("none.sysml").toString());

        assertThat(result.exitCode()).isEqualTo(1);
        assertThat(result.err()).contains("Validation failed");
    }
}
