package com.hardware.cdc.cli.validation;

import com.hardware.cdc.cli.exception.OptionsValidationException;
import com.hardware.cdc.cli.model.AnalyzeOptions;
import com.hardware.cdc.cli.model.ValidatedAnalyzeOptions;
import com.hardware.cdc.report.ReportFormat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class AnalyzeOptionsValidatorTest {

    @TempDir
    Path tempDir;

    private final AnalyzeOptionsValidator validator = new AnalyzeOptionsValidator();

    @Test
    void testValidOptions() throws IOException {
        Path design = Files.writeString(tempDir.resolve("top.v"), "module top; endmodule\n");
        Path report = tempDir.resolve("report.json");

        ValidatedAnalyzeOptions validated = validator.validate(
                options("--format", "Json", "--output", report.toString(), design.toString()));

        assertThat(validated.getInputFiles()).containsExactly(design);
        assertThat(validated.getFormat()).isEqualTo(ReportFormat.JSON);
        assertThat(validated.getOutputFile()).isEqualTo(report);
    }

    @Test
    void testDefaults() {
        ValidatedAnalyzeOptions validated = validator.validate(options("design.v"));

        assertThat(validated.getFormat()).isEqualTo(ReportFormat.TEXT);
        assertThat(validated.getOutputFile()).isNull();
        assertThat(validated.getInputFiles()).containsExactly(Path.of("design.v"));
    }

    @Test
    void testAllErrorsReportedTogether() {
        assertThatThrownBy(() -> validator.validate(options("--format", "xml", "--output", tempDir.toString())))
                .isInstanceOf(OptionsValidationException.class)
                .satisfies(e -> assertThat(((OptionsValidationException) e).getErrors()).containsExactly(
                        "unsupported report format: xml",
                        "At least one input file or glob pattern is required.",
                        "Output path is a directory: " + tempDir));
    }

    @Test
    void testGlobWithoutMatches() {
        assertThatThrownBy(() -> validator.validate(options(tempDir + "/*.v")))
                .isInstanceOf(OptionsValidationException.class)
                .hasMessage("no input files matched the provided patterns");
    }

    private AnalyzeOptions options(String... args) {
        AnalyzeOptions options = new AnalyzeOptions();
        new CommandLine(options).parseArgs(args);
        return options;
    }
}
