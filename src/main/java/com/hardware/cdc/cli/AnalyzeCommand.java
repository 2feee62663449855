package com.hardware.cdc.cli;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.Arrays;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.hardware.cdc.analysis.AnalysisRule;
import com.hardware.cdc.cli.exception.OptionsValidationException;
import com.hardware.cdc.cli.model.AnalyzeOptions;
import com.hardware.cdc.cli.model.ValidatedAnalyzeOptions;
import com.hardware.cdc.cli.output.AnalysisResultsPrinter;
import com.hardware.cdc.cli.validation.AnalyzeOptionsValidator;
import com.hardware.cdc.core.AnalysisResult;
import com.hardware.cdc.core.AnalysisRunner;
import com.hardware.cdc.core.context.AnalyzerConfig;
import com.hardware.cdc.parser.exception.DesignLoadException;
import com.hardware.cdc.report.exception.ReportRenderingException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * CLI command that analyzes Verilog designs for clock domain crossings.
 *
 * Exit codes: 0 no violations, 1 violations found, 2 usage error or
 * analysis failure.
 */
@Command(
        name = "cdc-analyzer",
        mixinStandardHelpOptions = true,
        version = "cdc-analyzer 1.0.0",
        description = "Finds signals crossing clock domains without a synchronizer in Verilog designs."
)
public class AnalyzeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AnalyzeCommand.class);

    public static final int EXIT_CLEAN = 0;
    public static final int EXIT_VIOLATIONS = 1;
    public static final int EXIT_FAILURE = 2;

    @Spec
    private CommandSpec spec;

    @Mixin
    private AnalyzeOptions options = new AnalyzeOptions();

    private final AnalyzeOptionsValidator validator;
    private final AnalysisRunner runner;
    private final AnalysisResultsPrinter printer = new AnalysisResultsPrinter();

    public AnalyzeCommand() {
        this(new AnalyzeOptionsValidator(), new AnalysisRunner());
    }

    public AnalyzeCommand(AnalyzeOptionsValidator validator, AnalysisRunner runner) {
        this.validator = validator;
        this.runner = runner;
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();

        if (options.isListRules()) {
            Arrays.stream(AnalysisRule.values())
                    .map(AnalysisRule::getId)
                    .sorted()
                    .forEach(out::println);
            out.flush();
            return EXIT_CLEAN;
        }

        ValidatedAnalyzeOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(error -> log.error(error));
            spec.commandLine().usage(spec.commandLine().getErr());
            return EXIT_FAILURE;
        }

        AnalyzerConfig config = AnalyzerConfig.builder()
                .inputFiles(validated.getInputFiles())
                .format(validated.getFormat())
                .outputFile(validated.getOutputFile())
                .disabledRules(options.getDisabledRules())
                .build();
        printer.printBanner(config);

        try {
            AnalysisResult result = runner.run(config);
            if (config.getOutputFile() == null) {
                out.println(result.getRenderedReport());
                out.flush();
            }
            printer.printSummary(result);
            return result.getReport().hasViolations() ? EXIT_VIOLATIONS : EXIT_CLEAN;

        } catch (DesignLoadException e) {
            printer.printFailure(e.getSummary(), e.getProblems());
            return EXIT_FAILURE;
        } catch (IOException e) {
            log.error("Analysis failed with I/O error", e);
            return EXIT_FAILURE;
        } catch (ReportRenderingException | IllegalArgumentException e) {
            log.error("Analysis failed: {}", e.getMessage(), e);
            return EXIT_FAILURE;
        }
    }
}
