package com.hardware.cdc.cli.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Holds all CLI options for the analyzer. No validation, no execution
 * logic, no printing.
 */
@Getter
public class AnalyzeOptions {

	@Parameters(arity = "0..*", paramLabel = "INPUT", description = "Verilog files or glob patterns ('**' matches any number of directories)")
	private List<String> inputs = new ArrayList<>();

	@Option(names = { "--format", "-f" }, defaultValue = "text", description = "Report format: text or json (default: ${DEFAULT-VALUE})")
	private String format;

	@Option(names = { "--output", "-o" }, description = "Write the report to this file instead of standard output")
	private Path output;

	@Option(names = { "--disable-rule" }, paramLabel = "RULE", description = "Suppress violations of a rule; may be repeated")
	private List<String> disabledRules = new ArrayList<>();

	@Option(names = { "--list-rules" }, description = "List the available analysis rules and exit")
	private boolean listRules;
}
