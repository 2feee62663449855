package com.hardware.cdc.cli.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.hardware.cdc.cli.InputPatternExpander;
import com.hardware.cdc.cli.exception.OptionsValidationException;
import com.hardware.cdc.cli.model.AnalyzeOptions;
import com.hardware.cdc.cli.model.ValidatedAnalyzeOptions;
import com.hardware.cdc.report.ReportFormat;

public class AnalyzeOptionsValidator {

	private final InputPatternExpander expander;

	public AnalyzeOptionsValidator() {
		this(new InputPatternExpander());
	}

	public AnalyzeOptionsValidator(InputPatternExpander expander) {
		this.expander = expander;
	}

	public ValidatedAnalyzeOptions validate(AnalyzeOptions o) {
		List<String> errors = new ArrayList<>();

		ReportFormat format = ReportFormat.fromId(o.getFormat()).orElse(null);
		if (format == null) {
			errors.add("unsupported report format: " + o.getFormat());
		}

		List<Path> inputFiles = List.of();
		if (o.getInputs() == null || o.getInputs().isEmpty()) {
			errors.add("At least one input file or glob pattern is required.");
		} else {
			try {
				inputFiles = expander.expand(o.getInputs());
				if (inputFiles.isEmpty()) {
					errors.add("no input files matched the provided patterns");
				}
			} catch (IOException e) {
				errors.add("Failed to expand input patterns: " + e.getMessage());
			}
		}

		if (o.getOutput() != null && Files.isDirectory(o.getOutput())) {
			errors.add("Output path is a directory: " + o.getOutput());
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		return new ValidatedAnalyzeOptions(inputFiles, format, o.getOutput());
	}
}
