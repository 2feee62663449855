package com.hardware.cdc;

import com.hardware.cdc.cli.AnalyzeCommand;

import picocli.CommandLine;

/**
 * Main entry point for the CDC analyzer.
 * Parses Verilog designs, infers clock domains and reports signals that
 * cross between domains without a synchronizer.
 */
public class CdcAnalyzerApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new AnalyzeCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
