package com.hardware.cdc.parser;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.hardware.cdc.ast.ModuleDefNode;
import com.hardware.cdc.ast.SourceNode;
import com.hardware.cdc.core.context.ToolDiagnostics;
import com.hardware.cdc.parser.exception.DesignLoadException;

/**
 * Reads and parses design files into one source tree.
 *
 * Loading is all-or-nothing: missing files are reported before anything is
 * parsed, and any syntax error fails the whole load.
 */
public class DesignSourceLoader {
    private static final Logger log = LoggerFactory.getLogger(DesignSourceLoader.class);

    public SourceNode load(List<Path> files, ToolDiagnostics diagnostics) throws IOException {
        Objects.requireNonNull(diagnostics, "diagnostics");
        if (files == null || files.isEmpty()) {
            throw new IllegalArgumentException("no input files were provided");
        }

        List<String> missing = files.stream()
                .filter(path -> !Files.isRegularFile(path))
                .map(Path::toString)
                .toList();
        if (!missing.isEmpty()) {
            throw new DesignLoadException(
                    "the following design files are missing: " + String.join(", ", missing), List.of());
        }

        List<ModuleDefNode> modules = new ArrayList<>();
        for (Path path : files) {
            modules.addAll(parseFile(path, diagnostics));
        }

        if (diagnostics.hasErrors()) {
            throw new DesignLoadException("failed to parse design files", diagnostics.getErrors());
        }

        log.info("Loaded {} modules from {} files", modules.size(), files.size());
        return new SourceNode(modules);
    }

    /**
     * Parses a single file. Syntax errors are added to the diagnostics.
     */
    public List<ModuleDefNode> parseFile(Path path, ToolDiagnostics diagnostics) throws IOException {
        String fileName = path.toString();
        String content = Files.readString(path);

        log.info("Parsing design file: {}", fileName);

        VerilogTokenizer tokenizer = new VerilogTokenizer(content, fileName);
        List<VerilogToken> tokens = tokenizer.tokenize();

        VerilogParser parser = new VerilogParser(tokens, fileName);
        List<ModuleDefNode> modules = parser.parse(diagnostics);

        log.debug("Parsed {} modules from {}", modules.size(), fileName);
        return modules;
    }
}
