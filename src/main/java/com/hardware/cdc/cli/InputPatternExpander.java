package com.hardware.cdc.cli;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Expands input arguments into design files.
 *
 * Arguments without glob characters are taken as-is, whether or not the
 * file exists. Glob matches are sorted per pattern; a file matched by more
 * than one argument is kept once, at its first position. {@code **}
 * also matches zero directories, so {@code src/**}{@code /*.v} includes
 * {@code src/top.v}.
 */
public class InputPatternExpander {
    private static final Logger log = LoggerFactory.getLogger(InputPatternExpander.class);

    private static final String GLOB_CHARS = "*?[{";

    public List<Path> expand(List<String> patterns) throws IOException {
        Set<Path> files = new LinkedHashSet<>();
        for (String pattern : patterns) {
            List<Path> matches = expandPattern(pattern);
            if (matches.isEmpty()) {
                log.warn("No files matched '{}'", pattern);
            }
            files.addAll(matches);
        }
        return new ArrayList<>(files);
    }

    private List<Path> expandPattern(String pattern) throws IOException {
        if (!isGlob(pattern)) {
            return List.of(Path.of(pattern));
        }

        String[] segments = pattern.split("/", -1);
        StringBuilder base = new StringBuilder();
        int i = 0;
        while (i < segments.length - 1 && !isGlob(segments[i])) {
            base.append(segments[i]).append('/');
            i++;
        }
        boolean implicitRoot = base.length() == 0;
        Path root = implicitRoot ? Path.of(".") : Path.of(base.toString());
        if (!Files.isDirectory(root)) {
            return List.of();
        }

        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + pattern);
        PathMatcher flatMatcher = pattern.contains("**/")
                ? FileSystems.getDefault().getPathMatcher("glob:" + pattern.replace("**/", ""))
                : null;

        try (Stream<Path> walk = Files.walk(root)) {
            return walk.filter(Files::isRegularFile)
                    .map(path -> implicitRoot ? path.normalize() : path)
                    .filter(path -> matcher.matches(path) || (flatMatcher != null && flatMatcher.matches(path)))
                    .sorted()
                    .toList();
        }
    }

    private boolean isGlob(String text) {
        return text.chars().anyMatch(c -> GLOB_CHARS.indexOf(c) >= 0);
    }
}
