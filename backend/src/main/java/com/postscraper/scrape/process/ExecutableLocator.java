package com.postscraper.scrape.process;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

public class ExecutableLocator {
    private final String pathVariable;
    private final boolean windows;

    public ExecutableLocator() {
        this(System.getenv("PATH"), System.getProperty("os.name", "").toLowerCase(Locale.ROOT).contains("win"));
    }

    public ExecutableLocator(String pathVariable, boolean windows) {
        this.pathVariable = pathVariable == null ? "" : pathVariable;
        this.windows = windows;
    }

    public Optional<Path> locate(String executable) {
        if (executable == null || executable.isBlank()) {
            return Optional.empty();
        }
        String name = executable.trim();
        if (name.contains("/") || name.contains(File.separator)) {
            Path direct = Paths.get(name);
            return isExecutableFile(direct) ? Optional.of(direct.toAbsolutePath()) : Optional.empty();
        }
        for (String dir : pathVariable.split(File.pathSeparator)) {
            if (dir.isBlank()) {
                continue;
            }
            for (String candidate : candidateNames(name)) {
                Path path = Paths.get(dir, candidate);
                if (isExecutableFile(path)) {
                    return Optional.of(path);
                }
            }
        }
        return Optional.empty();
    }

    private List<String> candidateNames(String name) {
        List<String> names = new ArrayList<>();
        names.add(name);
        if (windows) {
            names.add(name + ".cmd");
            names.add(name + ".exe");
            names.add(name + ".bat");
        }
        return names;
    }

    private boolean isExecutableFile(Path path) {
        return Files.isRegularFile(path) && Files.isExecutable(path);
    }
}
