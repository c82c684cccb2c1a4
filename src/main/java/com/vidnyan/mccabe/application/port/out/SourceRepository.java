package com.vidnyan.mccabe.application.port.out;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Predicate;

/**
 * Port for discovering and reading source files.
 */
public interface SourceRepository {

    /**
     * List source files under {@code root} (or {@code root} itself when it is a file), sorted by path.
     */
    List<Path> findSourceFiles(Path root, ScanOptions options, Predicate<Path> accepted) throws IOException;

    /**
     * Read a whole file, detecting its encoding.
     */
    String read(Path file) throws IOException;

    /**
     * Scan options.
     */
    record ScanOptions(
        boolean includeTests,
        List<String> excludePatterns
    ) {
        public static ScanOptions defaults() {
            return new ScanOptions(false, List.of());
        }
    }
}
