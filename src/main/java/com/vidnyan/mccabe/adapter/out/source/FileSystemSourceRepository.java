package com.vidnyan.mccabe.adapter.out.source;

import com.vidnyan.mccabe.application.port.out.SourceRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * File system based source repository.
 * Walks a directory for source files and reads them as UTF-8, falling back to ISO-8859-1.
 */
@Slf4j
@Component
public class FileSystemSourceRepository implements SourceRepository {

    @Override
    public List<Path> findSourceFiles(Path root, ScanOptions options, Predicate<Path> accepted) throws IOException {
        if (Files.isRegularFile(root)) {
            return accepted.test(root) ? List.of(root) : List.of();
        }
        try (Stream<Path> paths = Files.walk(root)) {
            return paths
                    .filter(Files::isRegularFile)
                    .filter(accepted)
                    .filter(p -> options.includeTests() || !isTestFile(root, p))
                    .filter(p -> !matchesExcludePattern(p, options.excludePatterns()))
                    .sorted()
                    .toList();
        }
    }

    @Override
    public String read(Path file) throws IOException {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (CharacterCodingException e) {
            log.debug("{} is not valid UTF-8, reading as ISO-8859-1", file);
            return Files.readString(file, StandardCharsets.ISO_8859_1);
        }
    }

    /**
     * Only the part of the path below the scan root is considered, so a checkout
     * living under a directory named "test" is still scanned.
     */
    boolean isTestFile(Path root, Path path) {
        Path relative = root.relativize(path);
        for (Path segment : relative) {
            if (segment.toString().equals("test")) {
                return true;
            }
        }
        String fileName = relative.getFileName().toString();
        return fileName.endsWith("Test.java") || fileName.endsWith("Tests.java");
    }

    private boolean matchesExcludePattern(Path path, List<String> patterns) {
        if (patterns == null || patterns.isEmpty()) {
            return false;
        }
        String pathStr = path.toString();
        return patterns.stream().anyMatch(pathStr::contains);
    }
}
