package com.vidnyan.mccabe.application.service;

import com.vidnyan.mccabe.AnalysisProperties;
import com.vidnyan.mccabe.adapter.out.parser.JavaSyntaxTreeAdapter;
import com.vidnyan.mccabe.adapter.out.source.FileSystemSourceRepository;
import com.vidnyan.mccabe.application.port.in.AnalyzeComplexityUseCase.AnalysisRequest;
import com.vidnyan.mccabe.application.port.in.AnalyzeComplexityUseCase.AnalysisResult;
import com.vidnyan.mccabe.application.port.in.AnalyzeComplexityUseCase.FileReport;
import com.vidnyan.mccabe.application.port.in.AnalyzeComplexityUseCase.FileStatus;
import com.vidnyan.mccabe.domain.complexity.ComplexityViolation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ComplexityAnalysisServiceTest {

    private static final String SIMPLE = """
            package com.example;

            class Simple {
                int twice(int n) {
                    return n * 2;
                }
            }
            """;

    private static final String BRANCHY = """
            package com.example;

            class Branchy {
                String classify(int n) {
                    if (n < 0) {
                        return "negative";
                    } else if (n == 0) {
                        return "zero";
                    } else if (n < 10) {
                        return "small";
                    }
                    for (int i = 0; i < n; i++) {
                        log(i);
                    }
                    return "large";
                }
            }
            """;

    @TempDir
    Path tempDir;

    private ComplexityAnalysisService service;

    @BeforeEach
    void setUp() {
        AnalysisProperties properties = new AnalysisProperties();
        properties.setParallelism(2);
        service = new ComplexityAnalysisService(new JavaSyntaxTreeAdapter(), new FileSystemSourceRepository(), properties);
    }

    @Test
    void analyzeSource_ReportsViolationsAboveThreshold() {
        // Act
        FileReport report = service.analyzeSource("Branchy.java", BRANCHY, 3);

        // Assert
        assertTrue(report.isAnalyzed());
        assertEquals(1, report.scores().size());
        assertEquals(5, report.scores().get(0).complexity());

        ComplexityViolation violation = report.violations().get(0);
        assertEquals("Branchy, classify", violation.entity());
        assertEquals(4, violation.line());
        assertEquals("Branchy, classify is too complex (5)", violation.message());
    }

    @Test
    void analyzeSource_NegativeThresholdScoresButNeverReports() {
        // Act
        FileReport report = service.analyzeSource("Branchy.java", BRANCHY, -1);

        // Assert
        assertEquals(1, report.scores().size());
        assertTrue(report.violations().isEmpty());
    }

    @Test
    void analyzeSource_SyntaxErrorIsSeparateStatus() {
        // Act
        FileReport report = service.analyzeSource("Broken.java", "class Broken { void m( }", 0);

        // Assert
        assertEquals(FileStatus.SYNTAX_ERROR, report.status());
        assertTrue(report.violations().isEmpty());
        assertFalse(report.problems().isEmpty());
    }

    @Test
    void analyze_Directory() throws IOException {
        // Arrange
        Path pkg = tempDir.resolve("src/main/java/com/example");
        Files.createDirectories(pkg);
        Files.writeString(pkg.resolve("Simple.java"), SIMPLE);
        Files.writeString(pkg.resolve("Branchy.java"), BRANCHY);
        Files.writeString(pkg.resolve("Broken.java"), "class Broken {");
        Files.writeString(pkg.resolve("notes.txt"), "not java");

        Path testPkg = tempDir.resolve("src/test/java/com/example");
        Files.createDirectories(testPkg);
        Files.writeString(testPkg.resolve("BranchyTest.java"), BRANCHY.replace("Branchy", "BranchyTest"));

        // Act
        AnalysisResult result = service.analyze(AnalysisRequest.forPath(tempDir, 3));

        // Assert
        List<String> names = result.files().stream()
                .map(f -> Path.of(f.fileName()).getFileName().toString())
                .toList();
        assertEquals(List.of("Branchy.java", "Broken.java", "Simple.java"), names);
        assertEquals(2, result.stats().filesAnalyzed());
        assertEquals(1, result.stats().filesFailed());
        assertEquals(2, result.stats().graphsBuilt());
        assertEquals(1, result.violationCount());
        assertEquals(FileStatus.SYNTAX_ERROR, result.failedFiles().get(0).status());
    }

    @Test
    void analyze_HonorsIncludeTestsAndExcludes() throws IOException {
        // Arrange
        Path main = tempDir.resolve("src/main/java/com/example");
        Path generated = tempDir.resolve("src/main/java/generated");
        Path test = tempDir.resolve("src/test/java/com/example");
        Files.createDirectories(main);
        Files.createDirectories(generated);
        Files.createDirectories(test);
        Files.writeString(main.resolve("Simple.java"), SIMPLE);
        Files.writeString(generated.resolve("Gen.java"), SIMPLE.replace("Simple", "Gen"));
        Files.writeString(test.resolve("SimpleTest.java"), SIMPLE.replace("Simple", "SimpleTest"));

        // Act
        AnalysisResult result = service.analyze(
                new AnalysisRequest(tempDir, 0, true, List.of("generated")));

        // Assert
        List<String> names = result.files().stream()
                .map(f -> Path.of(f.fileName()).getFileName().toString())
                .toList();
        assertEquals(List.of("Simple.java", "SimpleTest.java"), names);
        assertEquals(2, result.violationCount());
    }

    @Test
    void analyze_ProjectCheckedOutUnderTestDirectory() throws IOException {
        // Arrange
        Path project = tempDir.resolve("test/myproject");
        Path pkg = project.resolve("src/main/java/com/example");
        Files.createDirectories(pkg);
        Files.writeString(pkg.resolve("Simple.java"), SIMPLE);
        Files.writeString(pkg.resolve("Branchy.java"), BRANCHY);

        // Act
        AnalysisResult result = service.analyze(AnalysisRequest.forPath(project, 3));

        // Assert
        assertEquals(2, result.stats().filesAnalyzed());
        assertEquals(2, result.stats().graphsBuilt());
        assertEquals(1, result.violationCount());
    }

    @Test
    void analyze_SingleFile() throws IOException {
        // Arrange
        Path file = tempDir.resolve("Branchy.java");
        Files.writeString(file, BRANCHY);

        // Act
        AnalysisResult result = service.analyze(AnalysisRequest.forPath(file, 7));

        // Assert
        assertEquals(1, result.files().size());
        assertEquals(0, result.violationCount());
    }

    @Test
    void analyze_MissingPathIsRejected() {
        // Arrange
        Path missing = tempDir.resolve("missing");

        // Act & Assert
        assertThrows(IllegalArgumentException.class,
                () -> service.analyze(AnalysisRequest.forPath(missing, 7)));
    }

    @Test
    void analyze_EmptyDirectory() {
        // Act
        AnalysisResult result = service.analyze(AnalysisRequest.forPath(tempDir, 7));

        // Assert
        assertTrue(result.files().isEmpty());
        assertEquals(0, result.stats().graphsBuilt());
    }
}
