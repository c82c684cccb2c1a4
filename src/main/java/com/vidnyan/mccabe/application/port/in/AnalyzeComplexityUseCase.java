package com.vidnyan.mccabe.application.port.in;

import com.vidnyan.mccabe.domain.complexity.ComplexityViolation;
import com.vidnyan.mccabe.domain.complexity.GraphScore;

import java.nio.file.Path;
import java.util.List;

/**
 * Primary use case: compute cyclomatic complexity and report what exceeds a threshold.
 */
public interface AnalyzeComplexityUseCase {

    /**
     * Analyze a file or a directory tree.
     * @param request Analysis request parameters
     * @return Per-file reports sorted by path, plus statistics
     */
    AnalysisResult analyze(AnalysisRequest request);

    /**
     * Analyze one in-memory source unit.
     * @param threshold Maximum allowed complexity; negative disables checking
     */
    FileReport analyzeSource(String fileName, String source, int threshold);

    /**
     * Analysis request parameters.
     */
    record AnalysisRequest(
        Path sourcePath,
        int maxComplexity,
        boolean includeTests,
        List<String> excludePatterns
    ) {
        public static AnalysisRequest forPath(Path path, int maxComplexity) {
            return new AnalysisRequest(path, maxComplexity, false, List.of());
        }
    }

    enum FileStatus {
        ANALYZED,
        SYNTAX_ERROR,
        READ_ERROR,
        ANALYSIS_ERROR
    }

    /**
     * Outcome for one source file.
     */
    record FileReport(
        String fileName,
        FileStatus status,
        List<GraphScore> scores,
        List<ComplexityViolation> violations,
        List<String> problems
    ) {
        public static FileReport analyzed(String fileName, List<GraphScore> scores,
                                          List<ComplexityViolation> violations) {
            return new FileReport(fileName, FileStatus.ANALYZED, scores, violations, List.of());
        }

        public static FileReport failed(String fileName, FileStatus status, List<String> problems) {
            return new FileReport(fileName, status, List.of(), List.of(), problems);
        }

        public boolean isAnalyzed() {
            return status == FileStatus.ANALYZED;
        }
    }

    /**
     * Analysis result.
     */
    record AnalysisResult(
        List<FileReport> files,
        AnalysisStats stats
    ) {
        public int violationCount() {
            return files.stream()
                    .mapToInt(f -> f.violations().size())
                    .sum();
        }

        public List<FileReport> failedFiles() {
            return files.stream()
                    .filter(f -> !f.isAnalyzed())
                    .toList();
        }
    }

    /**
     * Analysis statistics.
     */
    record AnalysisStats(
        int filesAnalyzed,
        int filesFailed,
        int graphsBuilt,
        int violations,
        long totalDurationMs
    ) {}
}
