package com.vidnyan.mccabe.application.service;

import com.vidnyan.mccabe.AnalysisProperties;
import com.vidnyan.mccabe.application.port.in.AnalyzeComplexityUseCase;
import com.vidnyan.mccabe.application.port.out.SourceRepository;
import com.vidnyan.mccabe.application.port.out.SyntaxTreeParser;
import com.vidnyan.mccabe.domain.cfg.PathGraphingVisitor;
import com.vidnyan.mccabe.domain.complexity.ComplexityChecker;
import com.vidnyan.mccabe.domain.complexity.ComplexityViolation;
import com.vidnyan.mccabe.domain.complexity.GraphScore;
import com.vidnyan.mccabe.domain.graph.PathGraph;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Orchestrates parse, graph building and scoring.
 * Every file is an independent unit of work with its own visitor traversal.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ComplexityAnalysisService implements AnalyzeComplexityUseCase {

    private final SyntaxTreeParser syntaxTreeParser;
    private final SourceRepository sourceRepository;
    private final AnalysisProperties properties;

    @Override
    public AnalysisResult analyze(AnalysisRequest request) {
        Instant startTime = Instant.now();
        Path sourcePath = request.sourcePath();
        if (sourcePath == null || !Files.exists(sourcePath)) {
            throw new IllegalArgumentException("Source path does not exist: " + sourcePath);
        }
        log.info("Starting analysis of: {}", sourcePath);

        List<Path> files;
        try {
            files = sourceRepository.findSourceFiles(
                    sourcePath,
                    new SourceRepository.ScanOptions(request.includeTests(), request.excludePatterns()),
                    syntaxTreeParser::supports
            );
        } catch (IOException e) {
            throw new IllegalStateException("Failed to scan " + sourcePath, e);
        }
        log.info("Found {} source files", files.size());

        List<FileReport> reports = analyzeAll(files, request.maxComplexity());

        int graphs = reports.stream().mapToInt(r -> r.scores().size()).sum();
        int violations = reports.stream().mapToInt(r -> r.violations().size()).sum();
        int failed = (int) reports.stream().filter(r -> !r.isAnalyzed()).count();
        AnalysisStats stats = new AnalysisStats(
                reports.size() - failed,
                failed,
                graphs,
                violations,
                Duration.between(startTime, Instant.now()).toMillis()
        );

        log.info("Analysis complete: {} graphs, {} violations in {}ms",
                stats.graphsBuilt(), stats.violations(), stats.totalDurationMs());
        return new AnalysisResult(reports, stats);
    }

    @Override
    public FileReport analyzeSource(String fileName, String source, int threshold) {
        SyntaxTreeParser.ParsingResult parsed = syntaxTreeParser.parse(fileName, source);
        if (!parsed.isSuccessful()) {
            log.warn("Unable to parse {}: {}", fileName, parsed.problems());
            return FileReport.failed(fileName, FileStatus.SYNTAX_ERROR, parsed.problems());
        }

        Collection<PathGraph> graphs = new PathGraphingVisitor().build(parsed.tree()).values();
        List<GraphScore> scores = ComplexityChecker.score(graphs);
        List<ComplexityViolation> violations = ComplexityChecker.violations(scores, threshold);
        log.debug("{}: {} graphs, {} violations", fileName, scores.size(), violations.size());
        return FileReport.analyzed(fileName, scores, violations);
    }

    private List<FileReport> analyzeAll(List<Path> files, int threshold) {
        if (files.isEmpty()) {
            return List.of();
        }
        int workers = Math.max(1, Math.min(properties.getParallelism(), files.size()));
        ExecutorService executor = Executors.newFixedThreadPool(workers);
        try {
            List<Future<FileReport>> futures = new ArrayList<>();
            for (Path file : files) {
                futures.add(executor.submit(() -> analyzeFile(file, threshold)));
            }

            List<FileReport> reports = new ArrayList<>();
            for (int i = 0; i < files.size(); i++) {
                reports.add(await(futures.get(i), files.get(i)));
            }
            return reports;
        } finally {
            executor.shutdownNow();
        }
    }

    private FileReport analyzeFile(Path file, int threshold) {
        String source;
        try {
            source = sourceRepository.read(file);
        } catch (IOException e) {
            log.warn("Failed to read {}: {}", file, e.getMessage());
            return FileReport.failed(file.toString(), FileStatus.READ_ERROR, List.of(String.valueOf(e.getMessage())));
        }
        return analyzeSource(file.toString(), source, threshold);
    }

    private FileReport await(Future<FileReport> future, Path file) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while analyzing " + file, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Error analyzing {}: {}", file, cause.getMessage(), cause);
            return FileReport.failed(file.toString(), FileStatus.ANALYSIS_ERROR, List.of(String.valueOf(cause.getMessage())));
        }
    }
}
