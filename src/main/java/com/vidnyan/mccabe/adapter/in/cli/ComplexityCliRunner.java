package com.vidnyan.mccabe.adapter.in.cli;

import com.vidnyan.mccabe.AnalysisProperties;
import com.vidnyan.mccabe.application.port.in.AnalyzeComplexityUseCase;
import com.vidnyan.mccabe.application.port.in.AnalyzeComplexityUseCase.AnalysisRequest;
import com.vidnyan.mccabe.application.port.in.AnalyzeComplexityUseCase.AnalysisResult;
import com.vidnyan.mccabe.application.port.in.AnalyzeComplexityUseCase.FileReport;
import com.vidnyan.mccabe.application.port.out.ReportWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;

/**
 * CLI Runner for standalone complexity checks.
 * Runs analysis when mccabe.analyze.path property is set.
 * Exit code is 1 when violations or failed files were found.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ComplexityCliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final AnalyzeComplexityUseCase analyzeComplexityUseCase;
    private final ReportWriter reportWriter;
    private final AnalysisProperties properties;

    @Value("${mccabe.analyze.path:}")
    private String sourcePath;

    private int exitCode = 0;

    @Override
    public void run(String... args) throws Exception {
        if (sourcePath == null || sourcePath.isBlank()) {
            log.info("No source path specified. Set mccabe.analyze.path property.");
            return;
        }

        log.info("Checking complexity of {} (max {})", sourcePath, properties.getMaxComplexity());

        AnalysisRequest request = new AnalysisRequest(
                Path.of(sourcePath),
                properties.getMaxComplexity(),
                properties.isIncludeTests(),
                properties.getExcludePatterns()
        );
        AnalysisResult result = analyzeComplexityUseCase.analyze(request);

        printResults(result);
        writeReport(result);

        exitCode = result.violationCount() > 0 || !result.failedFiles().isEmpty() ? 1 : 0;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private void printResults(AnalysisResult result) {
        for (FileReport report : result.files()) {
            ViolationFormatter.lines(report).forEach(log::info);
        }

        log.info("───────────────────────────────────────────────────────────────");
        log.info(" Files analyzed: {}", result.stats().filesAnalyzed());
        log.info(" Files failed:   {}", result.stats().filesFailed());
        log.info(" Graphs built:   {}", result.stats().graphsBuilt());
        log.info(" Violations:     {}", result.stats().violations());
        log.info(" Duration:       {}ms", result.stats().totalDurationMs());
    }

    private void writeReport(AnalysisResult result) {
        String reportFile = properties.getReportFile();
        if (reportFile == null || reportFile.isBlank()) {
            return;
        }
        try {
            reportWriter.write(result, Path.of(reportFile));
        } catch (IOException e) {
            log.error("Failed to write report {}: {}", reportFile, e.getMessage());
        }
    }
}
