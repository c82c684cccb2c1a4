package com.vidnyan.mccabe.adapter.out.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.mccabe.application.port.in.AnalyzeComplexityUseCase.AnalysisResult;
import com.vidnyan.mccabe.application.port.out.ReportWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes the analysis result as JSON.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JsonReportWriter implements ReportWriter {

    private final ObjectMapper objectMapper;

    @Override
    public void write(AnalysisResult result, Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        objectMapper.writeValue(target.toFile(), result);
        log.info("Report written to {}", target);
    }
}
