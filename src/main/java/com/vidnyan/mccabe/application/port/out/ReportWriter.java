package com.vidnyan.mccabe.application.port.out;

import com.vidnyan.mccabe.application.port.in.AnalyzeComplexityUseCase.AnalysisResult;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Port for persisting an analysis result.
 */
public interface ReportWriter {

    void write(AnalysisResult result, Path target) throws IOException;
}
