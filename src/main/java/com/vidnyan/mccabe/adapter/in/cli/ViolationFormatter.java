package com.vidnyan.mccabe.adapter.in.cli;

import com.vidnyan.mccabe.application.port.in.AnalyzeComplexityUseCase.FileReport;
import com.vidnyan.mccabe.domain.complexity.ComplexityViolation;
import com.vidnyan.mccabe.domain.model.Location;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders reports as compiler-style lines.
 */
public final class ViolationFormatter {

    private ViolationFormatter() {
    }

    /**
     * {@code <file>:<line>:<column>: <entity> is too complex (<score>)}
     */
    public static String format(String fileName, ComplexityViolation violation) {
        return Location.at(fileName, violation.line(), violation.column()).format() + ": " + violation.message();
    }

    /**
     * One line per violation, or one line per problem when the file was not analyzed.
     */
    public static List<String> lines(FileReport report) {
        List<String> lines = new ArrayList<>();
        if (!report.isAnalyzed()) {
            String reason = switch (report.status()) {
                case SYNTAX_ERROR -> "unable to parse";
                case READ_ERROR -> "unable to read";
                default -> "analysis failed";
            };
            for (String problem : report.problems()) {
                lines.add(report.fileName() + ": " + reason + ": " + problem);
            }
            return lines;
        }
        for (ComplexityViolation violation : report.violations()) {
            lines.add(format(report.fileName(), violation));
        }
        return lines;
    }
}
