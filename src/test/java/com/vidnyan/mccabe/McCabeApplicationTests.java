package com.vidnyan.mccabe;

import com.vidnyan.mccabe.application.port.in.AnalyzeComplexityUseCase;
import com.vidnyan.mccabe.application.port.in.AnalyzeComplexityUseCase.FileReport;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = "mccabe.analysis.max-complexity=1")
class McCabeApplicationTests {

    @Autowired
    private AnalyzeComplexityUseCase analyzeComplexityUseCase;

    @Autowired
    private AnalysisProperties properties;

    @Test
    void contextLoads() {
        assertEquals(1, properties.getMaxComplexity());
        assertTrue(properties.getParallelism() >= 1);
    }

    @Test
    void useCaseIsWired() {
        FileReport report = analyzeComplexityUseCase.analyzeSource("A.java",
                "class A { void m(boolean b) { if (b) { run(); } } }", properties.getMaxComplexity());

        assertEquals(1, report.violations().size());
        assertEquals("A, m", report.violations().get(0).entity());
    }
}
