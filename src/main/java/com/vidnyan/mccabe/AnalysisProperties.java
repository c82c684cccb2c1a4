package com.vidnyan.mccabe;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the complexity analysis.
 * Can be configured via application.yml
 */
@Data
@Component
@ConfigurationProperties(prefix = "mccabe.analysis")
public class AnalysisProperties {

    /**
     * Highest complexity that is not reported. Negative disables checking.
     */
    private int maxComplexity = 7;

    /**
     * Whether test sources are analyzed too.
     */
    private boolean includeTests = false;

    /**
     * Paths containing any of these fragments are skipped.
     */
    private List<String> excludePatterns = new ArrayList<>();

    /**
     * Worker threads for directory analysis.
     */
    private int parallelism = Runtime.getRuntime().availableProcessors();

    /**
     * Optional JSON report destination.
     */
    private String reportFile;

    @PostConstruct
    public void init() {
        if (parallelism < 1) {
            parallelism = 1;
        }
    }
}
