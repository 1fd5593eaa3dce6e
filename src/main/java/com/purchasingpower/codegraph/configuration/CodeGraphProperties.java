package com.purchasingpower.codegraph.configuration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Tunables for graph construction and querying, bound from {@code codegraph.*}.
 *
 * <p>Defaults match the values the engine was calibrated with, so a plain
 * {@code new CodeGraphProperties()} is a valid configuration.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "codegraph")
public class CodeGraphProperties {

    @Min(8)
    private int vectorDimension = 100;

    @Min(0)
    private long vectorCacheSize = 50_000;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double similarityThreshold = 0.7;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double querySimilarityFloor = 0.3;

    @Min(1)
    private int maxQueryResults = 20;

    @Min(1)
    private int maxSuggestions = 5;

    @Min(1)
    private int maxReportedCycles = 10;

    @Min(0)
    private int hubConnectionThreshold = 5;

    @Min(1)
    private int godObjectLineThreshold = 500;

    @Min(0)
    private int serviceCountThreshold = 3;

    @Min(1)
    private int domainTermMinFrequency = 3;

    @NotEmpty
    private List<String> extensions = new ArrayList<>(List.of(
        ".ts", ".tsx", ".js", ".jsx", ".py", ".java", ".cpp", ".c", ".cs", ".go", ".rs"));

    @NotNull
    private List<String> excludedDirectories = new ArrayList<>(List.of(
        ".git", "node_modules", "dist", "build", "target", "coverage", ".next", "out"));

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private ExtractionProperties extraction = new ExtractionProperties();
}
