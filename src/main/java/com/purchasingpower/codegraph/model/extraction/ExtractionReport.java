package com.purchasingpower.codegraph.model.extraction;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of the extraction phase over a whole tree, in discovery order.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExtractionReport {

    @Builder.Default
    private List<FileExtraction> extractions = new ArrayList<>();

    private int filesDiscovered;
    private int filesSkipped;

    @Builder.Default
    private List<String> errors = new ArrayList<>();
}
