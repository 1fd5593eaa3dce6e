package com.purchasingpower.codegraph.model.export;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExportMetadata {

    private Instant exportDate;
    private String version;
    private String rootPath;
    private Instant builtAt;
}
