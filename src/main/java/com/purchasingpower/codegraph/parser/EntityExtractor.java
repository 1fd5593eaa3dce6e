package com.purchasingpower.codegraph.parser;

import com.purchasingpower.codegraph.configuration.CodeGraphProperties;
import com.purchasingpower.codegraph.exception.BuildCancelledException;
import com.purchasingpower.codegraph.knowledge.CancellationToken;
import com.purchasingpower.codegraph.model.extraction.CallSite;
import com.purchasingpower.codegraph.model.extraction.DependencyReference;
import com.purchasingpower.codegraph.model.extraction.ExtractedEntity;
import com.purchasingpower.codegraph.model.extraction.ExtractionReport;
import com.purchasingpower.codegraph.model.extraction.FileExtraction;
import com.purchasingpower.codegraph.model.extraction.LexicalScan;
import com.purchasingpower.codegraph.model.graph.AttributeValue;
import com.purchasingpower.codegraph.model.graph.GraphNode;
import com.purchasingpower.codegraph.model.graph.NodeMetadataKeys;
import com.purchasingpower.codegraph.model.graph.NodeType;
import com.purchasingpower.codegraph.parser.LexicalSupport.LineIndex;
import com.purchasingpower.codegraph.util.GraphIds;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts file nodes, entity nodes, dependencies and call sites from
 * discovered source files.
 *
 * <p>This is lexical extraction, not parsing:
 * <ul>
 *   <li>comments and string bodies are masked out, then per-language regular expressions find declarations</li>
 *   <li>relative imports are resolved against the discovered file set</li>
 *   <li>every {@code identifier(} that is not a declaration is a potential call</li>
 * </ul>
 * Files are processed in parallel on the extraction executor and merged back
 * in discovery order. A file that cannot be read is logged and skipped.
 */
@Slf4j
@Component
public class EntityExtractor {

    private static final Pattern FUNCTION_KEYWORDS = Pattern.compile("\\b(?:function|def|class)\\b");
    private static final Pattern CONDITIONAL_KEYWORDS = Pattern.compile("\\b(?:if|else|switch|case|while|for)\\b");

    private final List<LanguageExtractor> languageExtractors;
    private final Executor extractionExecutor;
    private final CodeGraphProperties properties;

    public EntityExtractor(List<LanguageExtractor> languageExtractors,
                           @Qualifier("extractionExecutor") Executor extractionExecutor,
                           CodeGraphProperties properties) {
        this.languageExtractors = List.copyOf(languageExtractors);
        this.extractionExecutor = extractionExecutor;
        this.properties = properties;
    }

    /**
     * Extract every file.
     *
     * @param root build root, used for relative paths and ids
     * @param files discovered files, in discovery order
     * @param builtAt timestamp stamped on every node
     * @param cancellationToken checked before each file
     * @return extractions in discovery order plus skipped-file errors
     */
    public ExtractionReport extract(Path root, List<Path> files, Instant builtAt, CancellationToken cancellationToken) {
        Set<String> discoveredPaths = new HashSet<>();
        for (Path file : files) {
            discoveredPaths.add(FileDiscovery.relativePath(root, file));
        }

        List<CompletableFuture<FileOutcome>> futures = new ArrayList<>(files.size());
        for (Path file : files) {
            cancellationToken.throwIfCancellationRequested("extraction");
            futures.add(CompletableFuture.supplyAsync(
                () -> extractFile(root, file, discoveredPaths, builtAt, cancellationToken), extractionExecutor));
        }

        ExtractionReport report = ExtractionReport.builder()
            .filesDiscovered(files.size())
            .build();

        for (CompletableFuture<FileOutcome> future : futures) {
            FileOutcome outcome = join(future);
            if (outcome.extraction() != null) {
                report.getExtractions().add(outcome.extraction());
            } else {
                report.setFilesSkipped(report.getFilesSkipped() + 1);
                report.getErrors().add(outcome.error());
            }
        }

        log.info("Extracted {} files ({} skipped)", report.getExtractions().size(), report.getFilesSkipped());
        return report;
    }

    private FileOutcome extractFile(Path root, Path file, Set<String> discoveredPaths,
                                    Instant builtAt, CancellationToken cancellationToken) {
        cancellationToken.throwIfCancellationRequested("extraction");
        String relativePath = FileDiscovery.relativePath(root, file);

        String content;
        BasicFileAttributes attributes;
        try {
            content = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
            attributes = Files.readAttributes(file, BasicFileAttributes.class);
        } catch (IOException e) {
            log.warn("Failed to read {}: {}", relativePath, e.getMessage());
            return new FileOutcome(null, "Failed to read " + relativePath + ": " + e.getMessage());
        }

        try {
            return new FileOutcome(analyze(relativePath, file, content, attributes, discoveredPaths, builtAt), null);
        } catch (BuildCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Failed to extract {}: {}", relativePath, e.getMessage(), e);
            return new FileOutcome(null, "Failed to extract " + relativePath + ": " + e.getMessage());
        }
    }

    private FileExtraction analyze(String relativePath, Path file, String content, BasicFileAttributes attributes,
                                   Set<String> discoveredPaths, Instant builtAt) {
        String extension = FileDiscovery.extensionOf(file);
        SourceLanguage language = SourceLanguage.fromExtension(extension);
        String masked = LexicalSupport.maskComments(content, language.commentStyle());
        String code = LexicalSupport.maskCommentsAndStrings(content, language.commentStyle());
        LineIndex lineIndex = new LineIndex(content);

        GraphNode fileNode = createFileNode(relativePath, file, extension, language, content, code,
            lineIndex.lineCount(), attributes, builtAt);

        LexicalScan scan = findExtractor(language)
            .map(extractor -> extractor.scan(masked))
            .orElseGet(LexicalScan::empty);

        Map<String, GraphNode> entityNodes = new LinkedHashMap<>();
        Set<Integer> declarationOffsets = new HashSet<>();
        for (ExtractedEntity entity : scan.getEntities()) {
            declarationOffsets.add(entity.getNameOffset());
            GraphNode node = toNode(entity, relativePath, builtAt);
            entityNodes.putIfAbsent(node.getId(), node);
        }

        List<DependencyReference> dependencies = new ArrayList<>();
        for (DependencyReference dependency : scan.getDependencies()) {
            if (dependency.getSpecifier().startsWith(".")) {
                dependency.setResolvedPath(resolveRelative(relativePath, dependency.getSpecifier(), discoveredPaths));
            }
            dependencies.add(dependency);
        }

        List<CallSite> callSites = LexicalSupport.findCallSites(code, declarationOffsets, lineIndex);

        log.debug("{}: {} entities, {} dependencies, {} call sites",
            relativePath, entityNodes.size(), dependencies.size(), callSites.size());

        return FileExtraction.builder()
            .relativePath(relativePath)
            .fileNode(fileNode)
            .entityNodes(new ArrayList<>(entityNodes.values()))
            .dependencies(dependencies)
            .callSites(callSites)
            .build();
    }

    private GraphNode createFileNode(String relativePath, Path file, String extension, SourceLanguage language,
                                     String content, String code, int lineCount,
                                     BasicFileAttributes fileAttributes, Instant builtAt) {
        Map<String, AttributeValue> metadata = new LinkedHashMap<>();
        metadata.put(NodeMetadataKeys.SIZE, AttributeValue.of(fileAttributes.size()));
        metadata.put(NodeMetadataKeys.EXTENSION, AttributeValue.of(extension));
        metadata.put(NodeMetadataKeys.LAST_MODIFIED, AttributeValue.of(fileAttributes.lastModifiedTime().toInstant()));
        metadata.put(NodeMetadataKeys.LINE_COUNT, AttributeValue.of((long) lineCount));

        Map<String, AttributeValue> attributes = new LinkedHashMap<>();
        attributes.put(NodeMetadataKeys.LANGUAGE, AttributeValue.of(language.wireName()));
        attributes.put(NodeMetadataKeys.COMPLEXITY, AttributeValue.of(complexity(code, lineCount)));

        return GraphNode.builder()
            .id(GraphIds.nodeId(NodeType.FILE, relativePath))
            .type(NodeType.FILE)
            .name(file.getFileName().toString())
            .sourceLocation(relativePath)
            .metadata(metadata)
            .attributes(attributes)
            .importance(fileImportance(relativePath, lineCount))
            .lastUpdated(builtAt)
            .build();
    }

    private GraphNode toNode(ExtractedEntity entity, String relativePath, Instant builtAt) {
        return GraphNode.builder()
            .id(GraphIds.entityId(entity.getType(), relativePath, entity.getName()))
            .type(entity.getType())
            .name(entity.getName())
            .sourceLocation(relativePath)
            .metadata(new LinkedHashMap<>(entity.getMetadata()))
            .attributes(new LinkedHashMap<>(entity.getAttributes()))
            .importance(entity.getImportance())
            .lastUpdated(builtAt)
            .build();
    }

    /**
     * Resolve a relative specifier against the importing file's directory.
     * Probes the path itself, then each allowed extension, then an index file
     * in a directory of that name. Falls back to the bare normalized path.
     */
    String resolveRelative(String fromRelativePath, String specifier, Set<String> discoveredPaths) {
        int slash = fromRelativePath.lastIndexOf('/');
        String directory = slash >= 0 ? fromRelativePath.substring(0, slash) : "";
        String base = Path.of(directory).resolve(specifier).normalize().toString().replace('\\', '/');

        Set<String> candidates = new LinkedHashSet<>();
        if (!base.isEmpty()) {
            candidates.add(base);
            for (String extension : properties.getExtensions()) {
                candidates.add(base + extension);
            }
        }
        String prefix = base.isEmpty() ? "" : base + "/";
        for (String extension : properties.getExtensions()) {
            candidates.add(prefix + "index" + extension);
        }
        candidates.add(prefix + "__init__.py");

        for (String candidate : candidates) {
            if (discoveredPaths.contains(candidate)) {
                return candidate;
            }
        }
        log.debug("Unresolved relative import '{}' in {}", specifier, fromRelativePath);
        return base.isEmpty() ? prefix + "__init__.py" : base;
    }

    private Optional<LanguageExtractor> findExtractor(SourceLanguage language) {
        return languageExtractors.stream()
            .filter(extractor -> extractor.supports(language))
            .findFirst();
    }

    static double complexity(String content, int lineCount) {
        int functions = count(FUNCTION_KEYWORDS, content);
        int conditionals = count(CONDITIONAL_KEYWORDS, content);
        return (double) (functions + conditionals) / Math.max(1, lineCount);
    }

    static double fileImportance(String relativePath, int lineCount) {
        String path = relativePath.toLowerCase(Locale.ROOT);
        double importance = 0.5;
        if (path.contains("index.") || path.contains("main.")) {
            importance += 0.3;
        }
        if (path.contains("config")) {
            importance += 0.2;
        }
        if (path.contains("util") || path.contains("helper")) {
            importance += 0.1;
        }
        importance += Math.min(0.3, lineCount / 1000.0);
        return Math.min(1.0, importance);
    }

    private static int count(Pattern pattern, String content) {
        Matcher matcher = pattern.matcher(content);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }

    private static FileOutcome join(CompletableFuture<FileOutcome> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw e;
        }
    }

    private record FileOutcome(FileExtraction extraction, String error) {
    }
}
