package com.purchasingpower.codegraph.parser;

import com.purchasingpower.codegraph.configuration.CodeGraphProperties;
import com.purchasingpower.codegraph.exception.GraphBuildException;
import com.purchasingpower.codegraph.knowledge.CancellationToken;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Walks a source tree and returns the files extraction should read.
 *
 * <p>Directories whose name is on the exclude list are not entered.
 * Unreadable directories are logged and skipped.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FileDiscovery {

    private final CodeGraphProperties properties;

    /**
     * @param root root directory of the tree
     * @return matching files sorted by root-relative path
     * @throws GraphBuildException if the root is not a readable directory
     */
    public List<Path> discover(Path root, CancellationToken cancellationToken) {
        if (!Files.isDirectory(root)) {
            throw new GraphBuildException("Root path is not a directory: " + root, root.toString());
        }

        Set<String> extensions = new HashSet<>();
        properties.getExtensions().forEach(ext -> extensions.add(ext.toLowerCase(Locale.ROOT)));
        Set<String> excluded = new HashSet<>(properties.getExcludedDirectories());
        List<Path> files = new ArrayList<>();

        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    cancellationToken.throwIfCancellationRequested("discovery");
                    if (!dir.equals(root) && excluded.contains(dir.getFileName().toString())) {
                        log.debug("Skipping excluded directory {}", dir);
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile() && extensions.contains(extensionOf(file))) {
                        files.add(file);
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException e) {
                    log.warn("Cannot list {}: {}", file, e.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new GraphBuildException("Failed to walk " + root + ": " + e.getMessage(), root.toString(), e);
        }

        files.sort(Comparator.comparing(file -> relativePath(root, file)));
        log.info("Discovered {} source files under {}", files.size(), root);
        return files;
    }

    /**
     * Extension including the dot, lower-cased; empty if the name has none.
     */
    public static String extensionOf(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(dot).toLowerCase(Locale.ROOT) : "";
    }

    /**
     * Path relative to the root with {@code /} separators on every platform.
     */
    public static String relativePath(Path root, Path file) {
        return root.relativize(file).toString().replace('\\', '/');
    }
}
