package com.repo.cccp.core;

import java.nio.file.Path;
import java.util.*;

/**
 * Registry for syntax sources.
 * Routes files to the appropriate source based on their name suffix.
 */
public class SourceRegistry {

    private final List<SyntaxSource> sources;
    private final Map<String, SyntaxSource> extensionMap;

    public SourceRegistry(List<SyntaxSource> sources) {
        this.sources = new ArrayList<>(sources);
        this.extensionMap = buildExtensionMap();
    }

    private Map<String, SyntaxSource> buildExtensionMap() {
        Map<String, SyntaxSource> map = new HashMap<>();

        // Sort by priority (lower = higher priority)
        List<SyntaxSource> sorted = new ArrayList<>(sources);
        sorted.sort(Comparator.comparingInt(SyntaxSource::getPriority));

        // First available source wins for each suffix
        for (SyntaxSource source : sorted) {
            if (!source.isAvailable()) {
                System.out.println("  [SKIP] " + source.getSourceId() + " source not available");
                continue;
            }

            for (String ext : source.getSupportedExtensions()) {
                map.putIfAbsent(ext, source);
            }
        }

        return map;
    }

    /**
     * Get the source for a file. The longest matching suffix wins, so
     * {@code .ast.json} takes precedence over {@code .json}.
     */
    public Optional<SyntaxSource> getSource(Path file) {
        String name = file.getFileName().toString();
        String best = null;
        for (String ext : extensionMap.keySet()) {
            if (name.endsWith(ext) && (best == null || ext.length() > best.length())) {
                best = ext;
            }
        }
        return Optional.ofNullable(best).map(extensionMap::get);
    }

    /**
     * Check whether any available source handles this file.
     */
    public boolean supports(Path file) {
        return getSource(file).isPresent();
    }

    /**
     * Get all registered and available sources.
     */
    public List<SyntaxSource> getAvailableSources() {
        return sources.stream()
                .filter(SyntaxSource::isAvailable)
                .toList();
    }

    /**
     * Get all supported suffixes.
     */
    public Set<String> getSupportedExtensions() {
        return extensionMap.keySet();
    }

    /**
     * Print summary of available sources.
     */
    public void printSummary() {
        System.out.println("Available sources:");
        for (SyntaxSource source : getAvailableSources()) {
            System.out.printf("  [%s] %s%n", source.getSourceId(),
                    String.join(", ", new TreeSet<>(source.getSupportedExtensions())));
        }
    }
}
