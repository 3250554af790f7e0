package com.vidnyan.reqtrace.domain.index;

import com.vidnyan.reqtrace.domain.config.SpecImplKey;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Predicate;

/**
 * File-centric view: file path to code units and their rule references.
 * Immutable and thread-safe.
 */
public final class ReverseIndex {

    public static final ReverseIndex EMPTY = new ReverseIndex(List.of());

    private final Map<String, FileEntry> files;

    public ReverseIndex(List<FileEntry> entries) {
        Map<String, FileEntry> byPath = new TreeMap<>();
        entries.forEach(e -> byPath.put(e.path(), e));
        this.files = Collections.unmodifiableMap(byPath);
    }

    /**
     * All files in path order.
     */
    public Collection<FileEntry> files() {
        return files.values();
    }

    public Optional<FileEntry> file(String path) {
        return Optional.ofNullable(files.get(path));
    }

    /**
     * Files at or below {@code path} ("" or null for everything) matching the filter, in path order.
     */
    public List<FileEntry> filesUnder(String path, Predicate<FileEntry> filter) {
        String scope = normalizeScope(path);
        return files.values().stream()
                .filter(e -> isUnder(e.path(), scope))
                .filter(filter)
                .toList();
    }

    /**
     * Files that count toward unit coverage, optionally restricted to one pairing.
     */
    public static Predicate<FileEntry> countedFor(SpecImplKey key) {
        return key == null ? e -> !e.isTestOnly() : e -> e.isSourceOf(key);
    }

    /**
     * Bottom-up aggregate over the counted files under {@code path}.
     */
    public DirectoryCoverage coverage(String path, SpecImplKey key) {
        String scope = normalizeScope(path);
        List<FileCoverage> counted = filesUnder(scope, countedFor(key)).stream()
                .map(FileCoverage::of)
                .toList();
        if (files.containsKey(scope)) {
            // scope is a single file: its directory tree is just that file
            String parent = scope.contains("/") ? scope.substring(0, scope.lastIndexOf('/')) : "";
            return DirectoryCoverage.build(parent, counted);
        }
        return DirectoryCoverage.build(scope, counted);
    }

    public static String normalizeScope(String path) {
        if (path == null) {
            return "";
        }
        String scope = path.replace('\\', '/').trim();
        while (scope.startsWith("./")) {
            scope = scope.substring(2);
        }
        while (scope.endsWith("/")) {
            scope = scope.substring(0, scope.length() - 1);
        }
        return scope.equals(".") ? "" : scope;
    }

    private static boolean isUnder(String filePath, String scope) {
        return scope.isEmpty() || filePath.equals(scope) || filePath.startsWith(scope + "/");
    }
}
