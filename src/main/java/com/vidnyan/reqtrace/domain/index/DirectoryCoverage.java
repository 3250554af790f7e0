package com.vidnyan.reqtrace.domain.index;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Unit coverage of a directory, aggregated bottom-up from its files and subdirectories.
 * Aggregates are derived on demand and never stored in the index.
 */
public record DirectoryCoverage(
    String name,
    String path,
    int totalUnits,
    int coveredUnits,
    List<FileCoverage> files,
    List<DirectoryCoverage> children
) {

    public DirectoryCoverage {
        files = List.copyOf(files);
        children = List.copyOf(children);
    }

    /**
     * Build the tree rooted at {@code rootPath} ("" for the project root) from file coverages
     * whose paths lie under it.
     */
    public static DirectoryCoverage build(String rootPath, List<FileCoverage> fileCoverages) {
        Node root = new Node();
        String base = rootPath.isEmpty() ? "" : rootPath + "/";
        for (FileCoverage file : fileCoverages) {
            String relative = file.path().startsWith(base) ? file.path().substring(base.length()) : file.path();
            String[] segments = relative.split("/");
            Node node = root;
            for (int i = 0; i < segments.length - 1; i++) {
                node = node.dirs.computeIfAbsent(segments[i], k -> new Node());
            }
            node.files.put(segments[segments.length - 1], file);
        }
        String name = rootPath.isEmpty() ? "" : rootPath.substring(rootPath.lastIndexOf('/') + 1);
        return root.toCoverage(name, rootPath);
    }

    private static final class Node {
        private final Map<String, Node> dirs = new TreeMap<>();
        private final Map<String, FileCoverage> files = new TreeMap<>();

        private DirectoryCoverage toCoverage(String name, String path) {
            List<DirectoryCoverage> children = new ArrayList<>();
            int total = 0;
            int covered = 0;
            for (Map.Entry<String, Node> dir : dirs.entrySet()) {
                String childPath = path.isEmpty() ? dir.getKey() : path + "/" + dir.getKey();
                DirectoryCoverage child = dir.getValue().toCoverage(dir.getKey(), childPath);
                children.add(child);
                total += child.totalUnits();
                covered += child.coveredUnits();
            }
            for (FileCoverage file : files.values()) {
                total += file.totalUnits();
                covered += file.coveredUnits();
            }
            return new DirectoryCoverage(name, path, total, covered, List.copyOf(files.values()), children);
        }
    }
}
