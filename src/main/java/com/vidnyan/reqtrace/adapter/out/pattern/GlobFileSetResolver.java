package com.vidnyan.reqtrace.adapter.out.pattern;

import com.vidnyan.reqtrace.application.port.out.FileSetResolver;
import com.vidnyan.reqtrace.config.ReqTraceProperties;
import com.vidnyan.reqtrace.domain.config.ImplConfig;
import com.vidnyan.reqtrace.domain.config.SpecConfig;
import com.vidnyan.reqtrace.domain.config.SpecImplKey;
import com.vidnyan.reqtrace.domain.config.TraceConfig;
import com.vidnyan.reqtrace.domain.validation.Finding;
import com.vidnyan.reqtrace.domain.validation.FindingKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.AntPathMatcher;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Resolves Ant-style glob patterns against one walk of the project tree.
 * {@code *} stays within a path segment, {@code **} crosses segments, {@code ?} is one character.
 */
@Slf4j
@Component
public class GlobFileSetResolver implements FileSetResolver {

    private final AntPathMatcher matcher = new AntPathMatcher("/");
    private final boolean skipHidden;

    @Autowired
    public GlobFileSetResolver(ReqTraceProperties properties) {
        this(properties.getScan().isSkipHidden());
    }

    public GlobFileSetResolver(boolean skipHidden) {
        this.skipHidden = skipHidden;
    }

    @Override
    public Resolution resolve(Path projectRoot, TraceConfig config) throws IOException {
        List<String> allFiles = listFiles(projectRoot);
        log.debug("Walked {}: {} files", projectRoot, allFiles.size());

        List<Finding> findings = new ArrayList<>();
        Map<String, List<String>> specDocuments = new LinkedHashMap<>();
        SortedMap<SpecImplKey, ImplFiles> implFiles = new TreeMap<>();

        for (SpecConfig spec : config.specs()) {
            List<String> documents = resolveSpecDocuments(spec, allFiles, findings);
            if (documents.isEmpty()) {
                continue;
            }
            specDocuments.put(spec.name(), documents);

            for (ImplConfig impl : spec.impls()) {
                SpecImplKey key = new SpecImplKey(spec.name(), impl.name());
                ImplFiles files = resolveImpl(key, impl, allFiles, findings);
                if (files != null) {
                    implFiles.put(key, files);
                }
            }
        }
        return new Resolution(specDocuments, implFiles, findings);
    }

    /**
     * All regular files under the root as sorted, '/' separated relative paths.
     */
    public List<String> listFiles(Path projectRoot) throws IOException {
        Path root = projectRoot.toAbsolutePath().normalize();
        TreeSet<String> files = new TreeSet<>();
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (dir.equals(root)) {
                    return FileVisitResult.CONTINUE;
                }
                if (skipHidden && dir.getFileName().toString().startsWith(".")) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile()) {
                    files.add(relativePath(root, file));
                }
                return FileVisitResult.CONTINUE;
            }
        });
        return List.copyOf(files);
    }

    private List<String> resolveSpecDocuments(SpecConfig spec, List<String> allFiles, List<Finding> findings) {
        List<String> patterns = normalize(spec.include());
        if (patterns.isEmpty()) {
            findings.add(configError(spec.name(),
                    "Spec '" + spec.name() + "' has no document patterns; spec excluded"));
            return List.of();
        }
        List<String> documents = matchAny(patterns, allFiles);
        if (documents.isEmpty()) {
            findings.add(configError(spec.name(),
                    "Spec '" + spec.name() + "' document patterns " + patterns + " match no file; spec excluded"));
        }
        return documents;
    }

    private ImplFiles resolveImpl(SpecImplKey key, ImplConfig impl, List<String> allFiles, List<Finding> findings) {
        List<String> include = normalize(impl.include());
        if (include.isEmpty()) {
            findings.add(configError(key.toString(),
                    "Implementation '" + key + "' has no include patterns; pairing excluded"));
            return null;
        }
        for (String pattern : include) {
            if (allFiles.stream().noneMatch(f -> matcher.match(pattern, f))) {
                findings.add(configError(key.toString(),
                        "Include pattern '" + pattern + "' of '" + key + "' matches no file"));
            }
        }

        List<String> exclude = normalize(impl.exclude());
        List<String> sources = matchAny(include, allFiles).stream()
                .filter(f -> !matchesAny(exclude, f))
                .toList();

        List<String> testInclude = normalize(impl.testInclude());
        TreeSet<String> sourceSet = new TreeSet<>(sources);
        List<String> tests = matchAny(testInclude, allFiles).stream()
                .filter(f -> !matchesAny(exclude, f))
                .filter(f -> !sourceSet.contains(f))
                .toList();

        log.debug("{}: {} source files, {} test files", key, sources.size(), tests.size());
        return new ImplFiles(sources, tests);
    }

    private List<String> matchAny(List<String> patterns, List<String> allFiles) {
        return allFiles.stream()
                .filter(f -> matchesAny(patterns, f))
                .toList();
    }

    private boolean matchesAny(List<String> patterns, String file) {
        for (String pattern : patterns) {
            if (matcher.match(pattern, file)) {
                return true;
            }
        }
        return false;
    }

    private static List<String> normalize(List<String> patterns) {
        List<String> result = new ArrayList<>();
        for (String pattern : patterns) {
            if (pattern == null || pattern.isBlank()) {
                continue;
            }
            String p = pattern.trim().replace('\\', '/');
            while (p.startsWith("./")) {
                p = p.substring(2);
            }
            result.add(p);
        }
        return result;
    }

    private static Finding configError(String subject, String message) {
        return Finding.builder()
                .kind(FindingKind.CONFIG_ERROR)
                .specImpl(subject)
                .message(message)
                .build();
    }

    private static String relativePath(Path root, Path file) {
        return root.relativize(file).toString().replace('\\', '/');
    }
}
