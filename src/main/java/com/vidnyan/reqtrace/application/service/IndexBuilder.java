package com.vidnyan.reqtrace.application.service;

import com.vidnyan.reqtrace.application.port.out.FileSetResolver;
import com.vidnyan.reqtrace.application.port.out.FileSetResolver.ImplFiles;
import com.vidnyan.reqtrace.application.port.out.FileSetResolver.Resolution;
import com.vidnyan.reqtrace.application.port.out.SourceScanner;
import com.vidnyan.reqtrace.application.port.out.SourceScanner.AnnotationProblem;
import com.vidnyan.reqtrace.application.port.out.SourceScanner.ProblemKind;
import com.vidnyan.reqtrace.application.port.out.SourceScanner.ScannedAnnotation;
import com.vidnyan.reqtrace.application.port.out.SourceScanner.ScannedFile;
import com.vidnyan.reqtrace.application.port.out.SpecDocumentParser;
import com.vidnyan.reqtrace.application.port.out.TraceConfigSource;
import com.vidnyan.reqtrace.domain.config.SpecConfig;
import com.vidnyan.reqtrace.domain.config.SpecImplKey;
import com.vidnyan.reqtrace.domain.config.TraceConfig;
import com.vidnyan.reqtrace.domain.index.CoverageSnapshot;
import com.vidnyan.reqtrace.domain.index.FileEntry;
import com.vidnyan.reqtrace.domain.index.ForwardIndex;
import com.vidnyan.reqtrace.domain.index.ReverseIndex;
import com.vidnyan.reqtrace.domain.index.SpecIndex;
import com.vidnyan.reqtrace.domain.index.StaleReference;
import com.vidnyan.reqtrace.domain.model.CodeUnit;
import com.vidnyan.reqtrace.domain.model.RefVerb;
import com.vidnyan.reqtrace.domain.model.Reference;
import com.vidnyan.reqtrace.domain.model.Rule;
import com.vidnyan.reqtrace.domain.validation.Finding;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * Builds a complete snapshot from disk.
 *
 * Flow:
 * 1. Load and check configuration
 * 2. Resolve file sets
 * 3. Parse spec documents and scan sources, in parallel per file
 * 4. Merge results in path order into forward and reverse indexes
 * 5. Track staleness and validate
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IndexBuilder {

    private final TraceConfigSource configSource;
    private final FileSetResolver fileSetResolver;
    private final SpecDocumentParser specParser;
    private final SourceScanner sourceScanner;
    private final IndexValidator validator;
    private final StalenessTracker stalenessTracker;
    private final ExecutorService scanExecutor;

    /**
     * Build a snapshot with version 0; the caller assigns the real version.
     *
     * @throws IOException when a file cannot be read or the tree cannot be walked
     * @throws com.vidnyan.reqtrace.domain.error.ConfigException when the configuration is unusable
     */
    public CoverageSnapshot build(Path projectRoot) throws IOException {
        long start = System.currentTimeMillis();
        Path root = projectRoot.toAbsolutePath().normalize();

        TraceConfig config = configSource.load();
        IndexValidator.ConfigCheck check = validator.checkConfig(config);
        Resolution resolution = fileSetResolver.resolve(root, check.usable());
        log.info("Resolved {} specs, {} spec/impl pairs from {}",
                resolution.specDocuments().size(), resolution.implFiles().size(), configSource.describe());

        List<SpecConfig> specs = check.usable().specs().stream()
                .filter(s -> resolution.specDocuments().containsKey(s.name()))
                .toList();
        Map<String, List<Rule>> rulesBySpec = parseSpecs(root, specs, resolution);

        Map<String, Ownership> ownership = ownership(resolution, specs);
        List<ScannedFile> scanned = scanFiles(root, ownership);
        log.info("Scanned {} files", scanned.size());

        Merge merge = new Merge(specs, resolution);
        rulesBySpec.forEach(merge::declare);
        for (ScannedFile file : scanned) {
            merge.attach(file, ownership.get(file.path()));
        }

        ForwardIndex forward = merge.forward();
        ReverseIndex reverse = new ReverseIndex(merge.entries);
        List<StaleReference> stale = stalenessTracker.findStale(forward);

        List<Finding> earlier = new ArrayList<>(check.findings());
        earlier.addAll(resolution.findings());
        MergeIssues issues = new MergeIssues(merge.broken, merge.implInTest, merge.problems);
        List<Finding> findings = validator.validate(earlier, forward, issues, stale);

        log.info("Index built in {}ms: {} rules, {} files, {} findings",
                System.currentTimeMillis() - start, forward.ruleCount(), reverse.files().size(), findings.size());
        return new CoverageSnapshot(0L, Instant.now(), root.toString(), check.usable(),
                new TreeSet<>(resolution.implFiles().keySet()), forward, reverse, findings, stale);
    }

    private Map<String, List<Rule>> parseSpecs(Path root, List<SpecConfig> specs, Resolution resolution)
            throws IOException {
        Map<String, List<CompletableFuture<List<Rule>>>> futures = new LinkedHashMap<>();
        for (SpecConfig spec : specs) {
            List<CompletableFuture<List<Rule>>> docs = new ArrayList<>();
            for (String path : resolution.specDocuments().get(spec.name())) {
                docs.add(CompletableFuture.supplyAsync(
                        () -> specParser.parse(spec.name(), spec.prefix(), path, read(root, path)), scanExecutor));
            }
            futures.put(spec.name(), docs);
        }

        Map<String, List<Rule>> rules = new LinkedHashMap<>();
        for (Map.Entry<String, List<CompletableFuture<List<Rule>>>> entry : futures.entrySet()) {
            List<Rule> specRules = new ArrayList<>();
            for (CompletableFuture<List<Rule>> doc : entry.getValue()) {
                specRules.addAll(join(doc));
            }
            rules.put(entry.getKey(), specRules);
        }
        return rules;
    }

    private List<ScannedFile> scanFiles(Path root, Map<String, Ownership> ownership) throws IOException {
        List<CompletableFuture<ScannedFile>> futures = new ArrayList<>();
        ownership.forEach((path, owner) -> futures.add(CompletableFuture.supplyAsync(
                () -> sourceScanner.scan(path, read(root, path), owner.prefixes), scanExecutor)));

        List<ScannedFile> scanned = new ArrayList<>(futures.size());
        for (CompletableFuture<ScannedFile> future : futures) {
            scanned.add(join(future));
        }
        return scanned;
    }

    /**
     * Which pairs include each file, in path order.
     */
    private static Map<String, Ownership> ownership(Resolution resolution, List<SpecConfig> specs) {
        Map<String, String> prefixes = new LinkedHashMap<>();
        specs.forEach(s -> prefixes.put(s.name(), s.prefix()));

        Map<String, Ownership> owners = new TreeMap<>();
        resolution.implFiles().forEach((key, files) -> {
            if (!prefixes.containsKey(key.spec())) {
                return;
            }
            for (String source : files.sources()) {
                owners.computeIfAbsent(source, k -> new Ownership()).sources.add(key);
            }
            for (String test : files.tests()) {
                owners.computeIfAbsent(test, k -> new Ownership()).tests.add(key);
            }
        });
        owners.values().forEach(o -> {
            o.sources.forEach(k -> o.prefixes.add(prefixes.get(k.spec())));
            o.tests.forEach(k -> o.prefixes.add(prefixes.get(k.spec())));
        });
        return owners;
    }

    private static String read(Path root, String path) {
        try {
            // lenient decoding: undecodable bytes become replacement characters
            return new String(Files.readAllBytes(root.resolve(path)), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + path, e);
        }
    }

    private static <T> T join(CompletableFuture<T> future) throws IOException {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof UncheckedIOException io) {
                throw io.getCause();
            }
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw e;
        }
    }

    private static final class Ownership {
        private final SortedSet<SpecImplKey> sources = new TreeSet<>();
        private final SortedSet<SpecImplKey> tests = new TreeSet<>();
        private final Set<String> prefixes = new TreeSet<>();
    }

    /**
     * Single-threaded merge state.
     */
    private static final class Merge {
        private final Map<String, SpecIndex.Builder> builders = new LinkedHashMap<>();
        private final Map<String, List<String>> specsByPrefix = new LinkedHashMap<>();
        private final List<FileEntry> entries = new ArrayList<>();
        private final List<Reference> broken = new ArrayList<>();
        private final List<Reference> implInTest = new ArrayList<>();
        private final List<MergeIssues.FileProblem> problems = new ArrayList<>();

        private Merge(List<SpecConfig> specs, Resolution resolution) {
            for (SpecConfig spec : specs) {
                builders.put(spec.name(), SpecIndex.builder(spec.name(), spec.prefix()));
                specsByPrefix.computeIfAbsent(spec.prefix(), k -> new ArrayList<>()).add(spec.name());
            }
            for (SpecImplKey key : resolution.implFiles().keySet()) {
                SpecIndex.Builder builder = builders.get(key.spec());
                if (builder != null) {
                    builder.impl(key.impl());
                }
            }
        }

        private void declare(String spec, List<Rule> rules) {
            SpecIndex.Builder builder = builders.get(spec);
            rules.forEach(builder::declare);
        }

        private void attach(ScannedFile file, Ownership owner) {
            List<Set<String>> unitRefs = new ArrayList<>();
            file.units().forEach(u -> unitRefs.add(new TreeSet<>()));

            for (ScannedAnnotation annotation : file.annotations()) {
                List<String> specs = specsByPrefix.getOrDefault(annotation.prefix(), List.of());
                if (specs.size() != 1) {
                    problems.add(new MergeIssues.FileProblem(file.path(), new AnnotationProblem(
                            ProblemKind.PREFIX_MISMATCH, annotation.prefix(),
                            annotation.prefix() + "[" + annotation.verb().token() + " " + annotation.ruleId() + "]",
                            annotation.line(), "prefix '" + annotation.prefix() + "' is shared by specs " + specs)));
                    continue;
                }
                String spec = specs.get(0);
                SpecIndex.Builder builder = builders.get(spec);
                for (SpecImplKey key : owner.sources) {
                    if (key.spec().equals(spec)) {
                        attachTo(builder, key, file.path(), annotation, unitRefs);
                    }
                }
                for (SpecImplKey key : owner.tests) {
                    if (!key.spec().equals(spec)) {
                        continue;
                    }
                    if (annotation.verb() == RefVerb.IMPL) {
                        implInTest.add(reference(key, file.path(), annotation));
                    } else {
                        attachTo(builder, key, file.path(), annotation, unitRefs);
                    }
                }
            }
            file.problems().forEach(p -> problems.add(new MergeIssues.FileProblem(file.path(), p)));

            List<CodeUnit> units = new ArrayList<>(file.units().size());
            for (int i = 0; i < file.units().size(); i++) {
                units.add(file.units().get(i).withRuleRefs(unitRefs.get(i)));
            }
            entries.add(new FileEntry(file.path(), units, owner.sources, owner.tests, file.lines()));
        }

        private void attachTo(SpecIndex.Builder builder, SpecImplKey key, String path,
                              ScannedAnnotation annotation, List<Set<String>> unitRefs) {
            Reference reference = reference(key, path, annotation);
            if (!builder.hasRule(annotation.ruleId())) {
                broken.add(reference);
                return;
            }
            builder.reference(reference);
            if (annotation.unitIndex() >= 0) {
                unitRefs.get(annotation.unitIndex()).add(annotation.ruleId());
            }
        }

        private static Reference reference(SpecImplKey key, String path, ScannedAnnotation annotation) {
            return new Reference(key.spec(), key.impl(), annotation.verb(), annotation.ruleId(),
                    path, annotation.line(), annotation.fingerprint());
        }

        private ForwardIndex forward() {
            return new ForwardIndex(builders.values().stream().map(SpecIndex.Builder::build).toList());
        }
    }
}
