package com.vidnyan.reqtrace.adapter.out.pattern;

import com.vidnyan.reqtrace.application.port.out.FileSetResolver.ImplFiles;
import com.vidnyan.reqtrace.application.port.out.FileSetResolver.Resolution;
import com.vidnyan.reqtrace.domain.config.ImplConfig;
import com.vidnyan.reqtrace.domain.config.SpecConfig;
import com.vidnyan.reqtrace.domain.config.SpecImplKey;
import com.vidnyan.reqtrace.domain.config.TraceConfig;
import com.vidnyan.reqtrace.domain.validation.Finding;
import com.vidnyan.reqtrace.domain.validation.FindingKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GlobFileSetResolverTest {

    @TempDir
    Path root;

    private final GlobFileSetResolver resolver = new GlobFileSetResolver(true);

    @BeforeEach
    void setUp() throws IOException {
        for (String file : List.of("docs/spec.md", "docs/notes.txt", "src/main.rs", "src/net/conn.rs",
                "src/gen/api.rs", "tests/conn_test.rs", ".git/HEAD", "src/.cache/x.rs")) {
            Path path = root.resolve(file);
            Files.createDirectories(path.getParent());
            Files.writeString(path, "x");
        }
    }

    @Test
    void listFiles_ShouldSkipHiddenDirectoriesAndSort() throws IOException {
        List<String> files = resolver.listFiles(root);

        assertEquals(List.of("docs/notes.txt", "docs/spec.md", "src/gen/api.rs", "src/main.rs",
                "src/net/conn.rs", "tests/conn_test.rs"), files);
    }

    @Test
    void resolve_ShouldApplyIncludeExcludeAndTestInclude() throws IOException {
        ImplConfig impl = new ImplConfig("rust", List.of("src/**/*.rs", "tests/**"), List.of("src/gen/**"),
                List.of("tests/**/*_test.rs", "src/main.rs"));
        TraceConfig config = new TraceConfig(List.of(
                new SpecConfig("core", "r", null, List.of("docs/*.md"), List.of(impl))));

        Resolution resolution = resolver.resolve(root, config);

        assertTrue(resolution.findings().isEmpty());
        assertEquals(List.of("docs/spec.md"), resolution.specDocuments().get("core"));
        ImplFiles files = resolution.implFiles().get(new SpecImplKey("core", "rust"));
        assertEquals(List.of("src/main.rs", "src/net/conn.rs", "tests/conn_test.rs"), files.sources());
        // already a source file, so not a test file
        assertTrue(files.tests().isEmpty());
    }

    @Test
    void resolve_ShouldSeparateTestOnlyFiles() throws IOException {
        ImplConfig impl = new ImplConfig("rust", List.of("./src/**/*.rs"), List.of(),
                List.of("tests/**/*.rs"));
        TraceConfig config = new TraceConfig(List.of(
                new SpecConfig("core", "r", null, List.of("docs/spec.md"), List.of(impl))));

        ImplFiles files = resolver.resolve(root, config).implFiles().get(new SpecImplKey("core", "rust"));

        assertEquals(3, files.sources().size());
        assertEquals(List.of("tests/conn_test.rs"), files.tests());
    }

    @Test
    void resolve_ShouldExcludeSpecWhoseDocumentsMatchNothing() throws IOException {
        TraceConfig config = new TraceConfig(List.of(
                new SpecConfig("ghost", "g", null, List.of("nowhere/*.md"),
                        List.of(ImplConfig.of("a", List.of("src/**"), List.of())))));

        Resolution resolution = resolver.resolve(root, config);

        assertTrue(resolution.specDocuments().isEmpty());
        assertTrue(resolution.implFiles().isEmpty());
        assertEquals(1, resolution.findings().size());
        Finding finding = resolution.findings().get(0);
        assertEquals(FindingKind.CONFIG_ERROR, finding.kind());
        assertEquals("ghost", finding.specImpl());
    }

    @Test
    void resolve_ShouldExcludePairingWithEmptyInclude() throws IOException {
        TraceConfig config = new TraceConfig(List.of(
                new SpecConfig("core", "r", null, List.of("docs/spec.md"),
                        List.of(ImplConfig.of("empty", List.of(" "), List.of())))));

        Resolution resolution = resolver.resolve(root, config);

        assertTrue(resolution.implFiles().isEmpty());
        assertEquals("core/empty", resolution.findings().get(0).specImpl());
    }

    @Test
    void resolve_ShouldReportUnmatchedIncludeButKeepPairing() throws IOException {
        TraceConfig config = new TraceConfig(List.of(
                new SpecConfig("core", "r", null, List.of("docs/spec.md"),
                        List.of(ImplConfig.of("rust", List.of("src/*.rs", "lib/**/*.rs"), List.of())))));

        Resolution resolution = resolver.resolve(root, config);

        assertEquals(1, resolution.findings().size());
        assertTrue(resolution.findings().get(0).message().contains("lib/**/*.rs"));
        assertEquals(List.of("src/main.rs"),
                resolution.implFiles().get(new SpecImplKey("core", "rust")).sources());
    }
}
