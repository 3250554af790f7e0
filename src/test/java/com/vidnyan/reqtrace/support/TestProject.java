package com.vidnyan.reqtrace.support;

import com.vidnyan.reqtrace.adapter.out.config.FileTraceConfigSource;
import com.vidnyan.reqtrace.adapter.out.pattern.GlobFileSetResolver;
import com.vidnyan.reqtrace.adapter.out.scanner.LanguageTable;
import com.vidnyan.reqtrace.adapter.out.scanner.LexicalAnnotationScanner;
import com.vidnyan.reqtrace.adapter.out.spec.MarkdownSpecParser;
import com.vidnyan.reqtrace.application.service.CoverageQueryService;
import com.vidnyan.reqtrace.application.service.IndexBuilder;
import com.vidnyan.reqtrace.application.service.IndexValidator;
import com.vidnyan.reqtrace.application.service.ReloadController;
import com.vidnyan.reqtrace.application.service.StalenessTracker;
import com.vidnyan.reqtrace.config.ReqTraceConfiguration;
import com.vidnyan.reqtrace.domain.model.Fingerprints;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * A project tree on disk wired to the real adapters.
 */
public class TestProject implements AutoCloseable {

    public static final String CONFIG_PATH = ".config/reqtrace/config.yaml";
    public static final String SAMPLE_CONN_TEXT = "Connections MUST be pooled.";
    public static final String SAMPLE_CLOSE_TEXT = "Connections SHOULD close idle sockets.";

    private final Path root;
    private final ExecutorService executor = Executors.newFixedThreadPool(4);
    private final FileTraceConfigSource configSource;

    public TestProject(Path root) {
        this.root = root;
        this.configSource = new FileTraceConfigSource(root.resolve(CONFIG_PATH), ReqTraceConfiguration.jsonMapper());
    }

    /**
     * One spec with three rules and one source file exercising every verb state:
     * db.conn verified only, db.close implemented with a stale fingerprint, net.open untouched.
     */
    public TestProject withSampleCoverage() {
        config("""
                specs:
                  - name: spec
                    prefix: r
                    sourceUrl: https://example.org/spec
                    include: [spec.md]
                    impls:
                      - name: impl
                        include: ["*.src"]
                """);
        write("spec.md", """
                # Storage

                r[db.conn]
                %s

                r[db.close]
                %s

                r[net.open]
                Sockets MAY open lazily.
                """.formatted(SAMPLE_CONN_TEXT, SAMPLE_CLOSE_TEXT));
        return write("db.src", """
                // r[verify db.conn]
                fn connect() {
                    pool();
                }

                // r[impl db.close@%s]
                fn close() {}

                fn idle() {}
                """.formatted(wrongFingerprint(SAMPLE_CLOSE_TEXT)));
    }

    /**
     * Four hex chars that are not a prefix of the text's fingerprint.
     */
    public static String wrongFingerprint(String text) {
        String print = Fingerprints.of(text).substring(0, 4);
        char last = print.charAt(3) == '0' ? '1' : '0';
        return print.substring(0, 3) + last;
    }

    public Path root() {
        return root;
    }

    public TestProject config(String yaml) {
        return write(CONFIG_PATH, yaml);
    }

    public TestProject write(String relativePath, String content) {
        try {
            Path file = root.resolve(relativePath);
            Files.createDirectories(file.getParent());
            Files.writeString(file, content);
            return this;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public IndexBuilder indexBuilder() {
        return new IndexBuilder(configSource, new GlobFileSetResolver(true), new MarkdownSpecParser(),
                new LexicalAnnotationScanner(new LanguageTable()), new IndexValidator(), new StalenessTracker(),
                executor);
    }

    public ReloadController reloadController() {
        return new ReloadController(indexBuilder(), root);
    }

    public CoverageQueryService queries(ReloadController controller) {
        return new CoverageQueryService(controller, configSource);
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
