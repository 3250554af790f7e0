package com.vidnyan.reqtrace.application.service;

import com.vidnyan.reqtrace.domain.config.SpecImplKey;
import com.vidnyan.reqtrace.domain.error.ConfigException;
import com.vidnyan.reqtrace.domain.index.CoverageSnapshot;
import com.vidnyan.reqtrace.domain.index.DirectoryCoverage;
import com.vidnyan.reqtrace.domain.index.FileEntry;
import com.vidnyan.reqtrace.domain.index.RuleRefs;
import com.vidnyan.reqtrace.domain.index.SpecIndex;
import com.vidnyan.reqtrace.domain.model.CodeUnit;
import com.vidnyan.reqtrace.domain.model.Fingerprints;
import com.vidnyan.reqtrace.domain.validation.Finding;
import com.vidnyan.reqtrace.domain.validation.FindingKind;
import com.vidnyan.reqtrace.support.TestProject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class IndexBuilderTest {

    private static final String CONFIG = """
            specs:
              - name: core
                prefix: r
                include: [docs/spec.md]
                impls:
                  - name: rust
                    include: ["src/**/*.rs"]
                    testInclude: ["tests/**/*.rs"]
            """;

    private static final String SPEC = """
            # Core

            r[auth.login]
            Users MUST log in.

            r[auth.logout]
            Users MAY log out.
            """;

    @TempDir
    Path root;

    private TestProject project;

    @BeforeEach
    void setUp() {
        project = new TestProject(root).config(CONFIG).write("docs/spec.md", SPEC);
    }

    @AfterEach
    void tearDown() {
        project.close();
    }

    @Test
    void build_ShouldLinkRulesReferencesAndUnits() throws IOException {
        // Arrange
        project.write("src/auth.rs", """
                // r[impl auth.login]
                fn login() {
                    run();
                }

                fn helper() {}
                """);
        project.write("tests/auth_test.rs", """
                // r[verify auth.login]
                fn login_works() {}
                """);

        // Act
        CoverageSnapshot snapshot = project.indexBuilder().build(root);

        // Assert
        assertEquals(0L, snapshot.version());
        assertEquals(Set.of(new SpecImplKey("core", "rust")), snapshot.pairs());
        assertTrue(snapshot.findings().isEmpty());

        SpecIndex spec = snapshot.forward().spec("core").orElseThrow();
        assertEquals(List.of("auth.login", "auth.logout"), spec.ruleIds());
        RuleRefs login = spec.refs("rust", "auth.login");
        assertEquals(1, login.implRefs().size());
        assertEquals("src/auth.rs", login.implRefs().get(0).file());
        assertEquals(1, login.verifyRefs().size());
        assertEquals("tests/auth_test.rs", login.verifyRefs().get(0).file());
        assertFalse(spec.refs("rust", "auth.logout").isImplemented());

        FileEntry source = snapshot.reverse().file("src/auth.rs").orElseThrow();
        assertFalse(source.isTestOnly());
        assertEquals(2, source.totalUnits());
        assertEquals(1, source.coveredUnits());
        CodeUnit covered = source.units().stream().filter(CodeUnit::isCovered).findFirst().orElseThrow();
        assertTrue(covered.contains(3));
        assertEquals(Set.of("auth.login"), covered.ruleRefs());

        FileEntry test = snapshot.reverse().file("tests/auth_test.rs").orElseThrow();
        assertTrue(test.isTestOnly());
    }

    @Test
    void build_ShouldReportDataProblemsAsFindings() throws IOException {
        // Arrange
        project.write("docs/spec.md", SPEC + "\nr[auth.login]\nAgain.\n");
        project.write("src/auth.rs", """
                // r[impl auth.gone]
                fn gone() {}

                // q[impl auth.logout]
                // r[impl bad..id]
                fn helper() {}
                """);
        project.write("tests/auth_test.rs", """
                // r[impl auth.logout]
                fn t() {}
                """);

        // Act
        CoverageSnapshot snapshot = project.indexBuilder().build(root);

        // Assert
        List<FindingKind> kinds = snapshot.findings().stream().map(Finding::kind).toList();
        assertEquals(List.of(
                FindingKind.BROKEN_REFERENCE,
                FindingKind.DUPLICATE_RULE_ID,
                FindingKind.PREFIX_MISMATCH,
                FindingKind.MALFORMED_ANNOTATION,
                FindingKind.IMPL_IN_TEST_FILE), kinds);

        Finding duplicate = snapshot.findings().get(1);
        assertEquals("core", duplicate.specImpl());
        assertEquals(2, duplicate.locations().size());
        assertEquals(2, snapshot.forward().declarationsAnywhere("auth.login").size());

        Finding mismatch = snapshot.findings().get(2);
        assertNull(mismatch.specImpl());
        assertEquals("src/auth.rs", mismatch.primaryLocation().filePath());
        assertEquals(4, mismatch.primaryLocation().line());

        SpecIndex spec = snapshot.forward().spec("core").orElseThrow();
        assertFalse(spec.refs("rust", "auth.logout").isImplemented());
        assertEquals(0, snapshot.reverse().file("src/auth.rs").orElseThrow().coveredUnits());
    }

    @Test
    void build_ShouldDetectStaleReferencesWhenRuleTextChanges() throws IOException {
        // Arrange
        String loginPrint = Fingerprints.of("Users MUST log in.");
        String logoutPrint = Fingerprints.of("Users MAY log out.");
        project.write("src/auth.rs", "// r[impl auth.login@" + loginPrint.substring(0, 6) + "]\n"
                + "fn login() {}\n\n"
                + "// r[impl auth.logout@" + logoutPrint.toUpperCase() + "]\n"
                + "fn logout() {}\n");
        assertTrue(project.indexBuilder().build(root).stale().isEmpty());

        // Act
        project.write("docs/spec.md", SPEC.replace("Users MUST log in.", "Users MUST log in twice."));
        CoverageSnapshot snapshot = project.indexBuilder().build(root);

        // Assert
        assertEquals(1, snapshot.stale().size());
        assertEquals("auth.login", snapshot.stale().get(0).reference().ruleId());
        assertEquals(Fingerprints.of("Users MUST log in twice."), snapshot.stale().get(0).currentFingerprint());
        assertEquals(FindingKind.STALE, snapshot.findings().get(0).kind());
    }

    @Test
    void build_ShouldReportConfigurationErrorsAndKeepUsableParts() throws IOException {
        // Arrange
        project.config("""
                specs:
                  - name: core
                    prefix: r
                    include: [docs/spec.md]
                    impls:
                      - name: rust
                        include: ["src/**/*.rs"]
                  - name: other
                    prefix: r
                    include: [docs/spec.md]
                    impls:
                      - name: rust
                        include: ["src/**/*.rs"]
                  - name: core
                    prefix: x
                    include: [docs/spec.md]
                  - name: broken
                    prefix: "a b"
                    include: [docs/spec.md]
                """);
        project.write("src/auth.rs", "// r[impl auth.login]\nfn login() {}\n");

        // Act
        CoverageSnapshot snapshot = project.indexBuilder().build(root);

        // Assert
        List<Finding> configErrors = snapshot.findings().stream()
                .filter(f -> f.kind() == FindingKind.CONFIG_ERROR)
                .toList();
        assertEquals(3, configErrors.size());
        assertEquals(2, snapshot.pairs().size());

        // shared prefix: the annotation cannot be attributed to either spec
        List<Finding> mismatches = snapshot.findings().stream()
                .filter(f -> f.kind() == FindingKind.PREFIX_MISMATCH)
                .toList();
        assertEquals(1, mismatches.size());
        assertFalse(snapshot.forward().spec("core").orElseThrow().refs("rust", "auth.login").isImplemented());
    }

    @Test
    void build_ShouldFailWhenConfigurationIsMissing() {
        TestProject empty = new TestProject(root.resolve("nowhere"));
        try {
            assertThrows(ConfigException.class, () -> empty.indexBuilder().build(root));
        } finally {
            empty.close();
        }
    }

    @Test
    void build_ShouldAggregateUnitsPerDirectory() throws IOException {
        // Arrange
        project.write("src/auth.rs", "// r[impl auth.login]\nfn login() {}\nfn other() {}\n");
        project.write("src/net/conn.rs", "fn open() {}\nfn close() {}\n");

        // Act
        CoverageSnapshot snapshot = project.indexBuilder().build(root);
        DirectoryCoverage src = snapshot.reverse().coverage("src", null);

        // Assert
        assertEquals(4, src.totalUnits());
        assertEquals(1, src.coveredUnits());
        assertEquals(1, src.children().size());
        assertEquals("src/net", src.children().get(0).path());
        assertEquals(2, src.children().get(0).totalUnits());
        assertEquals(0, src.children().get(0).coveredUnits());
    }
}
