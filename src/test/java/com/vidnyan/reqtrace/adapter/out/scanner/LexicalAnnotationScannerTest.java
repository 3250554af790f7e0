package com.vidnyan.reqtrace.adapter.out.scanner;

import com.vidnyan.reqtrace.application.port.out.SourceScanner.AnnotationProblem;
import com.vidnyan.reqtrace.application.port.out.SourceScanner.ProblemKind;
import com.vidnyan.reqtrace.application.port.out.SourceScanner.ScannedAnnotation;
import com.vidnyan.reqtrace.application.port.out.SourceScanner.ScannedFile;
import com.vidnyan.reqtrace.domain.model.CodeUnit;
import com.vidnyan.reqtrace.domain.model.RefVerb;
import com.vidnyan.reqtrace.domain.model.UnitKind;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class LexicalAnnotationScannerTest {

    private final LexicalAnnotationScanner scanner = new LexicalAnnotationScanner(new LanguageTable());

    @Test
    void scan_ShouldAttributeAnnotationToEnclosingFunction() {
        String source = """
                use std::io;

                pub struct Session {
                    user: String,
                }

                const LIMIT: u32 = 3;
                pub fn login(user: &str) -> Session {
                    let name = user.to_string();
                    // r[impl auth.login]
                    if name.is_empty() {
                        panic!("empty");
                    }
                    Session { user: name }
                }
                """;

        ScannedFile file = scanner.scan("src/auth.rs", source, Set.of("r"));

        assertEquals("c-family", file.language());
        assertEquals(1, file.annotations().size());
        ScannedAnnotation annotation = file.annotations().get(0);
        assertEquals(RefVerb.IMPL, annotation.verb());
        assertEquals("auth.login", annotation.ruleId());
        assertEquals(10, annotation.line());

        CodeUnit unit = file.units().get(annotation.unitIndex());
        assertEquals(8, unit.startLine());
        assertEquals(15, unit.endLine());
        assertEquals(UnitKind.FUNCTION, unit.kind());
        assertEquals("login", unit.name());

        // struct and function only; if-block and struct literal are not units
        assertEquals(2, file.units().size());
        assertEquals(UnitKind.TYPE, file.units().get(0).kind());
    }

    @Test
    void scan_ShouldIncludeDocCommentAndDecoratorInUnit() {
        String source = """
                package demo;

                public class Pool {

                    /**
                     * Opens a connection.
                     * r[impl db.conn]
                     */
                    @Override
                    public Connection open() {
                        return connect();
                    }
                }
                """;

        ScannedFile file = scanner.scan("src/Pool.java", source, Set.of("r"));

        ScannedAnnotation annotation = file.annotations().get(0);
        assertEquals(7, annotation.line());
        CodeUnit unit = file.units().get(annotation.unitIndex());
        assertEquals(5, unit.startLine());
        assertEquals(12, unit.endLine());
        assertEquals("open", unit.name());

        CodeUnit type = file.units().get(0);
        assertEquals(UnitKind.TYPE, type.kind());
        assertEquals("Pool", type.name());
        assertEquals(3, type.startLine());
        assertEquals(13, type.endLine());
    }

    @Test
    void scan_ShouldReadVerbsAndCapturedFingerprints() {
        String source = """
                // r[verify auth.login@1a2B3c4d]
                // r[depends auth.session]
                /* r[related auth.audit] */
                fn check() {}
                """;

        ScannedFile file = scanner.scan("tests/check.rs", source, Set.of("r"));

        List<ScannedAnnotation> annotations = file.annotations();
        assertEquals(3, annotations.size());
        assertEquals(RefVerb.VERIFY, annotations.get(0).verb());
        assertEquals("1a2B3c4d", annotations.get(0).fingerprint());
        assertEquals(RefVerb.DEPENDS, annotations.get(1).verb());
        assertNull(annotations.get(1).fingerprint());
        assertEquals(RefVerb.RELATED, annotations.get(2).verb());

        // all three sit directly above the same declaration
        assertEquals(annotations.get(0).unitIndex(), annotations.get(2).unitIndex());
        assertEquals(1, file.units().get(annotations.get(0).unitIndex()).startLine());
    }

    @Test
    void scan_ShouldReportMalformedAnnotationsWithOwnedPrefix() {
        String source = """
                // r[frobnicate auth.login]
                // r[impl]
                // r[auth.login@xyz]
                // r[]
                // r[impl auth..login]
                int x = 1;
                """;

        ScannedFile file = scanner.scan("src/x.c", source, Set.of("r"));

        assertTrue(file.annotations().isEmpty());
        assertEquals(5, file.problems().size());
        assertTrue(file.problems().stream().allMatch(p -> p.kind() == ProblemKind.MALFORMED));
        assertTrue(file.problems().get(0).reason().contains("unknown verb"));
    }

    @Test
    void scan_ShouldFlagForeignPrefixOnlyWhenItLooksLikeAnnotation() {
        String source = """
                // q[impl auth.login]
                // values are in arr[i] and x[0]
                int y = 2;
                // q[verify login]
                """;

        ScannedFile file = scanner.scan("src/y.c", source, Set.of("r"));

        assertTrue(file.annotations().isEmpty());
        assertEquals(2, file.problems().size());
        AnnotationProblem problem = file.problems().get(0);
        assertEquals(ProblemKind.PREFIX_MISMATCH, problem.kind());
        assertEquals("q", problem.prefix());
        assertEquals(1, problem.line());
        assertEquals(ProblemKind.PREFIX_MISMATCH, file.problems().get(1).kind());
        assertEquals(4, file.problems().get(1).line());
    }

    @Test
    void scan_ShouldIgnoreBracketsInsideStrings() {
        String source = """
                fn main() {
                    let s = "// r[impl auth.login]";
                    let c = '{';
                }
                """;

        ScannedFile file = scanner.scan("src/main.rs", source, Set.of("r"));

        assertTrue(file.annotations().isEmpty());
        assertEquals(1, file.units().size());
        assertEquals(4, file.units().get(0).endLine());
    }

    @Test
    void scan_ShouldUseIndentationForPython() {
        String source = """
                import os

                # r[impl cfg.load]
                def load(path):
                    with open(path) as f:
                        return f.read()

                x = 1
                """;

        ScannedFile file = scanner.scan("app/config.py", source, Set.of("r"));

        assertEquals("python", file.language());
        CodeUnit unit = file.units().get(file.annotations().get(0).unitIndex());
        assertEquals(3, unit.startLine());
        assertEquals(6, unit.endLine());
        assertEquals(UnitKind.FUNCTION, unit.kind());
        assertEquals("load", unit.name());
    }

    @Test
    void scan_ShouldSynthesizeLineUnitOutsideDeclarations() {
        String source = """
                #!/bin/bash
                set -e

                # r[impl deploy.rollout]
                # r[verify deploy.check]
                kubectl apply -f app.yaml
                echo done
                """;

        ScannedFile file = scanner.scan("ops/deploy.sh", source, Set.of("r"));

        assertEquals(2, file.annotations().size());
        assertEquals(1, file.units().size());
        CodeUnit unit = file.units().get(0);
        assertEquals(UnitKind.LINE, unit.kind());
        assertEquals(4, unit.startLine());
        assertEquals(6, unit.endLine());
        assertEquals(0, file.annotations().get(0).unitIndex());
        assertEquals(0, file.annotations().get(1).unitIndex());
    }

    @Test
    void scan_ShouldNotTreatLambdasAndControlBlocksAsUnits() {
        String source = """
                function main() {
                  items.forEach((x) => {
                    if (x) {
                      log(x);
                    }
                  });
                  const handler = function () {
                    run();
                  };
                }
                """;

        ScannedFile file = scanner.scan("web/main.js", source, Set.of("r"));

        assertEquals(1, file.units().size());
        assertEquals("main", file.units().get(0).name());
        assertEquals(10, file.units().get(0).endLine());
    }

    @Test
    void scan_ShouldIgnoreMarkersInsideSingleQuotedAndTemplateStrings() {
        String source = """
                function fetchUser() {
                  const url = 'http://example.com/r[impl auth.login]';
                  const tpl = `// r[impl auth.logout]`;
                  return get(url); // r[impl auth.fetch]
                }
                """;

        ScannedFile file = scanner.scan("src/a.js", source, Set.of("r"));

        assertEquals("script", file.language());
        assertEquals(1, file.annotations().size());
        assertEquals("auth.fetch", file.annotations().get(0).ruleId());
        assertEquals(4, file.annotations().get(0).line());
        assertTrue(file.problems().isEmpty());
    }

    @Test
    void scan_ShouldIgnoreHashInsideSingleQuotedPythonString() {
        String source = """
                def color():
                    return '#r[impl ui.color]'
                """;

        ScannedFile file = scanner.scan("src/ui.py", source, Set.of("r"));

        assertTrue(file.annotations().isEmpty());
    }

    @Test
    void scan_ShouldFallBackToGenericProfileForUnknownExtensions() {
        String source = """
                # r[impl gen.hash]
                step one
                // r[impl gen.slash]
                step two
                """;

        ScannedFile file = scanner.scan("build/steps.xyz", source, Set.of("r"));

        assertEquals("generic", file.language());
        assertEquals(2, file.annotations().size());
    }

    @Test
    void scan_ShouldHonourExtensionOverrides() {
        LexicalAnnotationScanner custom = new LexicalAnnotationScanner(new LanguageTable(Map.of("tpl", "hash")));

        ScannedFile file = custom.scan("views/page.tpl", "# r[impl view.page]\nrender\n", Set.of("r"));

        assertEquals("hash", file.language());
        assertEquals(1, file.annotations().size());
    }
}
