package com.vidnyan.reqtrace.adapter.out.scanner;

import com.vidnyan.reqtrace.adapter.out.scanner.AnnotationGrammar.Parsed;
import com.vidnyan.reqtrace.adapter.out.scanner.AnnotationGrammar.Token;
import com.vidnyan.reqtrace.domain.model.RefVerb;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AnnotationGrammarTest {

    @Test
    void parse_ShouldDefaultToImplVerb() {
        Parsed parsed = AnnotationGrammar.parse("auth.login");

        assertTrue(parsed.isValid());
        assertEquals(RefVerb.IMPL, parsed.verb());
        assertEquals("auth.login", parsed.ruleId());
        assertNull(parsed.fingerprint());
    }

    @Test
    void parse_ShouldSplitFingerprint() {
        Parsed parsed = AnnotationGrammar.parse(" verify auth.login@ABCD ");

        assertTrue(parsed.isValid());
        assertEquals(RefVerb.VERIFY, parsed.verb());
        assertEquals("auth.login", parsed.ruleId());
        assertEquals("ABCD", parsed.fingerprint());
    }

    @Test
    void parse_ShouldRejectBadBodies() {
        assertFalse(AnnotationGrammar.parse("").isValid());
        assertFalse(AnnotationGrammar.parse("impl").isValid());
        assertFalse(AnnotationGrammar.parse("Impl auth.login").isValid());
        assertFalse(AnnotationGrammar.parse("impl auth.login extra").isValid());
        assertFalse(AnnotationGrammar.parse("auth.login@abc").isValid());
        assertFalse(AnnotationGrammar.parse("auth.login@123456789").isValid());
        assertFalse(AnnotationGrammar.parse("@abcd").isValid());
        assertFalse(AnnotationGrammar.parse("auth login!").isValid());
    }

    @Test
    void tokens_ShouldRequireWordBoundaryBeforePrefix() {
        List<Token> tokens = AnnotationGrammar.tokens(" see r[impl a.b] and xr[c.d], r[e.f]");

        assertEquals(3, tokens.size());
        assertEquals("r", tokens.get(0).prefix());
        assertEquals("impl a.b", tokens.get(0).body());
        assertEquals("xr", tokens.get(1).prefix());
        assertEquals("r[e.f]", tokens.get(2).text());
    }

    @Test
    void looksLikeAnnotation_ShouldRequireDottedIdOrExplicitVerb() {
        assertTrue(AnnotationGrammar.looksLikeAnnotation(AnnotationGrammar.parse("a.b")));
        assertTrue(AnnotationGrammar.looksLikeAnnotation(AnnotationGrammar.parse("verify login")));
        assertFalse(AnnotationGrammar.looksLikeAnnotation(AnnotationGrammar.parse("login")));
        assertFalse(AnnotationGrammar.looksLikeAnnotation(AnnotationGrammar.parse("0")));
        assertFalse(AnnotationGrammar.looksLikeAnnotation(AnnotationGrammar.parse("a b c")));
    }
}
