package com.vidnyan.reqtrace.domain.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FingerprintsTest {

    @Test
    void of_ShouldIgnoreWhitespaceLayout() {
        String print = Fingerprints.of("Users  MUST\n\tlog in.");

        assertEquals(Fingerprints.LENGTH, print.length());
        assertTrue(print.matches("[0-9a-f]{8}"));
        assertEquals(print, Fingerprints.of(" Users MUST log in. "));
        assertNotEquals(print, Fingerprints.of("Users MUST log out."));
    }

    @Test
    void isValidCaptured_ShouldAcceptFourToEightHexChars() {
        assertTrue(Fingerprints.isValidCaptured("abcd"));
        assertTrue(Fingerprints.isValidCaptured("ABCDEF01"));
        assertFalse(Fingerprints.isValidCaptured("abc"));
        assertFalse(Fingerprints.isValidCaptured("abcdef012"));
        assertFalse(Fingerprints.isValidCaptured("wxyz"));
        assertFalse(Fingerprints.isValidCaptured(null));
    }

    @Test
    void matches_ShouldCompareCaseInsensitivePrefix() {
        assertTrue(Fingerprints.matches("1a2b3c4d", "1A2B"));
        assertTrue(Fingerprints.matches("1a2b3c4d", "1a2b3c4d"));
        assertFalse(Fingerprints.matches("1a2b3c4d", "2b3c"));
    }

    @Test
    void ruleId_ShouldRequireDotSeparatedSegments() {
        assertTrue(Rule.isValidId("auth.login.rate-limit"));
        assertTrue(Rule.isValidId("single"));
        assertFalse(Rule.isValidId("auth..login"));
        assertFalse(Rule.isValidId(".auth"));
        assertFalse(Rule.isValidId("auth login"));
    }
}
