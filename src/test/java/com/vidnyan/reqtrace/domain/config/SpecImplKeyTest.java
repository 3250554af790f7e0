package com.vidnyan.reqtrace.domain.config;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;

class SpecImplKeyTest {

    @Test
    void parse_ShouldSplitOnLastSlash() {
        SpecImplKey key = SpecImplKey.parse("org/spec/rust");

        assertEquals("org/spec", key.spec());
        assertEquals("rust", key.impl());
        assertEquals("org/spec/rust", key.toString());
    }

    @Test
    void parse_ShouldRejectIncompleteKeys() {
        assertThrows(IllegalArgumentException.class, () -> SpecImplKey.parse("spec"));
        assertThrows(IllegalArgumentException.class, () -> SpecImplKey.parse("/impl"));
        assertThrows(IllegalArgumentException.class, () -> SpecImplKey.parse("spec/"));
        assertThrows(IllegalArgumentException.class, () -> SpecImplKey.parse(null));
    }

    @Test
    void compareTo_ShouldOrderBySpecThenImpl() {
        TreeSet<SpecImplKey> keys = new TreeSet<>(List.of(
                new SpecImplKey("b", "a"), new SpecImplKey("a", "z"), new SpecImplKey("a", "b")));

        assertEquals(List.of("a/b", "a/z", "b/a"), keys.stream().map(SpecImplKey::toString).toList());
    }
}
