package com.vidnyan.reqtrace.adapter.out.scanner;

import com.vidnyan.reqtrace.adapter.out.scanner.LanguageProfile.BlockMarker;
import com.vidnyan.reqtrace.adapter.out.scanner.LanguageProfile.Boundary;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * File extension to language profile lookup.
 * Built-in mappings can be extended or overridden with {@code reqtrace.scan.extensions}.
 */
@Slf4j
public class LanguageTable {

    private static final BlockMarker C_BLOCK = new BlockMarker("/*", "*/");

    public static final LanguageProfile C_FAMILY =
            new LanguageProfile("c-family", List.of("//"), List.of(C_BLOCK), "\"", Boundary.BRACE);
    public static final LanguageProfile SCRIPT =
            new LanguageProfile("script", List.of("//"), List.of(C_BLOCK), "\"'`", Boundary.BRACE);
    public static final LanguageProfile PYTHON =
            new LanguageProfile("python", List.of("#"), List.of(), "\"'", Boundary.INDENT);
    public static final LanguageProfile RUBY =
            new LanguageProfile("ruby", List.of("#"), List.of(new BlockMarker("=begin", "=end")), "\"'", Boundary.INDENT);
    public static final LanguageProfile LUA =
            new LanguageProfile("lua", List.of("--"), List.of(new BlockMarker("--[[", "]]")), "\"'", Boundary.INDENT);
    public static final LanguageProfile HASH =
            new LanguageProfile("hash", List.of("#"), List.of(), "\"'", Boundary.SINGLE_LINE);
    public static final LanguageProfile DASH =
            new LanguageProfile("dash", List.of("--"), List.of(C_BLOCK, new BlockMarker("{-", "-}")), "\"", Boundary.SINGLE_LINE);
    public static final LanguageProfile SEMICOLON =
            new LanguageProfile("semicolon", List.of(";"), List.of(), "\"", Boundary.SINGLE_LINE);
    public static final LanguageProfile MARKUP =
            new LanguageProfile("markup", List.of(), List.of(new BlockMarker("<!--", "-->")), "", Boundary.SINGLE_LINE);
    public static final LanguageProfile GENERIC =
            new LanguageProfile("generic", List.of("//", "#"), List.of(C_BLOCK), "\"", Boundary.BRACE);

    private static final Map<String, LanguageProfile> BY_TAG = new LinkedHashMap<>();

    static {
        for (LanguageProfile p : List.of(C_FAMILY, SCRIPT, PYTHON, RUBY, LUA, HASH, DASH, SEMICOLON, MARKUP, GENERIC)) {
            BY_TAG.put(p.tag(), p);
        }
    }

    private final Map<String, LanguageProfile> byExtension = new HashMap<>();

    public LanguageTable() {
        this(Map.of());
    }

    /**
     * @param overrides extension (without dot) to profile tag
     */
    public LanguageTable(Map<String, String> overrides) {
        register(C_FAMILY, "java", "kt", "kts", "scala", "groovy", "gradle", "c", "h", "cc", "cpp", "cxx",
                "hh", "hpp", "cs", "go", "rs", "swift", "zig", "proto", "m", "mm", "sol", "v");
        register(SCRIPT, "js", "jsx", "mjs", "cjs", "ts", "tsx", "dart", "php");
        register(PYTHON, "py", "pyi");
        register(RUBY, "rb", "rake");
        register(LUA, "lua");
        register(HASH, "sh", "bash", "zsh", "fish", "yaml", "yml", "toml", "ini", "cfg", "conf", "r",
                "pl", "pm", "mk", "cmake", "dockerfile", "tf", "nix", "ex", "exs");
        register(DASH, "sql", "hs", "elm", "ada", "adb");
        register(SEMICOLON, "clj", "cljs", "cljc", "el", "lisp", "scm", "rkt", "asm", "s");
        register(MARKUP, "html", "htm", "xml", "xhtml", "vue", "svelte", "md");

        overrides.forEach((extension, tag) -> {
            LanguageProfile profile = BY_TAG.get(tag);
            if (profile == null) {
                log.warn("Unknown language profile '{}' for extension '{}', known: {}", tag, extension, BY_TAG.keySet());
                return;
            }
            byExtension.put(normalizeExtension(extension), profile);
        });
    }

    /**
     * Profile for a project-relative path; the generic profile when the extension is unknown.
     */
    public LanguageProfile forPath(String path) {
        String name = path.substring(path.lastIndexOf('/') + 1);
        int dot = name.lastIndexOf('.');
        String extension = dot < 0 ? name : name.substring(dot + 1);
        return byExtension.getOrDefault(normalizeExtension(extension), GENERIC);
    }

    private void register(LanguageProfile profile, String... extensions) {
        for (String extension : extensions) {
            byExtension.put(extension, profile);
        }
    }

    private static String normalizeExtension(String extension) {
        String e = extension.trim().toLowerCase(Locale.ROOT);
        return e.startsWith(".") ? e.substring(1) : e;
    }
}
