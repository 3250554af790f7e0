package com.vidnyan.reqtrace.adapter.out.scanner.unit;

import com.vidnyan.reqtrace.adapter.out.scanner.LexedLine;
import com.vidnyan.reqtrace.domain.model.CodeUnit;
import com.vidnyan.reqtrace.domain.model.UnitKind;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Units for curly-brace languages.
 *
 * <p>A brace block becomes a unit when its header looks like a declaration: it contains a
 * declaration keyword, or it is a call-like signature {@code name(...)} that does not start with a
 * control keyword. Control-flow blocks, lambdas and initializers are not units.
 */
public class BraceBlockStrategy implements UnitBoundaryStrategy {

    private static final int MAX_HEADER_LINES = 20;

    private static final Map<String, UnitKind> DECLARATION_KEYWORDS = Map.ofEntries(
            Map.entry("fn", UnitKind.FUNCTION),
            Map.entry("function", UnitKind.FUNCTION),
            Map.entry("func", UnitKind.FUNCTION),
            Map.entry("fun", UnitKind.FUNCTION),
            Map.entry("def", UnitKind.FUNCTION),
            Map.entry("class", UnitKind.TYPE),
            Map.entry("struct", UnitKind.TYPE),
            Map.entry("enum", UnitKind.TYPE),
            Map.entry("interface", UnitKind.TYPE),
            Map.entry("trait", UnitKind.TYPE),
            Map.entry("impl", UnitKind.TYPE),
            Map.entry("record", UnitKind.TYPE),
            Map.entry("object", UnitKind.TYPE),
            Map.entry("union", UnitKind.TYPE),
            Map.entry("type", UnitKind.TYPE),
            Map.entry("protocol", UnitKind.TYPE),
            Map.entry("extension", UnitKind.TYPE),
            Map.entry("namespace", UnitKind.BLOCK),
            Map.entry("module", UnitKind.BLOCK),
            Map.entry("mod", UnitKind.BLOCK));

    private static final Set<String> CONTROL_KEYWORDS = Set.of(
            "if", "else", "elif", "for", "foreach", "while", "do", "switch", "match", "when", "select",
            "try", "catch", "finally", "loop", "return", "throw", "yield", "synchronized", "using",
            "lock", "with", "defer", "go", "new", "unless", "until");

    private static final Pattern WORD = Pattern.compile("[A-Za-z_$][\\w$]*");
    private static final Pattern ANNOTATION = Pattern.compile("@[\\w.]+(\\([^)]*\\))?");
    private static final Pattern CALL = Pattern.compile("([A-Za-z_$][\\w$]*)\\s*(?:<[^<>]*>)?\\s*\\(");
    private static final Set<String> CONTINUATION_WORDS = Set.of("throws", "extends", "implements", "where");
    private static final List<String> CONTINUATION_STARTS = List.of(")", "]", ".", "->", "=>", ":", "&&", "||", "+", "?");
    private static final List<String> OPEN_ENDINGS = List.of(",", "(", "[", "=", "->", "=>", ":", "&&", "||", "+",
            "-", ".", "<", "|", "&", "?");
    private static final Pattern NAME_AFTER_KEYWORD = Pattern.compile("^\\s*(?:\\([^)]*\\)\\s*|<[^>]*>\\s*)*([A-Za-z_$][\\w$]*)");

    @Override
    public List<CodeUnit> detect(String path, List<LexedLine> lines) {
        List<CodeUnit> units = new ArrayList<>();
        Deque<int[]> open = new ArrayDeque<>();

        for (LexedLine line : lines) {
            String code = line.code();
            for (int col = 0; col < code.length(); col++) {
                char c = code.charAt(col);
                if (c == '{') {
                    open.push(new int[] {line.number(), col});
                } else if (c == '}' && !open.isEmpty()) {
                    int[] brace = open.pop();
                    CodeUnit unit = toUnit(path, lines, brace[0], brace[1], line.number());
                    if (unit != null) {
                        units.add(unit);
                    }
                }
            }
        }
        return Units.nestOnly(units);
    }

    private CodeUnit toUnit(String path, List<LexedLine> lines, int braceLine, int braceCol, int closeLine) {
        Header header = header(lines, braceLine, braceCol);
        Declaration declaration = classify(header.text());
        if (declaration == null) {
            return null;
        }
        int start = Units.extendUpward(lines, header.startLine());
        return CodeUnit.of(path, start, closeLine, declaration.kind(), declaration.name());
    }

    /**
     * Header text before an opening brace, following continuation lines upward.
     */
    Header header(List<LexedLine> lines, int braceLine, int braceCol) {
        String onLine = lines.get(braceLine - 1).code().substring(0, braceCol);
        int cut = lastDelimiter(onLine);
        StringBuilder text = new StringBuilder(onLine.substring(cut + 1));
        int startLine = braceLine;

        if (cut < 0) {
            for (int n = braceLine - 1; n >= 1 && braceLine - n <= MAX_HEADER_LINES; n--) {
                LexedLine previous = lines.get(n - 1);
                if (!previous.hasCode()) {
                    break;
                }
                String code = previous.code();
                String trimmed = code.trim();
                if (trimmed.endsWith(";") || trimmed.endsWith("{") || trimmed.endsWith("}")
                        || trimmed.startsWith("#")) {
                    break;
                }
                if (!text.toString().isBlank() && isComplete(trimmed) && !continuesAbove(text.toString())) {
                    // a finished statement above, e.g. Kotlin's "val x = load()" with no semicolon
                    break;
                }
                int previousCut = lastDelimiter(code);
                text.insert(0, code.substring(previousCut + 1) + " ");
                startLine = n;
                if (previousCut >= 0) {
                    break;
                }
            }
        }
        if (text.toString().isBlank()) {
            startLine = braceLine;
        }
        return new Header(text.toString(), startLine);
    }

    /**
     * Declaration kind and name, or null when the header does not declare anything.
     */
    Declaration classify(String rawHeader) {
        String header = ANNOTATION.matcher(rawHeader).replaceAll(" ").trim();
        if (header.isEmpty() || depthAt(header, header.length()) != 0) {
            // an open paren means the block is an argument, e.g. a callback
            return null;
        }
        Matcher first = WORD.matcher(header);
        if (!first.find() || CONTROL_KEYWORDS.contains(first.group())) {
            return null;
        }

        Matcher word = WORD.matcher(header);
        while (word.find()) {
            UnitKind kind = DECLARATION_KEYWORDS.get(word.group());
            if (kind == null || depthAt(header, word.start()) != 0
                    || isCalled(header, word) || hasAssignmentBefore(header, word.start())) {
                continue;
            }
            Matcher name = NAME_AFTER_KEYWORD.matcher(header.substring(word.end()));
            String declared = name.find() ? name.group(1) : null;
            if (kind == UnitKind.FUNCTION && declared == null) {
                return null;
            }
            return new Declaration(kind, declared);
        }

        if (header.endsWith("=") || header.endsWith("=>") || header.endsWith("->") || header.endsWith(",")) {
            return null;
        }
        if (hasAssignmentBefore(header, header.length()) || header.matches("(?s).*\\bnew\\b.*")) {
            return null;
        }
        String call = firstCallName(header);
        return call == null ? null : new Declaration(UnitKind.FUNCTION, call);
    }

    /**
     * {@code object(} or {@code type(} is a call of something named like a keyword; Go's {@code func (r T)} is not.
     */
    private static boolean isCalled(String header, Matcher word) {
        if (word.group().equals("func")) {
            return false;
        }
        int i = word.end();
        while (i < header.length() && header.charAt(i) == ' ') {
            i++;
        }
        return i < header.length() && header.charAt(i) == '(';
    }

    private static String firstCallName(String header) {
        Matcher m = CALL.matcher(header);
        while (m.find()) {
            String name = m.group(1);
            if (!CONTROL_KEYWORDS.contains(name) && !DECLARATION_KEYWORDS.containsKey(name)) {
                return name;
            }
        }
        return null;
    }

    private static int depthAt(String header, int end) {
        int depth = 0;
        for (int i = 0; i < end; i++) {
            char c = header.charAt(i);
            if (c == '(' || c == '[') {
                depth++;
            } else if (c == ')' || c == ']') {
                depth--;
            }
        }
        return depth;
    }

    /**
     * An {@code =} outside brackets, other than a comparison or arrow, before {@code end}.
     */
    private static boolean hasAssignmentBefore(String header, int end) {
        int depth = 0;
        for (int i = 0; i < end; i++) {
            char c = header.charAt(i);
            if (c == '(' || c == '[') {
                depth++;
            } else if (c == ')' || c == ']') {
                depth--;
            } else if (c == '=' && depth == 0) {
                char before = i > 0 ? header.charAt(i - 1) : ' ';
                char after = i + 1 < header.length() ? header.charAt(i + 1) : ' ';
                if ("=!<>".indexOf(before) < 0 && after != '=' && after != '>') {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Bracket-balanced line that does not end in an operator or separator.
     */
    private static boolean isComplete(String trimmed) {
        if (depthAt(trimmed, trimmed.length()) != 0) {
            return false;
        }
        return OPEN_ENDINGS.stream().noneMatch(trimmed::endsWith);
    }

    /**
     * Header text that can only be the tail of a longer signature.
     */
    private static boolean continuesAbove(String text) {
        String trimmed = text.trim();
        if (CONTINUATION_STARTS.stream().anyMatch(trimmed::startsWith)) {
            return true;
        }
        Matcher first = WORD.matcher(trimmed);
        return first.lookingAt() && CONTINUATION_WORDS.contains(first.group());
    }

    private static int lastDelimiter(String code) {
        return Math.max(code.lastIndexOf(';'), Math.max(code.lastIndexOf('{'), code.lastIndexOf('}')));
    }

    record Header(String text, int startLine) {}

    record Declaration(UnitKind kind, String name) {}
}
