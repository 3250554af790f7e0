package com.vidnyan.reqtrace.adapter.out.scanner;

import com.vidnyan.reqtrace.adapter.out.scanner.LanguageProfile.BlockMarker;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits source lines into code and comment text for one language profile.
 * Strings opened by one of the profile's quote characters are skipped, and so are simple
 * character literals where {@code '} is not a quote. Strings do not span lines.
 * Not thread-safe; create one per file.
 */
public class CommentLexer {

    private final LanguageProfile profile;
    private BlockMarker openBlock;

    public CommentLexer(LanguageProfile profile) {
        this.profile = profile;
    }

    public List<LexedLine> lex(List<String> lines) {
        List<LexedLine> result = new ArrayList<>(lines.size());
        openBlock = null;
        for (int i = 0; i < lines.size(); i++) {
            result.add(lexLine(i + 1, lines.get(i)));
        }
        return result;
    }

    private LexedLine lexLine(int number, String line) {
        StringBuilder code = new StringBuilder(line.length());
        List<String> comments = new ArrayList<>();
        int i = 0;
        int n = line.length();

        while (i < n) {
            if (openBlock != null) {
                int close = line.indexOf(openBlock.close(), i);
                int end = close < 0 ? n : close;
                comments.add(line.substring(i, end));
                if (close < 0) {
                    pad(code, n - i);
                    i = n;
                } else {
                    pad(code, end + openBlock.close().length() - i);
                    i = end + openBlock.close().length();
                    openBlock = null;
                }
                continue;
            }

            char c = line.charAt(i);
            if (profile.isQuote(c)) {
                int end = stringEnd(line, i);
                code.append(c);
                pad(code, end - i - 1);
                i = end;
                continue;
            }
            if (c == '\'') {
                int end = charLiteralEnd(line, i);
                if (end > 0) {
                    code.append('\'');
                    pad(code, end - i - 1);
                    i = end;
                    continue;
                }
            }

            BlockMarker block = blockAt(line, i);
            if (block != null) {
                openBlock = block;
                pad(code, block.open().length());
                i += block.open().length();
                if (i >= n) {
                    // a bare opener still makes this a comment line
                    comments.add("");
                }
                continue;
            }
            String marker = lineMarkerAt(line, i);
            if (marker != null) {
                comments.add(line.substring(i + marker.length()));
                pad(code, n - i);
                break;
            }

            code.append(c);
            i++;
        }
        return new LexedLine(number, line, code.toString(), comments);
    }

    /**
     * Index just past the closing quote, or the end of the line when unterminated.
     */
    private static int stringEnd(String line, int open) {
        char quote = line.charAt(open);
        int i = open + 1;
        while (i < line.length()) {
            char c = line.charAt(i);
            if (c == '\\') {
                i += 2;
            } else if (c == quote) {
                return i + 1;
            } else {
                i++;
            }
        }
        return line.length();
    }

    /**
     * Index past a literal like {@code 'x'} or {@code '\n'}, or -1 when the quote starts nothing of the kind.
     */
    private static int charLiteralEnd(String line, int open) {
        int n = line.length();
        if (open + 2 < n && line.charAt(open + 1) != '\\' && line.charAt(open + 2) == '\'') {
            return open + 3;
        }
        if (open + 1 < n && line.charAt(open + 1) == '\\') {
            int close = line.indexOf('\'', open + 3);
            if (close > 0 && close - open <= 10) {
                return close + 1;
            }
        }
        return -1;
    }

    private BlockMarker blockAt(String line, int i) {
        for (BlockMarker block : profile.blockMarkers()) {
            if (line.startsWith(block.open(), i)) {
                return block;
            }
        }
        return null;
    }

    private String lineMarkerAt(String line, int i) {
        for (String marker : profile.lineMarkers()) {
            if (line.startsWith(marker, i)) {
                return marker;
            }
        }
        return null;
    }

    private static void pad(StringBuilder code, int count) {
        for (int k = 0; k < count; k++) {
            code.append(' ');
        }
    }
}
