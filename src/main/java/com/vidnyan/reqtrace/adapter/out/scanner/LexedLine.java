package com.vidnyan.reqtrace.adapter.out.scanner;

import java.util.List;

/**
 * One source line split into code and comment text.
 *
 * @param number   1-based line number
 * @param raw      original text
 * @param code     text with comments removed and string contents blanked; columns are preserved
 * @param comments comment fragments found on the line, in column order
 */
public record LexedLine(
    int number,
    String raw,
    String code,
    List<String> comments
) {

    public LexedLine {
        comments = List.copyOf(comments);
    }

    public boolean hasCode() {
        return !code.isBlank();
    }

    public boolean hasComment() {
        return !comments.isEmpty();
    }

    public boolean isCommentOnly() {
        return hasComment() && !hasCode();
    }

    public boolean isBlank() {
        return raw.isBlank();
    }

    /**
     * Annotation-style lines such as {@code @Override} or {@code #[test]} that belong to the next declaration.
     */
    public boolean isDecorator() {
        String trimmed = code.trim();
        return (trimmed.startsWith("@") && !trimmed.startsWith("@interface")) || trimmed.startsWith("#[");
    }

    /**
     * Leading whitespace width, tabs counted as four columns.
     */
    public int indent() {
        int width = 0;
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c == ' ') {
                width++;
            } else if (c == '\t') {
                width += 4;
            } else {
                break;
            }
        }
        return width;
    }
}
