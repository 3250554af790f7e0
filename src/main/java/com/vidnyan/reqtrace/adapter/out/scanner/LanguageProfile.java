package com.vidnyan.reqtrace.adapter.out.scanner;

import java.util.List;

/**
 * Comment syntax and unit boundary style of a family of languages.
 *
 * @param tag          short name, e.g. {@code c-family}
 * @param lineMarkers  markers that start a comment running to end of line
 * @param blockMarkers open/close pairs of block comments
 * @param quotes       characters that open a string closed by the same character on the same line
 * @param boundary     how code units are found
 */
public record LanguageProfile(
    String tag,
    List<String> lineMarkers,
    List<BlockMarker> blockMarkers,
    String quotes,
    Boundary boundary
) {

    public LanguageProfile {
        lineMarkers = List.copyOf(lineMarkers);
        blockMarkers = List.copyOf(blockMarkers);
    }

    public boolean isQuote(char c) {
        return quotes.indexOf(c) >= 0;
    }

    public record BlockMarker(String open, String close) {}

    public enum Boundary {
        BRACE,
        INDENT,
        SINGLE_LINE
    }
}
