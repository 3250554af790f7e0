package com.vidnyan.reqtrace.application.service;

import com.vidnyan.reqtrace.application.port.in.CoverageQueryUseCase.HitKind;
import com.vidnyan.reqtrace.application.port.in.CoverageQueryUseCase.SearchHit;
import com.vidnyan.reqtrace.domain.index.CoverageSnapshot;
import com.vidnyan.reqtrace.domain.index.FileEntry;
import com.vidnyan.reqtrace.domain.index.SpecIndex;
import com.vidnyan.reqtrace.domain.model.Rule;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Ranked matching over rule ids and text and over source lines.
 *
 * <p>Exact id match scores 3, substring 2, fuzzy subsequence 1. Equal scores rank the shorter
 * match window first, then id or path, then line.
 */
final class SourceSearch {

    static final double EXACT = 3.0;
    static final double SUBSTRING = 2.0;
    static final double FUZZY = 1.0;

    private static final int MAX_FUZZY_SPREAD = 4;
    private static final int SNIPPET_LENGTH = 120;

    static final Comparator<SearchHit> RANK = Comparator
            .comparingDouble(SearchHit::score).reversed()
            .thenComparingInt(SearchHit::matchLength)
            .thenComparing(SearchHit::id)
            .thenComparingInt(SearchHit::line)
            .thenComparing(SearchHit::kind);

    private SourceSearch() {
    }

    static List<SearchHit> search(CoverageSnapshot snapshot, String query, int limit) {
        String needle = query.trim().toLowerCase(Locale.ROOT);
        List<SearchHit> hits = new ArrayList<>();

        for (SpecIndex spec : snapshot.forward().specs()) {
            for (List<Rule> declarations : spec.allDeclarations().values()) {
                for (Rule rule : declarations) {
                    ruleHit(rule, needle).ifPresent(hits::add);
                }
            }
        }
        for (FileEntry file : snapshot.reverse().files()) {
            List<String> lines = file.lines();
            for (int i = 0; i < lines.size(); i++) {
                SearchHit hit = sourceHit(file.path(), i + 1, lines.get(i), needle);
                if (hit != null) {
                    hits.add(hit);
                }
            }
        }

        hits.sort(RANK);
        return hits.size() > limit ? List.copyOf(hits.subList(0, limit)) : hits;
    }

    private static Optional<SearchHit> ruleHit(Rule rule, String needle) {
        String snippet = snippet(rule.text());
        if (rule.id().toLowerCase(Locale.ROOT).equals(needle)) {
            return Optional.of(hit(HitKind.RULE, rule, snippet, EXACT, needle.length()));
        }
        String haystack = (rule.id() + " " + rule.text()).toLowerCase(Locale.ROOT);
        int window = window(haystack, needle);
        if (window < 0) {
            return Optional.empty();
        }
        double score = haystack.contains(needle) ? SUBSTRING : FUZZY;
        return Optional.of(hit(HitKind.RULE, rule, snippet, score, window));
    }

    private static SearchHit sourceHit(String path, int line, String text, String needle) {
        String haystack = text.toLowerCase(Locale.ROOT);
        int window = window(haystack, needle);
        if (window < 0) {
            return null;
        }
        double score = haystack.contains(needle) ? SUBSTRING : FUZZY;
        return new SearchHit(HitKind.SOURCE, path, line, snippet(text.trim()), score, window);
    }

    private static SearchHit hit(HitKind kind, Rule rule, String snippet, double score, int window) {
        return new SearchHit(kind, rule.id(), rule.location().line(), snippet, score, window);
    }

    /**
     * Length of the matching window: the needle itself on a substring hit, the span of a
     * subsequence match otherwise, -1 when nothing matches closely enough.
     */
    static int window(String haystack, String needle) {
        if (haystack.contains(needle)) {
            return needle.length();
        }
        int best = -1;
        int first = haystack.indexOf(needle.charAt(0));
        while (first >= 0) {
            int pos = first;
            int matched = 1;
            while (matched < needle.length()) {
                pos = haystack.indexOf(needle.charAt(matched), pos + 1);
                if (pos < 0) {
                    break;
                }
                matched++;
            }
            if (pos < 0) {
                break;
            }
            int span = pos - first + 1;
            if (best < 0 || span < best) {
                best = span;
            }
            first = haystack.indexOf(needle.charAt(0), first + 1);
        }
        return best >= 0 && best <= needle.length() * MAX_FUZZY_SPREAD ? best : -1;
    }

    private static String snippet(String text) {
        String firstLine = text.lines().findFirst().orElse("").trim();
        return firstLine.length() > SNIPPET_LENGTH ? firstLine.substring(0, SNIPPET_LENGTH) + "..." : firstLine;
    }
}
