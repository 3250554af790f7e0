package com.vidnyan.reqtrace.adapter.out.scanner;

import com.vidnyan.reqtrace.domain.model.Fingerprints;
import com.vidnyan.reqtrace.domain.model.RefVerb;
import com.vidnyan.reqtrace.domain.model.Rule;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Grammar of {@code prefix[verb? rule.id@fingerprint?]} tokens inside comment text.
 */
public final class AnnotationGrammar {

    private static final Pattern TOKEN = Pattern.compile("(?<![A-Za-z0-9_\\-])([A-Za-z0-9_\\-]+)\\[([^\\[\\]]*)\\]");

    private AnnotationGrammar() {
    }

    /**
     * A bracket token found in a comment.
     *
     * @param prefix text before the bracket
     * @param body   text inside the bracket
     * @param text   the whole token, for reports
     */
    public record Token(String prefix, String body, String text) {}

    /**
     * Outcome of parsing a token body. Exactly one of {@code error} and {@code ruleId} is set.
     * {@code explicitVerb} records whether the body named its verb.
     */
    public record Parsed(RefVerb verb, boolean explicitVerb, String ruleId, String fingerprint, String error) {

        public boolean isValid() {
            return error == null;
        }

        static Parsed error(String reason) {
            return new Parsed(null, false, null, null, reason);
        }
    }

    public static List<Token> tokens(String comment) {
        List<Token> tokens = new ArrayList<>();
        Matcher m = TOKEN.matcher(comment);
        while (m.find()) {
            tokens.add(new Token(m.group(1), m.group(2), m.group()));
        }
        return tokens;
    }

    public static Parsed parse(String body) {
        String trimmed = body.trim();
        if (trimmed.isEmpty()) {
            return Parsed.error("empty rule id");
        }
        String[] parts = trimmed.split("\\s+");
        if (parts.length > 2) {
            return Parsed.error("expected [verb] rule-id, got " + parts.length + " words");
        }

        RefVerb verb = RefVerb.IMPL;
        String target = parts[0];
        if (parts.length == 2) {
            Optional<RefVerb> parsedVerb = RefVerb.fromToken(parts[0]);
            if (parsedVerb.isEmpty()) {
                return Parsed.error("unknown verb '" + parts[0] + "'");
            }
            verb = parsedVerb.get();
            target = parts[1];
        } else if (RefVerb.fromToken(parts[0]).isPresent()) {
            return Parsed.error("empty rule id after verb '" + parts[0] + "'");
        }

        String fingerprint = null;
        int at = target.indexOf('@');
        if (at >= 0) {
            fingerprint = target.substring(at + 1);
            target = target.substring(0, at);
            if (!Fingerprints.isValidCaptured(fingerprint)) {
                return Parsed.error("invalid fingerprint '" + fingerprint + "', expected 4-8 hex characters");
            }
        }
        if (target.isEmpty()) {
            return Parsed.error("empty rule id");
        }
        if (!Rule.isValidId(target)) {
            return Parsed.error("invalid rule id '" + target + "'");
        }
        return new Parsed(verb, parts.length == 2, target, fingerprint, null);
    }

    /**
     * Whether a token with a foreign prefix looks enough like an annotation to report:
     * a dotted id, or any id after a recognised verb.
     */
    public static boolean looksLikeAnnotation(Parsed parsed) {
        return parsed.isValid() && (parsed.explicitVerb() || parsed.ruleId().contains("."));
    }
}
