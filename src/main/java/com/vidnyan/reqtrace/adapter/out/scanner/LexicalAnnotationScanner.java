package com.vidnyan.reqtrace.adapter.out.scanner;

import com.vidnyan.reqtrace.adapter.out.scanner.AnnotationGrammar.Parsed;
import com.vidnyan.reqtrace.adapter.out.scanner.AnnotationGrammar.Token;
import com.vidnyan.reqtrace.adapter.out.scanner.LanguageProfile.Boundary;
import com.vidnyan.reqtrace.adapter.out.scanner.unit.BraceBlockStrategy;
import com.vidnyan.reqtrace.adapter.out.scanner.unit.IndentBlockStrategy;
import com.vidnyan.reqtrace.adapter.out.scanner.unit.SingleLineStrategy;
import com.vidnyan.reqtrace.adapter.out.scanner.unit.UnitBoundaryStrategy;
import com.vidnyan.reqtrace.adapter.out.scanner.unit.Units;
import com.vidnyan.reqtrace.application.port.out.SourceScanner;
import com.vidnyan.reqtrace.config.ReqTraceProperties;
import com.vidnyan.reqtrace.domain.model.CodeUnit;
import com.vidnyan.reqtrace.domain.model.UnitKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Comment-syntax driven scanner: finds annotations in comments and the code units they annotate.
 * Stateless; safe to call from several threads.
 */
@Slf4j
@Component
public class LexicalAnnotationScanner implements SourceScanner {

    private final LanguageTable languages;
    private final Map<Boundary, UnitBoundaryStrategy> strategies = new EnumMap<>(Boundary.class);

    @Autowired
    public LexicalAnnotationScanner(ReqTraceProperties properties) {
        this(new LanguageTable(properties.getScan().getExtensions()));
    }

    public LexicalAnnotationScanner(LanguageTable languages) {
        this.languages = languages;
        strategies.put(Boundary.BRACE, new BraceBlockStrategy());
        strategies.put(Boundary.INDENT, new IndentBlockStrategy());
        strategies.put(Boundary.SINGLE_LINE, new SingleLineStrategy());
    }

    @Override
    public ScannedFile scan(String path, String content, Set<String> ownedPrefixes) {
        LanguageProfile profile = languages.forPath(path);
        List<String> lines = content.lines().toList();
        List<LexedLine> lexed = new CommentLexer(profile).lex(lines);

        List<Found> found = new ArrayList<>();
        List<AnnotationProblem> problems = new ArrayList<>();
        for (LexedLine line : lexed) {
            for (String comment : line.comments()) {
                for (Token token : AnnotationGrammar.tokens(comment)) {
                    collect(token, line.number(), ownedPrefixes, found, problems);
                }
            }
        }

        List<CodeUnit> units = new ArrayList<>(strategies.get(profile.boundary()).detect(path, lexed));
        for (Found annotation : found) {
            if (innermost(units, annotation.line()) < 0) {
                units.add(lineUnit(path, lexed, units, annotation.line()));
            }
        }
        units.sort(Units.ORDER);

        List<ScannedAnnotation> annotations = new ArrayList<>(found.size());
        for (Found f : found) {
            Parsed p = f.parsed();
            annotations.add(new ScannedAnnotation(f.prefix(), p.verb(), p.ruleId(), p.fingerprint(),
                    f.line(), innermost(units, f.line())));
        }

        if (!annotations.isEmpty() || !problems.isEmpty()) {
            log.debug("{} [{}]: {} units, {} annotations, {} problems",
                    path, profile.tag(), units.size(), annotations.size(), problems.size());
        }
        return new ScannedFile(path, profile.tag(), lines, units, annotations, problems);
    }

    private void collect(Token token, int line, Set<String> ownedPrefixes,
                         List<Found> found, List<AnnotationProblem> problems) {
        Parsed parsed = AnnotationGrammar.parse(token.body());
        if (ownedPrefixes.contains(token.prefix())) {
            if (parsed.isValid()) {
                found.add(new Found(token.prefix(), parsed, line));
            } else {
                problems.add(new AnnotationProblem(ProblemKind.MALFORMED, token.prefix(), token.text(),
                        line, parsed.error()));
            }
        } else if (AnnotationGrammar.looksLikeAnnotation(parsed)) {
            problems.add(new AnnotationProblem(ProblemKind.PREFIX_MISMATCH, token.prefix(), token.text(),
                    line, "prefix '" + token.prefix() + "' is not owned by any spec covering this file"));
        }
    }

    /**
     * Index of the smallest unit containing the line, or -1.
     */
    private static int innermost(List<CodeUnit> units, int line) {
        int best = -1;
        for (int i = 0; i < units.size(); i++) {
            CodeUnit unit = units.get(i);
            if (unit.contains(line) && (best < 0 || unit.span() < units.get(best).span())) {
                best = i;
            }
        }
        return best;
    }

    /**
     * The annotation's comment block plus the code line right after it, if that line is free.
     */
    private static CodeUnit lineUnit(String path, List<LexedLine> lines, List<CodeUnit> units, int line) {
        LexedLine at = lines.get(line - 1);
        if (at.hasCode()) {
            return CodeUnit.of(path, line, line, UnitKind.LINE, null);
        }
        int start = line;
        while (start > 1 && lines.get(start - 2).isCommentOnly() && innermost(units, start - 1) < 0) {
            start--;
        }
        int end = line;
        while (end < lines.size() && lines.get(end).isCommentOnly() && innermost(units, end + 1) < 0) {
            end++;
        }
        if (end < lines.size() && lines.get(end).hasCode() && innermost(units, end + 1) < 0) {
            end++;
        }
        return CodeUnit.of(path, start, end, UnitKind.LINE, null);
    }

    private record Found(String prefix, Parsed parsed, int line) {}
}
