package com.vidnyan.reqtrace.adapter.out.scanner.unit;

import com.vidnyan.reqtrace.adapter.out.scanner.LexedLine;
import com.vidnyan.reqtrace.domain.model.CodeUnit;
import com.vidnyan.reqtrace.domain.model.UnitKind;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Units for indentation-scoped languages.
 * A {@code def}/{@code class}/{@code function} header owns every following line indented deeper than
 * itself, plus a closing {@code end} at its own indentation (Ruby, Lua).
 */
public class IndentBlockStrategy implements UnitBoundaryStrategy {

    private static final Pattern HEADER = Pattern.compile(
            "^\\s*(?:(?:async|local|export|pub|private|public|protected|static)\\s+)*"
                    + "(def|class|fn|function|module|struct|enum|trait|impl)\\b\\s*([A-Za-z_][\\w.!?]*)?");
    private static final Pattern END = Pattern.compile("^\\s*end\\b.*");

    @Override
    public List<CodeUnit> detect(String path, List<LexedLine> lines) {
        List<CodeUnit> units = new ArrayList<>();
        for (LexedLine line : lines) {
            if (!line.hasCode()) {
                continue;
            }
            Matcher m = HEADER.matcher(line.code());
            if (!m.find()) {
                continue;
            }
            int end = bodyEnd(lines, line);
            int start = Units.extendUpward(lines, line.number());
            units.add(CodeUnit.of(path, start, end, kindOf(m.group(1)), m.group(2)));
        }
        return Units.nestOnly(units);
    }

    /**
     * Last line of the body: the last deeper-indented code line, or the matching {@code end}.
     */
    private static int bodyEnd(List<LexedLine> lines, LexedLine header) {
        int indent = header.indent();
        int end = header.number();
        for (int n = header.number() + 1; n <= lines.size(); n++) {
            LexedLine line = lines.get(n - 1);
            if (!line.hasCode()) {
                continue;
            }
            if (line.indent() > indent) {
                end = n;
                continue;
            }
            if (line.indent() == indent && END.matcher(line.code()).matches()) {
                end = n;
            }
            break;
        }
        return end;
    }

    private static UnitKind kindOf(String keyword) {
        return switch (keyword) {
            case "def", "fn", "function" -> UnitKind.FUNCTION;
            case "module" -> UnitKind.BLOCK;
            default -> UnitKind.TYPE;
        };
    }
}
