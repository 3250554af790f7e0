package com.vidnyan.reqtrace.adapter.out.scanner.unit;

import com.vidnyan.reqtrace.adapter.out.scanner.LexedLine;
import com.vidnyan.reqtrace.domain.model.CodeUnit;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;

/**
 * Helpers shared by the boundary strategies.
 */
public final class Units {

    /**
     * Start line ascending, widest first.
     */
    public static final Comparator<CodeUnit> ORDER = Comparator
            .comparingInt(CodeUnit::startLine)
            .thenComparing(Comparator.comparingInt(CodeUnit::endLine).reversed());

    private Units() {
    }

    /**
     * Move a header start up over the doc comments and decorators directly above it.
     */
    public static int extendUpward(List<LexedLine> lines, int headerLine) {
        int start = headerLine;
        while (start > 1) {
            LexedLine above = lines.get(start - 2);
            if (above.isCommentOnly() || above.isDecorator()) {
                start--;
            } else {
                break;
            }
        }
        return start;
    }

    /**
     * Sort and drop units that partially overlap one kept earlier; identical spans keep the first.
     */
    public static List<CodeUnit> nestOnly(List<CodeUnit> units) {
        List<CodeUnit> sorted = new ArrayList<>(units);
        sorted.sort(ORDER);

        List<CodeUnit> kept = new ArrayList<>();
        Deque<CodeUnit> open = new ArrayDeque<>();
        for (CodeUnit unit : sorted) {
            while (!open.isEmpty() && open.peek().endLine() < unit.startLine()) {
                open.pop();
            }
            CodeUnit parent = open.peek();
            if (parent != null && (unit.endLine() > parent.endLine()
                    || (unit.startLine() == parent.startLine() && unit.endLine() == parent.endLine()))) {
                continue;
            }
            kept.add(unit);
            open.push(unit);
        }
        return kept;
    }
}
