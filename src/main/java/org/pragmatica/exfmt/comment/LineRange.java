package org.pragmatica.exfmt.comment;

import org.pragmatica.exfmt.ast.Ast;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * First and last source line found anywhere in a subtree.
 */
public record LineRange(int min, int max) {
    public static final int MIN_LINE = 0;
    public static final int MAX_LINE = 9_999_999;

    /**
     * Range of a subtree without any position. Inverted, so that widening it with any line yields that line.
     */
    public static final LineRange NONE = new LineRange(MAX_LINE, MIN_LINE);

    public boolean isNone() {
        return equals(NONE);
    }

    public LineRange include(int line) {
        return new LineRange(Math.min(min, line), Math.max(max, line));
    }

    public static LineRange of(Ast ast) {
        return of(List.of(ast));
    }

    public static LineRange of(List<? extends Ast> asts) {
        var min = MAX_LINE;
        var max = MIN_LINE;
        Deque<Ast> pending = new ArrayDeque<>(asts);

        while (!pending.isEmpty()) {
            var ast = pending.pop();

            if (ast.isNode()) {
                var line = ast.metaOrEmpty().line();
                if (line.isPresent()) {
                    min = Math.min(min, line.get());
                    max = Math.max(max, line.get());
                }
            }

            if (ast instanceof Ast.Call call) {
                pending.addAll(call.args());
            } else if (ast instanceof Ast.Apply apply) {
                pending.push(apply.target());
                pending.addAll(apply.args());
            } else if (ast instanceof Ast.Special special) {
                pending.addAll(special.args());
            } else if (ast instanceof Ast.ListLiteral list) {
                pending.addAll(list.elements());
            } else if (ast instanceof Ast.Pair pair) {
                pending.push(pair.left());
                pending.push(pair.right());
            }
        }
        return new LineRange(min, max);
    }
}
