package org.pragmatica.exfmt.doc;

import com.google.common.base.Strings;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;

/**
 * Renders a {@link Doc} into text within a column budget.
 *
 * <p>The renderer walks the document once, using an explicit frame stack instead of recursion,
 * so arbitrarily deep documents render within the default thread stack. Each group decides
 * whether it fits when the renderer reaches it, by measuring its own content flat from the
 * current column. Flex breaks decide on their own by measuring what follows them up to the
 * next line break.
 *
 * <p>Newlines are written lazily: indentation is only emitted in front of text, blank lines
 * carry no trailing whitespace and the output never ends with newlines.
 */
public final class DocRenderer {
    public static final int UNLIMITED = Integer.MAX_VALUE;

    private final StringBuilder out = new StringBuilder();
    private final StringBuilder pendingDecorations = new StringBuilder();
    private final boolean decorate;

    private int width;
    private int column;
    private int pendingNewlines;
    private int pendingIndent;
    private int collapseMax;

    private DocRenderer(int width, boolean decorate) {
        this.width = width;
        this.decorate = decorate;
    }

    /**
     * Render the document with decorations, breaking groups that do not fit in {@code width} columns.
     */
    public static String render(Doc doc, int width) {
        if (width < 0) {
            throw new IllegalArgumentException("Width must not be negative: " + width);
        }
        return new DocRenderer(width, true).run(doc);
    }

    /**
     * Render the document at unlimited width without decorations.
     * Only forced breaks and hard lines produce newlines.
     */
    public static String renderPlain(Doc doc) {
        return new DocRenderer(UNLIMITED, false).run(doc);
    }

    // === Frames ===

    private enum Mode {
        FLAT,
        BREAK,
        // Measuring only: flat, and optimistic groups inside must fit completely
        FLAT_NO_BREAK,
        // Measuring only: content fits once its first break is reached
        BREAK_NO_FLAT
    }

    private sealed interface Frame {}

    private record Render(int indent, Mode mode, Doc doc) implements Frame {}

    private record Decoration(String text) implements Frame {}

    private record RestoreWidth(int width) implements Frame {}

    // === Rendering ===

    private String run(Doc doc) {
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Render(0, Mode.BREAK, doc));

        while (!stack.isEmpty()) {
            var frame = stack.pop();

            if (frame instanceof Decoration decoration) {
                writeDecoration(decoration.text());
                continue;
            }
            if (frame instanceof RestoreWidth restore) {
                width = restore.width();
                continue;
            }

            var render = (Render) frame;
            var indent = render.indent();
            var mode = render.mode();
            var current = render.doc();

            if (current instanceof Doc.Text text) {
                writeText(text.text(), text.width());
            } else if (current instanceof Doc.Concat concat) {
                stack.push(new Render(indent, mode, concat.right()));
                stack.push(new Render(indent, mode, concat.left()));
            } else if (current instanceof Doc.Line) {
                newline(indent);
            } else if (current instanceof Doc.Break brk) {
                renderBreak(stack, indent, mode, brk);
            } else if (current instanceof Doc.Nest nest) {
                stack.push(new Render(nestedIndent(nest, indent, column, mode), mode, nest.doc()));
            } else if (current instanceof Doc.Group group) {
                stack.push(new Render(indent, groupMode(group, indent, mode), group.doc()));
            } else if (current instanceof Doc.ForceUnfit force) {
                stack.push(new Render(indent, Mode.BREAK, force.doc()));
            } else if (current instanceof Doc.CollapseLines collapse) {
                collapseMax = collapse.max();
            } else if (current instanceof Doc.NoLimit noLimit) {
                if (width == UNLIMITED) {
                    stack.push(new Render(indent, mode, noLimit.doc()));
                } else {
                    stack.push(new RestoreWidth(width));
                    width = UNLIMITED;
                    stack.push(new Render(indent, Mode.FLAT, noLimit.doc()));
                }
            } else if (current instanceof Doc.Color color) {
                if (decorate) {
                    writeDecoration(color.open());
                    stack.push(new Decoration(color.close()));
                }
                stack.push(new Render(indent, mode, color.doc()));
            }
        }

        out.append(pendingDecorations);
        return out.toString();
    }

    private void renderBreak(Deque<Frame> stack, int indent, Mode mode, Doc.Break brk) {
        var breakWidth = brk.text().codePointCount(0, brk.text().length());

        if (brk.mode() == Doc.BreakMode.STRICT) {
            if (mode == Mode.BREAK) {
                newline(indent);
            } else {
                writeText(brk.text(), breakWidth);
            }
            return;
        }

        if (width == UNLIMITED || mode == Mode.FLAT
            || fits(width, column + breakWidth, new ArrayDeque<>(), stack.iterator())) {
            writeText(brk.text(), breakWidth);
        } else {
            newline(indent);
        }
    }

    private Mode groupMode(Doc.Group group, int indent, Mode mode) {
        if (mode == Mode.FLAT && group.mode() != Doc.GroupMode.OPTIMISTIC) {
            return Mode.FLAT;
        }

        Deque<Frame> content = new ArrayDeque<>();
        content.push(new Render(indent, Mode.FLAT, group.doc()));

        return fits(width, column, content, Collections.emptyIterator()) ? Mode.FLAT : Mode.BREAK;
    }

    private static int nestedIndent(Doc.Nest nest, int indent, int column, Mode mode) {
        var applies = nest.mode() == Doc.NestMode.ALWAYS || mode == Mode.BREAK || mode == Mode.BREAK_NO_FLAT;

        if (!applies) {
            return indent;
        }

        return switch (nest.indent().kind()) {
            case FIXED -> indent + nest.indent().amount();
            case CURSOR -> column;
            case RESET -> 0;
        };
    }

    // === Fitting ===

    /**
     * Check whether the frames in {@code local}, followed by the frames in {@code rest},
     * stay within {@code budget} columns until the next newline.
     */
    private static boolean fits(int budget, int start, Deque<Frame> local, Iterator<Frame> rest) {
        var limit = budget;
        var k = start;

        while (true) {
            if (k > limit) {
                return false;
            }

            Frame frame;
            if (!local.isEmpty()) {
                frame = local.pop();
            } else if (rest.hasNext()) {
                frame = rest.next();
            } else {
                return true;
            }

            if (frame instanceof RestoreWidth restore) {
                limit = restore.width();
                continue;
            }
            if (!(frame instanceof Render render)) {
                continue;
            }

            var indent = render.indent();
            var mode = render.mode();
            var doc = render.doc();
            var breaking = mode == Mode.BREAK || mode == Mode.BREAK_NO_FLAT;

            if (doc instanceof Doc.Text text) {
                k += text.width();
            } else if (doc instanceof Doc.Concat concat) {
                local.push(new Render(indent, mode, concat.right()));
                local.push(new Render(indent, mode, concat.left()));
            } else if (doc instanceof Doc.Line) {
                if (breaking) {
                    return true;
                }
                k = indent;
            } else if (doc instanceof Doc.Break brk) {
                if (breaking) {
                    return true;
                }
                k += brk.text().codePointCount(0, brk.text().length());
            } else if (doc instanceof Doc.Nest nest) {
                local.push(new Render(nestedIndent(nest, indent, k, mode), mode, nest.doc()));
            } else if (doc instanceof Doc.Group group) {
                local.push(new Render(indent, measuringMode(group.mode(), mode), group.doc()));
            } else if (doc instanceof Doc.ForceUnfit force) {
                if (!breaking) {
                    return false;
                }
                local.push(new Render(indent, mode, force.doc()));
            } else if (doc instanceof Doc.NoLimit noLimit) {
                local.push(new RestoreWidth(limit));
                limit = UNLIMITED;
                local.push(new Render(indent, mode, noLimit.doc()));
            } else if (doc instanceof Doc.Color color) {
                local.push(new Render(indent, mode, color.doc()));
            }
        }
    }

    private static Mode measuringMode(Doc.GroupMode groupMode, Mode mode) {
        return switch (groupMode) {
            case NORMAL -> mode == Mode.FLAT_NO_BREAK || mode == Mode.BREAK_NO_FLAT ? mode : Mode.FLAT;
            case OPTIMISTIC -> mode == Mode.FLAT_NO_BREAK ? Mode.FLAT_NO_BREAK : Mode.BREAK_NO_FLAT;
            case PESSIMISTIC -> mode == Mode.BREAK_NO_FLAT ? Mode.BREAK_NO_FLAT : Mode.FLAT_NO_BREAK;
        };
    }

    // === Output ===

    private void newline(int indent) {
        pendingNewlines++;
        pendingIndent = indent;
        column = indent;
    }

    private void writeText(String text, int textWidth) {
        if (text.isEmpty()) {
            return;
        }
        if (pendingNewlines > 0) {
            var newlines = collapseMax > 0 ? Math.min(pendingNewlines, collapseMax) : pendingNewlines;
            out.append(Strings.repeat("\n", newlines))
               .append(Strings.repeat(" ", pendingIndent))
               .append(pendingDecorations);
            pendingDecorations.setLength(0);
            pendingNewlines = 0;
        }
        collapseMax = 0;
        out.append(text);
        column += textWidth;
    }

    private void writeDecoration(String text) {
        if (pendingNewlines > 0) {
            pendingDecorations.append(text);
        } else {
            out.append(text);
        }
    }
}
