package org.pragmatica.exfmt.comment;

import org.junit.jupiter.api.Test;
import org.pragmatica.exfmt.ast.Ast;
import org.pragmatica.exfmt.ast.Asts;
import org.pragmatica.exfmt.ast.Ast.Call;
import org.pragmatica.exfmt.ast.Ast.Variable;
import org.pragmatica.exfmt.ast.Meta;
import org.pragmatica.exfmt.comment.CommentInterleaver.Entry;
import org.pragmatica.exfmt.doc.DocRenderer;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pragmatica.exfmt.doc.Docs.empty;
import static org.pragmatica.exfmt.doc.Docs.text;

class CommentInterleaverTest {

    private static CommentInterleaver interleaver(Comment... comments) {
        return new CommentInterleaver(CommentQueue.of(CommentNormalizer.gather(List.of(comments))));
    }

    private static Entry format(Ast ast, List<Ast> rest) {
        return Entry.of(text(((Variable) ast).name()));
    }

    @Test
    void interleave_withoutComments_formatsEveryItem() {
        var result = interleaver().interleave(List.of(Asts.var("a", 1), Asts.var("b", 2)), List.of(),
                                              LineRange.MIN_LINE, LineRange.MAX_LINE,
                                              LineRange::of, CommentInterleaverTest::format);

        assertThat(result.hasComments()).isFalse();
        assertThat(result.docs()).extracting(DocRenderer::renderPlain).containsExactly("a", "b");
    }

    @Test
    void interleave_commentBetweenItems_isPlacedBetweenThem() {
        var result = interleaver(Comment.of(2, "# note"))
            .interleave(List.of(Asts.var("a", 1), Asts.var("b", 3)), List.of(),
                        LineRange.MIN_LINE, LineRange.MAX_LINE,
                        LineRange::of, CommentInterleaverTest::format);

        assertThat(result.hasComments()).isTrue();
        assertThat(result.docs()).extracting(DocRenderer::renderPlain).containsExactly("a", "# note", "b");
    }

    @Test
    void interleave_commentBeforeClosingLine_goesAtTheEnd() {
        var result = interleaver(Comment.of(3, "# last"))
            .interleave(List.of(Asts.var("a", 1), Asts.var("b", 2)), List.of(),
                        LineRange.MIN_LINE, 5,
                        LineRange::of, CommentInterleaverTest::format);

        assertThat(result.docs()).extracting(DocRenderer::renderPlain).containsExactly("a", "b", "# last");
    }

    @Test
    void interleave_commentsOutsideRange_areLeftForTheEnclosingSequence() {
        var interleaver = interleaver(Comment.of(1, "# before"), Comment.of(9, "# after"));
        var result = interleaver.interleave(List.of(Asts.var("a", 3)), List.of(),
                                            2, 5,
                                            LineRange::of, CommentInterleaverTest::format);

        assertThat(result.hasComments()).isFalse();
        assertThat(interleaver.comments()).extracting(GatheredComment::line).containsExactly(1, 9);
    }

    @Test
    void interleave_itemsWithoutLines_leaveCommentsToTheEnd() {
        var result = interleaver(Comment.of(3, "# end"))
            .interleave(List.of(Asts.var("a"), Asts.var("b")), List.of(),
                        LineRange.MIN_LINE, LineRange.MAX_LINE,
                        LineRange::of, CommentInterleaverTest::format);

        assertThat(result.hasComments()).isTrue();
        assertThat(result.docs()).extracting(DocRenderer::renderPlain).containsExactly("a", "b", "# end");
    }

    @Test
    void interleave_nestedSequence_takesTheCommentsInsideIt() {
        var interleaver = interleaver(Comment.of(3, "# three"), Comment.of(6, "# six"));
        var inner = Asts.call("group", Meta.atLine(1), Asts.var("x", 2), Asts.var("y", 4));

        CommentInterleaver.EntryFunction<Ast> outerFormat = (ast, rest) -> {
            if (!(ast instanceof Call call)) {
                return format(ast, rest);
            }
            var nested = interleaver.interleave(call.args(), List.of(), 1, 5,
                                                LineRange::of, CommentInterleaverTest::format);
            var joined = nested.docs().stream().map(DocRenderer::renderPlain).collect(Collectors.joining("|"));
            return Entry.of(text(joined));
        };

        var result = interleaver.interleave(List.of(inner, Asts.var("b", 7)), List.of(),
                                            LineRange.MIN_LINE, LineRange.MAX_LINE,
                                            LineRange::of, outerFormat);

        assertThat(result.docs()).extracting(DocRenderer::renderPlain).containsExactly("x|# three|y", "# six", "b");
        assertThat(interleaver.comments().isEmpty()).isTrue();
    }

    @Test
    void extractBefore_returnsTheCommentsLeftAfterTheLine() {
        var queue = CommentQueue.of(CommentNormalizer.gather(List.of(new Comment(2, "# x", 2, 1),
                                                                     Comment.of(6, "# y"))));
        var entries = new ArrayList<Entry>(List.of(Entry.of(text("a"))));

        var step = CommentInterleaver.extractBefore(queue, 5, entries);

        assertThat(step.value()).isTrue();
        assertThat(step.comments()).extracting(GatheredComment::line).containsExactly(6);
        assertThat(entries).hasSize(2);
        assertThat(entries.get(0).newlines()).isEqualTo(2);
    }

    @Test
    void adjustTrailingNewlines_commentRightBelow_dropsTheBlankLine() {
        var queue = CommentQueue.of(CommentNormalizer.gather(List.of(Comment.of(4, "# x"))));
        var entry = new Entry(text("a"), empty(), 2);

        assertThat(CommentInterleaver.adjustTrailingNewlines(entry, 3, queue).newlines()).isEqualTo(1);
        assertThat(CommentInterleaver.adjustTrailingNewlines(entry, 2, queue).newlines()).isEqualTo(2);
        assertThat(CommentInterleaver.adjustTrailingNewlines(entry.withNewlines(1), 3, queue).newlines()).isEqualTo(1);
    }

    @Test
    void anyBetween_andFirstLineAfter_lookAtPendingComments() {
        var interleaver = interleaver(Comment.of(4, "# x"));

        assertThat(interleaver.anyBetween(1, 5)).isTrue();
        assertThat(interleaver.anyBetween(4, 5)).isFalse();
        assertThat(interleaver.firstLineAfter(2)).isEqualTo(4);
        assertThat(interleaver.firstLineAfter(4)).isGreaterThan(LineRange.MAX_LINE);
    }
}
