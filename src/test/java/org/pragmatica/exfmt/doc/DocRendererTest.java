package org.pragmatica.exfmt.doc;

import org.junit.jupiter.api.Test;
import org.pragmatica.exfmt.doc.Doc.GroupMode;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.pragmatica.exfmt.doc.Docs.collapseLines;
import static org.pragmatica.exfmt.doc.Docs.color;
import static org.pragmatica.exfmt.doc.Docs.concat;
import static org.pragmatica.exfmt.doc.Docs.flexGlue;
import static org.pragmatica.exfmt.doc.Docs.forceUnfit;
import static org.pragmatica.exfmt.doc.Docs.glue;
import static org.pragmatica.exfmt.doc.Docs.group;
import static org.pragmatica.exfmt.doc.Docs.hardLine;
import static org.pragmatica.exfmt.doc.Docs.nest;
import static org.pragmatica.exfmt.doc.Docs.noLimit;
import static org.pragmatica.exfmt.doc.Docs.softBreak;
import static org.pragmatica.exfmt.doc.Docs.text;

class DocRendererTest {

    // === Groups ===

    @Test
    void group_whenContentFits_rendersFlat() {
        var doc = group(glue(text("a"), text("b")));

        assertThat(DocRenderer.render(doc, 10)).isEqualTo("a b");
    }

    @Test
    void group_whenContentTooWide_breaksEveryStrictBreak() {
        var doc = group(glue(glue(text("aa"), text("bb")), text("cc")));

        assertThat(DocRenderer.render(doc, 4)).isEqualTo("aa\nbb\ncc");
    }

    @Test
    void group_measuresOnlyItsOwnContent() {
        // The trailing text does not take part in the decision
        var doc = concat(group(glue(text("a"), text("b"))), text("-tail"));

        assertThat(DocRenderer.render(doc, 3)).isEqualTo("a b-tail");
    }

    @Test
    void nest_indentsLinesOfBrokenGroup() {
        var doc = group(concat(text("["), nest(concat(softBreak(""), text("a")), 2), softBreak(""), text("]")));

        assertThat(DocRenderer.render(doc, 1)).isEqualTo("[\n  a\n]");
        assertThat(DocRenderer.render(doc, 10)).isEqualTo("[a]");
    }

    @Test
    void forceUnfit_breaksEvenWhenContentFits() {
        var doc = group(forceUnfit(glue(text("a"), text("b"))));

        assertThat(DocRenderer.render(doc, 80)).isEqualTo("a\nb");
    }

    @Test
    void optimisticGroup_fitsWhenTextUpToFirstBreakFits() {
        var list = group(concat(text("["), nest(concat(softBreak(""), text("aaaa")), 2), softBreak(""), text("]")),
                         GroupMode.OPTIMISTIC);
        var doc = group(concat(text("call("), list, text(")")));

        assertThat(DocRenderer.render(doc, 8)).isEqualTo("call([\n  aaaa\n])");
    }

    // === Flex breaks ===

    @Test
    void flexBreak_breaksOnlyWhereNeeded() {
        var doc = flexGlue(flexGlue(text("aa"), text("bb")), text("cc"));

        assertThat(DocRenderer.render(doc, 5)).isEqualTo("aa bb\ncc");
    }

    // === Newlines ===

    @Test
    void render_neverEndsWithNewline() {
        var doc = concat(text("a"), hardLine());

        assertThat(DocRenderer.render(doc, 80)).isEqualTo("a");
    }

    @Test
    void blankLines_carryNoIndentation() {
        var doc = nest(concat(text("a"), hardLine(), hardLine(), text("b")), 2);

        assertThat(DocRenderer.render(doc, 80)).isEqualTo("a\n\n  b");
    }

    @Test
    void collapseLines_capsFollowingNewlines() {
        var doc = concat(text("a"), collapseLines(2), concat(hardLine(), hardLine(), hardLine()), text("b"));

        assertThat(DocRenderer.render(doc, 80)).isEqualTo("a\n\nb");
    }

    // === Width ===

    @Test
    void width_isMeasuredInCodePoints() {
        var doc = group(glue(text("日本"), text("x")));

        assertThat(DocRenderer.render(doc, 4)).isEqualTo("日本 x");
    }

    @Test
    void breakText_isMeasuredInCodePoints() {
        var clef = "\uD834\uDD1E";
        var doc = concat(group(concat(text("a"), concat(softBreak(clef + clef), text("b")))),
                         group(glue(text("c"), text("d"))));

        assertThat(DocRenderer.render(doc, 8)).isEqualTo("a" + clef + clef + "bc d");
    }

    @Test
    void noLimit_rendersFlatRegardlessOfWidth() {
        var doc = noLimit(group(glue(text("aaaa"), text("bbbb"))));

        assertThat(DocRenderer.render(doc, 3)).isEqualTo("aaaa bbbb");
    }

    @Test
    void render_negativeWidth_isRejected() {
        assertThatThrownBy(() -> DocRenderer.render(text("a"), -1))
            .isInstanceOf(IllegalArgumentException.class);
    }

    // === Decorations ===

    @Test
    void color_isWrittenByRenderAndDroppedByRenderPlain() {
        var doc = color(text("x"), "<", ">");

        assertThat(DocRenderer.render(doc, 80)).isEqualTo("<x>");
        assertThat(DocRenderer.renderPlain(doc)).isEqualTo("x");
    }

    @Test
    void color_doesNotTakeColumns() {
        var doc = group(glue(color(text("ab"), "\u001b[31m", "\u001b[0m"), text("c")));

        assertThat(DocRenderer.render(doc, 4)).isEqualTo("\u001b[31mab\u001b[0m c");
    }
}
