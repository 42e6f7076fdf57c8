package org.pragmatica.exfmt.literal;

import org.junit.jupiter.api.Test;
import org.pragmatica.exfmt.doc.DocRenderer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pragmatica.exfmt.doc.Docs.concat;
import static org.pragmatica.exfmt.doc.Docs.nest;
import static org.pragmatica.exfmt.doc.Docs.text;

class StringEscapesTest {

    @Test
    void escapeString_escapesOnlyTheClosingDelimiter() {
        var doc = StringEscapes.escapeString("say \"hi\" it's \\n", "\"");

        assertThat(DocRenderer.renderPlain(doc)).isEqualTo("say \\\"hi\\\" it's \\n");
    }

    @Test
    void escapeString_newlinesStayAtColumnZero() {
        var doc = nest(concat(text("x = \""), StringEscapes.escapeString("a\nb", "\""), text("\"")), 4);

        assertThat(DocRenderer.renderPlain(doc)).isEqualTo("x = \"a\nb\"");
    }

    @Test
    void escapeHeredoc_startsOnNextLineAndEscapesDelimiter() {
        var doc = concat(text("\"\"\""), StringEscapes.escapeHeredoc("a\n\"\"\"\n", "\"\"\""), text("\"\"\""));

        assertThat(DocRenderer.renderPlain(doc)).isEqualTo("\"\"\"\na\n\\\"\"\"\n\"\"\"");
    }

    @Test
    void escapeHeredoc_indentedContent_blankLinesNotIndented() {
        var heredoc = concat(text("\"\"\""), StringEscapes.escapeHeredoc("a\n\nb\n", "\"\"\""), text("\"\"\""));
        var doc = nest(concat(text("x ="), nest(heredoc, 2)), 2);

        assertThat(DocRenderer.renderPlain(doc)).isEqualTo("x =\"\"\"\n    a\n\n    b\n    \"\"\"");
    }
}
