package org.pragmatica.exfmt.literal;

import com.google.common.base.Splitter;
import org.pragmatica.exfmt.doc.Doc;

import java.util.ArrayList;
import java.util.List;

import static org.pragmatica.exfmt.doc.Docs.concat;
import static org.pragmatica.exfmt.doc.Docs.hardLine;
import static org.pragmatica.exfmt.doc.Docs.nest;
import static org.pragmatica.exfmt.doc.Docs.text;

/**
 * Escaping of string, charlist and heredoc contents.
 *
 * <p>Contents are kept as written (escape sequences are not interpreted), only occurrences
 * of the closing delimiter are escaped. Newlines inside the content become hard lines
 * reset to column zero, so the content is not shifted by the surrounding indentation.
 */
public final class StringEscapes {
    private static final Splitter LINES = Splitter.on('\n');
    private static final int HEREDOC_DELIMITER_LENGTH = 3;

    private StringEscapes() {}

    /**
     * Escape the content of a single-line delimited literal.
     */
    public static Doc escapeString(String content, String delimiter) {
        var escaped = content.replace(delimiter, "\\" + delimiter);

        if (delimiter.length() == HEREDOC_DELIMITER_LENGTH) {
            return heredocToDoc(LINES.splitToList(escaped));
        }

        var lines = LINES.splitToList(escaped);
        var doc = text(lines.get(lines.size() - 1));

        for (int i = lines.size() - 2; i >= 0; i--) {
            doc = concat(text(lines.get(i)), concat(resetLine(), doc));
        }
        return doc;
    }

    /**
     * Escape the content of a heredoc. The content starts on the line after the opening delimiter.
     */
    public static Doc escapeHeredoc(String content, String delimiter) {
        var escaped = content.replace(delimiter, "\\" + delimiter);
        var lines = new ArrayList<String>();

        lines.add("");
        lines.addAll(LINES.splitToList(escaped));
        return heredocToDoc(lines);
    }

    /**
     * Join heredoc lines. Empty lines are not indented.
     */
    public static Doc heredocToDoc(List<String> lines) {
        var last = lines.size() - 1;
        var doc = text(lines.get(last));

        for (int i = last - 1; i >= 0; i--) {
            var separator = heredocLine(lines, i + 1);
            var line = lines.get(i);

            doc = line.isEmpty()
                  ? concat(separator, doc)
                  : concat(text(line), separator, doc);
        }
        return doc;
    }

    private static Doc heredocLine(List<String> lines, int next) {
        var blank = lines.get(next).isEmpty() || lines.get(next).equals("\r");

        if (blank && next + 1 < lines.size()) {
            return resetLine();
        }
        return hardLine();
    }

    private static Doc resetLine() {
        return nest(hardLine(), Doc.Indent.RESET);
    }
}
